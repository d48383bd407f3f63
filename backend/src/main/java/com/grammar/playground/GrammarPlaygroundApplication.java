package com.grammar.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrammarPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrammarPlaygroundApplication.class, args);
    }
}
