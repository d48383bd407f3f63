package com.grammar.playground.dto;

import java.util.ArrayList;
import java.util.List;

public record BnfStep(int step, String rule) {

    public static List<BnfStep> numbered(List<String> rules) {
        List<BnfStep> steps = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            steps.add(new BnfStep(i + 1, rules.get(i)));
        }
        return steps;
    }
}
