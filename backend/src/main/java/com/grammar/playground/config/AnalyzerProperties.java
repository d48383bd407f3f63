package com.grammar.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;

@ConfigurationProperties(prefix = "grammar.analyzer")
@Validated
public record AnalyzerProperties(
    @Positive
    @DefaultValue("10000")
    Integer maxExpressionLength,

    @DefaultValue("false")
    boolean traceEnabled,

    @NotEmpty
    @DefaultValue("*")
    List<String> allowedOrigins
) {
}
