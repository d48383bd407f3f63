package com.grammar.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalysisRequest(
    @NotBlank(message = "Missing or empty 'expression' field in request body")
    @Size(max = 10_000, message = "Expression cannot exceed 10,000 characters")
    String expression
) {

    public String sanitizedExpression() {
        if (expression == null) {
            return "";
        }

        return expression
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n")
            .trim();
    }
}
