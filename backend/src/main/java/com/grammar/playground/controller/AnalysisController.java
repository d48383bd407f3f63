package com.grammar.playground.controller;

import com.grammar.playground.dto.AnalysisRequest;
import com.grammar.playground.dto.AnalysisResponse;
import com.grammar.playground.service.GrammarAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/analysis")
@Validated
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);

    private final GrammarAnalysisService analysisService;

    public AnalysisController(GrammarAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/parse")
    public ResponseEntity<AnalysisResponse> parse(@Valid @RequestBody AnalysisRequest request) {
        logger.debug("Received analysis request for {} characters", request.expression().length());

        try {
            AnalysisResponse response = analysisService.analyze(request);

            if ("invalid_request".equals(response.resultType())) {
                logger.warn("Rejected analysis request: {}", response.error());
                return ResponseEntity.badRequest().body(response);
            }

            logger.debug("Analysis completed: status={}, type={}", response.status(), response.resultType());
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during analysis", e);
            return ResponseEntity.internalServerError()
                .body(AnalysisResponse.internalError(request.expression(), "Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Grammar analysis service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AnalysisResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);
        return ResponseEntity.badRequest().body(AnalysisResponse.invalidRequest(null, errorMessage.toString()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AnalysisResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(AnalysisResponse.invalidRequest(null, "Invalid JSON in request body"));
    }
}
