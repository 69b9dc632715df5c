package com.tony.winProbability.controller;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.exception.DatasetImportException;
import com.tony.winProbability.exception.LearnerTrainingException;
import com.tony.winProbability.exception.NumericalInstabilityException;
import com.tony.winProbability.exception.ReportNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({ConfigurationException.class, DatasetImportException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(RuntimeException ex) {
        log.warn("⚠️ Requête refusée : {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "invalid_configuration", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, "invalid_configuration", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        log.warn("⚠️ Corps de requête illisible : {}", cause.getMessage());
        return body(HttpStatus.BAD_REQUEST, "invalid_configuration", cause.getMessage());
    }

    @ExceptionHandler(LearnerTrainingException.class)
    public ResponseEntity<Map<String, Object>> handleTraining(LearnerTrainingException ex) {
        log.error("❌ Run interrompu : {}", ex.getMessage(), ex);
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.UNPROCESSABLE_ENTITY, "learner_failure", ex.getMessage());
        response.getBody().put("learner", ex.getLearnerName());
        response.getBody().put("fold", ex.getFold());
        return response;
    }

    @ExceptionHandler(NumericalInstabilityException.class)
    public ResponseEntity<Map<String, Object>> handleNumerical(NumericalInstabilityException ex) {
        log.error("❌ Instabilité numérique : {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "numerical_instability", ex.getMessage());
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoReport(ReportNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "no_report", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", code);
        body.put("message", message == null ? "" : message);
        body.put("timestamp", Instant.now().toEpochMilli());
        return ResponseEntity.status(status).body(body);
    }
}
