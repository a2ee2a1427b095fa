package com.yieldbasket.orchestrator.controller;

import com.yieldbasket.common.exception.CycleInProgressException;
import com.yieldbasket.common.exception.DecisionNotRecordedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body: {@code {"error_code": "...", "message": "...", "timestamp": "..."}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CycleInProgressException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleCycleInProgress(CycleInProgressException ex) {
        return errorResponse("CYCLE_IN_PROGRESS", ex.getMessage());
    }

    @ExceptionHandler(DecisionNotRecordedException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleNotRecorded(DecisionNotRecordedException ex) {
        log.error("Decision not recorded. decisionId={}", ex.getDecisionId(), ex);
        return errorResponse("DECISION_NOT_RECORDED", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception ex) {
        return errorResponse("BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "cycle failed: " + ex.getMessage());
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
