package com.yieldbasket.settlement.controller;

import com.yieldbasket.common.exception.CycleInProgressException;
import com.yieldbasket.settlement.exception.BridgeJobNotFoundException;
import com.yieldbasket.settlement.exception.InvalidJobStateException;
import com.yieldbasket.settlement.exception.TransferRejectedException;
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

    @ExceptionHandler(BridgeJobNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(BridgeJobNotFoundException ex) {
        return errorResponse("BRIDGE_JOB_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidJobStateException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleInvalidState(InvalidJobStateException ex) {
        return errorResponse("INVALID_JOB_STATE", ex.getMessage());
    }

    @ExceptionHandler(TransferRejectedException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleRejected(TransferRejectedException ex) {
        log.warn("Bridge transfer rejected. reason={}", ex.getMessage());
        return errorResponse("TRANSFER_REJECTED", ex.getMessage());
    }

    @ExceptionHandler(CycleInProgressException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleInProgress(CycleInProgressException ex) {
        return errorResponse("OPERATION_IN_PROGRESS", ex.getMessage());
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
        return errorResponse("INTERNAL_ERROR", ex.getMessage());
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
