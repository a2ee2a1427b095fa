package com.yieldbasket.staking.controller;

import com.yieldbasket.common.exception.AccumulatorOverflowException;
import com.yieldbasket.staking.exception.InvalidStakingRequestException;
import com.yieldbasket.staking.exception.StakeEntryNotFoundException;
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

    @ExceptionHandler(StakeEntryNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(StakeEntryNotFoundException ex) {
        return errorResponse("STAKE_ENTRY_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidStakingRequestException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleInvalid(InvalidStakingRequestException ex) {
        return errorResponse("INVALID_STAKING_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(AccumulatorOverflowException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleOverflow(AccumulatorOverflowException ex) {
        return errorResponse("ACCUMULATOR_OVERFLOW", ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(ServerWebInputException ex) {
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
