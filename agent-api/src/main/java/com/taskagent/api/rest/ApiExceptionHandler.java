package com.taskagent.api.rest;

import com.taskagent.core.exception.AgentException;
import com.taskagent.core.exception.CheckpointNotFoundException;
import com.taskagent.core.exception.ConfigurationException;
import com.taskagent.core.exception.NoStateException;
import com.taskagent.core.exception.OracleCallException;
import com.taskagent.core.exception.UnknownToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps agent errors to HTTP responses carrying the error code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({NoStateException.class, CheckpointNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(AgentException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> unavailable(ConfigurationException e) {
        log.error("Agent is not configured to run tasks: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(OracleCallException.class)
    public ResponseEntity<ErrorResponse> badGateway(OracleCallException e) {
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(UnknownToolException.class)
    public ResponseEntity<ErrorResponse> unprocessable(UnknownToolException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<ErrorResponse> internal(AgentException e) {
        log.error("Request failed with {}", e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, AgentException e) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), Instant.now()));
    }

    public record ErrorResponse(String errorCode, String message, Instant timestamp) {}
}
