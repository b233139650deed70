package com.txlens.api.controller;

import com.txlens.analysis.UnsupportedNetworkException;
import com.txlens.api.dto.ErrorBody;
import com.txlens.pipeline.ToolExecutionException;
import com.txlens.rpc.RpcException;
import com.txlens.rpc.TransactionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Maps failures to {@link ErrorBody}: validation and unsupported network 400, unknown transaction 404,
 * tool and RPC failures 502, anything else 500.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorBody> handleInvalidRequest(InvalidRequestException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(UnsupportedNetworkException.class)
    public ResponseEntity<ErrorBody> handleUnsupportedNetwork(UnsupportedNetworkException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("UNSUPPORTED_NETWORK", ex.getMessage()));
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(TransactionNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("TRANSACTION_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(ToolExecutionException.class)
    public ResponseEntity<ErrorBody> handleToolFailure(ToolExecutionException ex) {
        log.warn("Analysis failed in tool {}: {}", ex.getToolName(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("TOOL_FAILED", ex.getMessage()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleRpc(RpcException ex) {
        log.warn("RPC failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("RPC_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorBody> handleStatus(ResponseStatusException ex) {
        String message = ex.getReason() != null ? ex.getReason() : ex.getMessage();
        return ResponseEntity.status(ex.getStatusCode()).body(ErrorBody.of("REQUEST_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleUnexpected(Exception ex) {
        log.error("Unhandled API error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of("INTERNAL_ERROR", "Unexpected server error"));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_TX_HASH" -> "Invalid transaction hash format";
            case "INVALID_NETWORK" -> "Network ID is not supported";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
