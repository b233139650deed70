package com.txlens.api.controller;

import lombok.Getter;

/**
 * Path or query input that fails validation outside bean validation.
 */
@Getter
public class InvalidRequestException extends RuntimeException {

    private final String errorCode;

    public InvalidRequestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
