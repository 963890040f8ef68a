package com.ledgerbook.backup.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error raised by the HTTP layer with the status it should be answered with.
 */
@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status;

    public ApiException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public ApiException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
