package dev.jobboard.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when input fails a business validation rule.
 */
public class ValidationException extends JobBoardException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
