package dev.jobboard.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the acting user may not perform the operation.
 */
public class ForbiddenException extends JobBoardException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
