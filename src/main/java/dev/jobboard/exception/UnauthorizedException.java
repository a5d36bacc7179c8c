package dev.jobboard.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the caller cannot be identified or credentials are wrong.
 */
public class UnauthorizedException extends JobBoardException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
