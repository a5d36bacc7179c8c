package dev.jobboard.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a referenced record does not exist.
 */
public class NotFoundException extends JobBoardException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }

    public static NotFoundException of(String what, Object id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
