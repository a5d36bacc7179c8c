package dev.jobboard.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a request clashes with existing state (duplicates, illegal status moves).
 */
public class ConflictException extends JobBoardException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
