package dev.jobboard.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for domain failures that map to a specific HTTP status.
 */
@Getter
public abstract class JobBoardException extends RuntimeException {

    private final HttpStatus status;

    protected JobBoardException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }
}
