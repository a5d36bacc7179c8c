package dev.jobboard.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle stage of a job application.
 *
 * <p>The pipeline runs APPLIED, REVIEWED, INTERVIEW, OFFERED, ACCEPTED. A status may
 * only move forward; intermediate stages can be skipped but ACCEPTED is reachable
 * only from OFFERED. REJECTED can be reached from any open status. ACCEPTED and
 * REJECTED are terminal.
 */
public enum ApplicationStatus {
    APPLIED(0),
    REVIEWED(1),
    INTERVIEW(2),
    OFFERED(3),
    ACCEPTED(4),
    REJECTED(-1);

    private final int stage;

    ApplicationStatus(int stage) {
        this.stage = stage;
    }

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED;
    }

    public boolean canTransitionTo(ApplicationStatus target) {
        if (target == null || isTerminal() || target == this) {
            return false;
        }
        if (target == REJECTED) {
            return true;
        }
        if (target == ACCEPTED) {
            return this == OFFERED;
        }
        return target.stage > stage;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApplicationStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ApplicationStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown application status: " + value);
    }
}
