package de.mirkosertic.talentmatch.model;

/**
 * Raised when a proposer, reviewer pool or configuration is malformed.
 * <p>
 * Always detected before any scoring or matching starts. The orchestrator
 * converts it into a structured error response.
 */
public class InvalidSpecificationException extends IllegalArgumentException {

    public InvalidSpecificationException(final String message) {
        super(message);
    }
}
