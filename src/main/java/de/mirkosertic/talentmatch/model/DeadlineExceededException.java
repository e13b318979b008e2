package de.mirkosertic.talentmatch.model;

/**
 * Raised when the run deadline passes while similarities are still outstanding.
 * The orchestrator answers it by switching to rule-only ranking.
 */
public class DeadlineExceededException extends RuntimeException {

    public DeadlineExceededException(final String message) {
        super(message);
    }
}
