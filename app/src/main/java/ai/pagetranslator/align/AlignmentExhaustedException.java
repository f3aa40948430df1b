package ai.pagetranslator.align;

import ai.pagetranslator.document.PageProcessingException;

/**
 * Raised when every alignment attempt for a page produced an unusable reply.
 * Carries the last raw reply verbatim for operator diagnosis.
 */
public class AlignmentExhaustedException extends PageProcessingException {

    private final int attempts;
    private final String lastRawResponse;

    public AlignmentExhaustedException(int pageNumber, int attempts, String lastRawResponse, Throwable lastFailure) {
        super(pageNumber, "alignment failed after %d attempts: %s".formatted(attempts,
                lastFailure == null ? "no valid reply" : lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
        this.lastRawResponse = lastRawResponse;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Last reply text as received, or {@code null} when the backend never answered.
     */
    public String lastRawResponse() {
        return lastRawResponse;
    }
}
