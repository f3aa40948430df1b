package ai.pagetranslator.align;

import ai.pagetranslator.document.PageProcessingException;

/**
 * Raised when the chat backend fails with a non-retryable error during alignment.
 * Records how many attempts had been used, the failing one included.
 */
public class AlignmentBackendException extends PageProcessingException {

    private final int attempts;
    private final String lastRawResponse;

    public AlignmentBackendException(int pageNumber, int attempts, String lastRawResponse, ChatBackendException cause) {
        super(pageNumber, cause.getMessage(), cause);
        this.attempts = attempts;
        this.lastRawResponse = lastRawResponse;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Reply of the last attempt that got one, or {@code null} when the backend never answered.
     */
    public String lastRawResponse() {
        return lastRawResponse;
    }
}
