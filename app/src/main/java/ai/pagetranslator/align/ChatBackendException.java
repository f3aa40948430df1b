package ai.pagetranslator.align;

/**
 * Failure of the chat backend itself, as opposed to a malformed reply.
 * Retryable failures (timeouts) consume one alignment attempt; others end the page.
 */
public class ChatBackendException extends RuntimeException {

    private final boolean retryable;

    public ChatBackendException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
