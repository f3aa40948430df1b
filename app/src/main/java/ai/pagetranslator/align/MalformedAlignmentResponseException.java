package ai.pagetranslator.align;

import ai.pagetranslator.document.PageProcessingException;

/**
 * Raised when a chat reply cannot be used as a fragment alignment. Absorbed by the retry loop
 * until the attempt budget is spent.
 */
public class MalformedAlignmentResponseException extends PageProcessingException {

    public enum Reason {
        NOT_JSON("reply is not valid JSON"),
        MISSING_FRAGMENTS("reply has no text_fragments list"),
        INVALID_ENTRY("text_fragments contains an invalid entry");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public MalformedAlignmentResponseException(int pageNumber, Reason reason, String detail, Throwable cause) {
        super(pageNumber, detail == null || detail.isBlank() ? reason.description() : reason.description() + ": " + detail, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
