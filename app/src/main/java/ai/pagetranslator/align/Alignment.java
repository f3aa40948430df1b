package ai.pagetranslator.align;

import java.util.Objects;

/**
 * Successful alignment of one page with the number of chat attempts it took.
 */
public record Alignment(TranslationResponse response, int attempts, ChatSession session) {

    public Alignment {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(session, "session");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
    }
}
