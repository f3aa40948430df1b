package ai.pagetranslator.align;

import java.util.Objects;

/**
 * Raw model output together with the session to continue the conversation with.
 */
public record ChatReply(String text, ChatSession session) {

    public ChatReply {
        text = Objects.requireNonNullElse(text, "");
        Objects.requireNonNull(session, "session");
    }
}
