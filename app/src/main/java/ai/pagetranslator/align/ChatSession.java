package ai.pagetranslator.align;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable conversation handle threading the attempts for one page through a single exchange history.
 */
public final class ChatSession {

    private static final ChatSession EMPTY = new ChatSession(List.of());

    private final List<ChatMessage> messages;

    private ChatSession(List<ChatMessage> messages) {
        this.messages = List.copyOf(messages);
    }

    public static ChatSession empty() {
        return EMPTY;
    }

    public ChatSession append(UserMessage prompt, AiMessage reply) {
        List<ChatMessage> extended = new ArrayList<>(messages.size() + 2);
        extended.addAll(messages);
        extended.add(Objects.requireNonNull(prompt, "prompt"));
        extended.add(Objects.requireNonNull(reply, "reply"));
        return new ChatSession(extended);
    }

    public List<ChatMessage> messages() {
        return messages;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Number of completed prompt/reply exchanges.
     */
    public int exchanges() {
        return messages.size() / 2;
    }

    @Override
    public String toString() {
        return "ChatSession[exchanges=" + exchanges() + "]";
    }
}
