package ai.pagetranslator.align;

/**
 * Conversational model endpoint used for fragment alignment.
 */
@FunctionalInterface
public interface ChatBackend {

    /**
     * @throws ChatBackendException if the backend cannot produce a reply
     */
    ChatReply chat(String prompt, ChatSession session);
}
