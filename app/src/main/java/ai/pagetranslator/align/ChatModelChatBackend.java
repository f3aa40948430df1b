package ai.pagetranslator.align;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Chat backend backed by a LangChain4j {@link ChatModel}; the session carries the full message history.
 */
public class ChatModelChatBackend implements ChatBackend {

    private final ChatModel model;
    private final String providerName;

    public ChatModelChatBackend(ChatModel model, String providerName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = Objects.requireNonNull(providerName, "providerName");
    }

    @Override
    public ChatReply chat(String prompt, ChatSession session) {
        Objects.requireNonNull(session, "session");
        UserMessage userMessage = UserMessage.from(Objects.requireNonNull(prompt, "prompt"));
        List<ChatMessage> messages = new ArrayList<>(session.messages());
        messages.add(userMessage);
        ChatResponse response;
        try {
            response = model.chat(messages);
        } catch (RuntimeException ex) {
            boolean timeout = isTimeout(ex);
            throw new ChatBackendException("%s chat call failed%s: %s".formatted(providerName,
                    timeout ? " (timeout)" : "", ex.getMessage()), timeout, ex);
        }
        AiMessage aiMessage = response == null ? null : response.aiMessage();
        if (aiMessage == null) {
            throw new ChatBackendException(providerName + " returned no message", false, null);
        }
        String text = aiMessage.text() == null ? "" : aiMessage.text();
        return new ChatReply(text, session.append(userMessage, AiMessage.from(text)));
    }

    private static boolean isTimeout(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof TimeoutException
                    || cause instanceof SocketTimeoutException
                    || cause instanceof HttpTimeoutException
                    || cause instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
