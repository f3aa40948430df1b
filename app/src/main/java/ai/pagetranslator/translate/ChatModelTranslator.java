package ai.pagetranslator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelTranslator.class);
    private static final String FENCE = "```";

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        if (text == null || text.isBlank()) {
            return "";
        }
        try {
            String response = model.chat(buildPrompt(text, sourceLanguage, targetLanguage));
            if (response == null || response.isBlank()) {
                LOGGER.warn("{} returned an empty translation; keeping source text", providerName);
                return text;
            }
            return stripCodeFence(response.strip());
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TranslationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("LangChain translation failed", ex);
        }
    }

    private String buildPrompt(String text, String sourceLanguage, String targetLanguage) {
        return """
Translate the page text below from %s into %s.
Rules:
- The text is one page of a document with its line breaks removed. Translate it as continuous prose.
- Translate everything; do not summarize, drop or reorder sentences.
- Keep numbers, URLs, e-mail addresses and product names unchanged.
- Output only the translated text. Do not wrap the result in code fences and do not add commentary.

<text>
""".formatted(sourceLanguage, targetLanguage) + text + "\n</text>";
    }

    private String stripCodeFence(String response) {
        if (!response.startsWith(FENCE) || !response.endsWith(FENCE) || response.length() < 2 * FENCE.length()) {
            return response;
        }
        int firstLineEnd = response.indexOf('\n');
        if (firstLineEnd < 0) {
            return response;
        }
        return response.substring(firstLineEnd + 1, response.length() - FENCE.length()).strip();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
