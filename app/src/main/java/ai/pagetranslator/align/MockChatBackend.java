package ai.pagetranslator.align;

import ai.pagetranslator.translate.Translator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Offline chat backend for dry-run and mock modes. Answers with a well-formed alignment whose
 * translations come from the given {@link Translator}, so the whole pipeline runs without a model.
 */
public class MockChatBackend implements ChatBackend {

    private final ObjectMapper objectMapper;
    private final Translator fragmentTranslator;
    private final LanguagePair languages;

    public MockChatBackend(ObjectMapper objectMapper, Translator fragmentTranslator, LanguagePair languages) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.fragmentTranslator = Objects.requireNonNull(fragmentTranslator, "fragmentTranslator");
        this.languages = Objects.requireNonNull(languages, "languages");
    }

    @Override
    public ChatReply chat(String prompt, ChatSession session) {
        String requestJson = AlignmentPromptFormatter.extractRequestJson(prompt)
                .or(() -> firstRequestIn(session))
                .orElseThrow(() -> new ChatBackendException("mock backend received no translation request", false, null));
        String reply = answer(requestJson);
        return new ChatReply(reply, session.append(UserMessage.from(prompt), AiMessage.from(reply)));
    }

    private String answer(String requestJson) {
        try {
            TranslationRequest request = objectMapper.readValue(requestJson, TranslationRequest.class);
            List<FragmentEntry> entries = new ArrayList<>(request.textFragments().size());
            for (FragmentEntry entry : request.textFragments()) {
                String original = entry.originalTextFragment();
                String translated = original.isEmpty()
                        ? ""
                        : fragmentTranslator.translate(original, languages.source(), languages.target());
                entries.add(new FragmentEntry(entry.index(), original, translated));
            }
            return objectMapper.writeValueAsString(Map.of(AlignmentResponseParser.TEXT_FRAGMENTS, entries));
        } catch (JsonProcessingException ex) {
            throw new ChatBackendException("mock backend could not read the request: " + ex.getOriginalMessage(), false, ex);
        }
    }

    private static Optional<String> firstRequestIn(ChatSession session) {
        for (ChatMessage message : session.messages()) {
            if (message instanceof UserMessage userMessage && userMessage.hasSingleText()) {
                Optional<String> found = AlignmentPromptFormatter.extractRequestJson(userMessage.singleText());
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }
}
