package ai.pagetranslator.align;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.pagetranslator.text.TextNormalizer;
import ai.pagetranslator.translate.MockTranslator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class MockChatBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LanguagePair languages = new LanguagePair("en", "de");

    @Test
    void answersWithWellFormedAlignment() throws Exception {
        MockChatBackend backend = new MockChatBackend(objectMapper, new MockTranslator(), languages);
        TranslationRequest request = new TranslationRequest(2, new PageContext("A", "B"),
                List.of(FragmentEntry.untranslated(0, "Title"), FragmentEntry.untranslated(1, "")));

        ChatReply reply = backend.chat(AlignmentPromptFormatter.initialPrompt(objectMapper.writeValueAsString(request), languages),
                ChatSession.empty());

        TranslationResponse response = new AlignmentResponseParser(objectMapper, new TextNormalizer()).parse(2, reply.text());
        assertThat(response.textFragments()).containsExactly(
                new FragmentEntry(0, "Title", "[MOCK] Title"),
                new FragmentEntry(1, "", ""));
        assertThat(reply.session().exchanges()).isEqualTo(1);
    }

    @Test
    void findsRequestInSessionForCorrectivePrompts() throws Exception {
        MockChatBackend backend = new MockChatBackend(objectMapper, new MockTranslator(), languages);
        TranslationRequest request = new TranslationRequest(1, new PageContext("A", "B"),
                List.of(FragmentEntry.untranslated(0, "Hi")));
        ChatReply first = backend.chat(AlignmentPromptFormatter.initialPrompt(objectMapper.writeValueAsString(request), languages),
                ChatSession.empty());

        ChatReply second = backend.chat(AlignmentPromptFormatter.correctivePrompt("reply is not valid JSON"), first.session());

        assertThat(second.text()).contains("[MOCK] Hi");
        assertThat(second.session().exchanges()).isEqualTo(2);
    }

    @Test
    void failsWithoutRequest() {
        MockChatBackend backend = new MockChatBackend(objectMapper, new MockTranslator(), languages);

        assertThatThrownBy(() -> backend.chat("hello?", ChatSession.empty()))
                .isInstanceOf(ChatBackendException.class)
                .satisfies(ex -> assertThat(((ChatBackendException) ex).retryable()).isFalse());
    }
}
