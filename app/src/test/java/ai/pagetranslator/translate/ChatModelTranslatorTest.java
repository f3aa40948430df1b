package ai.pagetranslator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelTranslatorTest {

    @Test
    @DisplayName("Sends the page text with both languages and returns the model's answer")
    void translatesPageText() {
        List<String> prompts = new ArrayList<>();
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                prompts.add(prompt);
                return "  Hallo Welt\n";
            }
        };
        ChatModelTranslator translator = new ChatModelTranslator(stubModel, "TestProvider", "test-model");

        String result = translator.translate("Hello world", "English", "German");

        assertThat(result).isEqualTo("Hallo Welt");
        assertThat(prompts).singleElement().satisfies(prompt -> assertThat(prompt)
                .contains("from English into German")
                .contains("continuous prose")
                .doesNotContain("number of lines")
                .contains("<text>\nHello world\n</text>"));
    }

    @Test
    void stripsSurroundingCodeFence() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return "```text\nBonjour\n```";
            }
        };

        assertThat(new ChatModelTranslator(stubModel, "Gemini", "models/test").translate("Hello", "en", "fr"))
                .isEqualTo("Bonjour");
    }

    @Test
    void skipsModelForBlankText() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new AssertionError("model must not be called");
            }
        };

        assertThat(new ChatModelTranslator(stubModel, "Ollama", "m").translate("  ", "en", "de")).isEmpty();
    }

    @Test
    void keepsSourceTextWhenModelAnswersNothing() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return " ";
            }
        };

        assertThat(new ChatModelTranslator(stubModel, "Ollama", "m").translate("Keep me", "en", "de"))
                .isEqualTo("Keep me");
    }

    @Test
    void reportsMissingModelByName() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new ModelNotFoundException("404 model not found");
            }
        };
        ChatModelTranslator translator = new ChatModelTranslator(stubModel, "OLLAMA", "llama-missing");

        assertThatThrownBy(() -> translator.translate("Hello", "en", "de"))
                .isInstanceOf(TranslationException.class)
                .hasMessage("OLLAMA model 'llama-missing' is not available.");
    }

    @Test
    void wrapsOtherFailures() {
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new IllegalStateException("connection refused");
            }
        };

        assertThatThrownBy(() -> new ChatModelTranslator(stubModel, "OLLAMA", "m").translate("Hello", "en", "de"))
                .isInstanceOf(TranslationException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }
}
