package ai.pagetranslator.align;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Whole-page original and translated text sent to the model as context for fragment alignment.
 */
public record PageContext(
        @JsonProperty("original") String original,
        @JsonProperty("translated") String translated) {

    public PageContext {
        original = Objects.requireNonNullElse(original, "");
        translated = Objects.requireNonNullElse(translated, "");
    }
}
