package ai.pagetranslator.align;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One fragment of a request or response. {@code index} is the fragment's extraction position;
 * it is always sent and optional in model responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"index", "original_text_fragment", "translated_text_fragment"})
public record FragmentEntry(
        @JsonProperty("index") Integer index,
        @JsonProperty("original_text_fragment") String originalTextFragment,
        @JsonProperty("translated_text_fragment") String translatedTextFragment) {

    public static FragmentEntry untranslated(int index, String originalText) {
        return new FragmentEntry(index, originalText, "");
    }
}
