package ai.pagetranslator.align;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Structure sent to the chat model for one page. Fragment order matches extraction order.
 */
@JsonPropertyOrder({"page_number", "page_context", "text_fragments"})
public record TranslationRequest(
        @JsonProperty("page_number") int pageNumber,
        @JsonProperty("page_context") PageContext pageContext,
        @JsonProperty("text_fragments") List<FragmentEntry> textFragments) {

    public TranslationRequest {
        Objects.requireNonNull(pageContext, "pageContext");
        textFragments = List.copyOf(Objects.requireNonNull(textFragments, "textFragments"));
    }
}
