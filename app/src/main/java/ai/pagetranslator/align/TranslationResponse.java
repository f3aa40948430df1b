package ai.pagetranslator.align;

import java.util.List;
import java.util.Objects;

/**
 * Validated fragment list returned by the chat model.
 */
public record TranslationResponse(List<FragmentEntry> textFragments) {

    public TranslationResponse {
        textFragments = List.copyOf(Objects.requireNonNull(textFragments, "textFragments"));
    }
}
