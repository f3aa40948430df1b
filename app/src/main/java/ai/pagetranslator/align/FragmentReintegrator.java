package ai.pagetranslator.align;

import ai.pagetranslator.document.TextFragment;
import ai.pagetranslator.text.TextNormalizer;
import java.util.List;
import java.util.Objects;

/**
 * Writes translated fragment texts back onto the page's fragments by position.
 * Every pair is checked before the first fragment is changed, so a rejected page stays untouched.
 * The claimed original must equal the normalized fragment text exactly.
 */
public class FragmentReintegrator {

    private final TextNormalizer normalizer;

    public FragmentReintegrator(TextNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * @return number of fragments whose text was replaced
     * @throws FragmentMismatchException if any pair does not line up
     */
    public int reintegrate(int pageNumber, List<TextFragment> originals, List<FragmentEntry> translated) {
        Objects.requireNonNull(originals, "originals");
        Objects.requireNonNull(translated, "translated");
        if (originals.size() != translated.size()) {
            throw new FragmentMismatchException(pageNumber, -1,
                    String.valueOf(originals.size()), String.valueOf(translated.size()),
                    "response has %d fragments but page has %d".formatted(translated.size(), originals.size()));
        }

        for (int i = 0; i < originals.size(); i++) {
            FragmentEntry entry = translated.get(i);
            if (entry.index() != null && entry.index() != i) {
                throw new FragmentMismatchException(pageNumber, i, String.valueOf(i), String.valueOf(entry.index()),
                        "fragment at position %d claims index %d".formatted(i, entry.index()));
            }
            String expected = normalizer.normalize(originals.get(i).text());
            String claimed = entry.originalTextFragment();
            if (!expected.equals(claimed)) {
                throw new FragmentMismatchException(pageNumber, i, expected, claimed,
                        "fragment %d original text mismatch: expected '%s' but response claims '%s'"
                                .formatted(i, expected, claimed));
            }
        }

        for (int i = 0; i < originals.size(); i++) {
            originals.get(i).replaceText(Objects.requireNonNullElse(translated.get(i).translatedTextFragment(), ""));
        }
        return originals.size();
    }
}
