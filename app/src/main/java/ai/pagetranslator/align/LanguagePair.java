package ai.pagetranslator.align;

/**
 * Source and target language of a run, as free-form codes or names understood by the model.
 */
public record LanguagePair(String source, String target) {

    public LanguagePair {
        source = requireNonBlank(source, "source");
        target = requireNonBlank(target, "target");
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " language must not be blank");
        }
        return value.trim();
    }
}
