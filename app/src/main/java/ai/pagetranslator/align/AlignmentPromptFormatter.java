package ai.pagetranslator.align;

import java.util.Optional;

final class AlignmentPromptFormatter {

    static final String REQUEST_OPEN = "<request>";
    static final String REQUEST_CLOSE = "</request>";

    private AlignmentPromptFormatter() {
    }

    static String initialPrompt(String requestJson, LanguagePair languages) {
        return """
You are aligning a translated page with the text fragments of the original page.
The JSON below contains the page number, the whole page text in %1$s with its translation into %2$s \
(page_context), and the page's text fragments in reading order (text_fragments).
Rules:
- Fill in translated_text_fragment for every entry with the %2$s translation of original_text_fragment.
- Use page_context.translated as guidance so that the fragments read naturally when placed side by side.
- Copy index and original_text_fragment exactly as given. Never reorder, merge, split, add or drop entries.
- Keep empty fragments empty.
- Reply with the JSON object {"text_fragments": [...]} only. No commentary and no code fences.

""".formatted(languages.source(), languages.target()) + REQUEST_OPEN + "\n" + requestJson + "\n" + REQUEST_CLOSE;
    }

    static String correctivePrompt(String problem) {
        return "The structure is incomplete or wrong (" + problem + "). "
                + "Correct it and reply with the complete JSON object {\"text_fragments\": [...]} only, "
                + "keeping every entry of the original request in the same order.";
    }

    static Optional<String> extractRequestJson(String prompt) {
        if (prompt == null) {
            return Optional.empty();
        }
        int start = prompt.indexOf(REQUEST_OPEN);
        int end = prompt.lastIndexOf(REQUEST_CLOSE);
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(prompt.substring(start + REQUEST_OPEN.length(), end).strip());
    }
}
