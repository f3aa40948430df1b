package ai.pagetranslator.align;

import ai.pagetranslator.align.MalformedAlignmentResponseException.Reason;
import ai.pagetranslator.text.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an untrusted chat reply into a {@link TranslationResponse}. Checks run in a fixed order:
 * JSON syntax, presence of {@code text_fragments}, then the shape of each entry.
 */
public class AlignmentResponseParser {

    static final String TEXT_FRAGMENTS = "text_fragments";
    static final String INDEX = "index";
    static final String ORIGINAL = "original_text_fragment";
    static final String TRANSLATED = "translated_text_fragment";

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*\\R(.*)\\R\\s*```$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final TextNormalizer normalizer;

    public AlignmentResponseParser(ObjectMapper objectMapper, TextNormalizer normalizer) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * @throws MalformedAlignmentResponseException if the reply fails any check
     */
    public TranslationResponse parse(int pageNumber, String rawReply) {
        String candidate = unwrap(normalizer.decodeUnicodeEscapes(Objects.requireNonNullElse(rawReply, "")));
        JsonNode root;
        try {
            root = objectMapper.readTree(candidate);
        } catch (JsonProcessingException ex) {
            throw new MalformedAlignmentResponseException(pageNumber, Reason.NOT_JSON, ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new MalformedAlignmentResponseException(pageNumber, Reason.NOT_JSON, "expected a JSON object", null);
        }
        JsonNode fragments = root.get(TEXT_FRAGMENTS);
        if (fragments == null || !fragments.isArray()) {
            throw new MalformedAlignmentResponseException(pageNumber, Reason.MISSING_FRAGMENTS, null, null);
        }
        List<FragmentEntry> entries = new ArrayList<>(fragments.size());
        for (int i = 0; i < fragments.size(); i++) {
            entries.add(toEntry(pageNumber, i, fragments.get(i)));
        }
        return new TranslationResponse(entries);
    }

    private FragmentEntry toEntry(int pageNumber, int position, JsonNode node) {
        if (!node.isObject()) {
            throw invalidEntry(pageNumber, position, "not an object");
        }
        JsonNode original = node.get(ORIGINAL);
        JsonNode translated = node.get(TRANSLATED);
        if (original == null || !original.isTextual()) {
            throw invalidEntry(pageNumber, position, ORIGINAL + " is missing or not a string");
        }
        if (translated == null || !translated.isTextual()) {
            throw invalidEntry(pageNumber, position, TRANSLATED + " is missing or not a string");
        }
        Integer index = null;
        JsonNode indexNode = node.get(INDEX);
        if (indexNode != null && !indexNode.isNull()) {
            if (!indexNode.canConvertToInt() || !indexNode.isIntegralNumber()) {
                throw invalidEntry(pageNumber, position, INDEX + " is not an integer");
            }
            index = indexNode.intValue();
        }
        return new FragmentEntry(index, original.textValue(), translated.textValue());
    }

    private static MalformedAlignmentResponseException invalidEntry(int pageNumber, int position, String detail) {
        return new MalformedAlignmentResponseException(pageNumber, Reason.INVALID_ENTRY,
                "entry " + position + " " + detail, null);
    }

    private static String unwrap(String reply) {
        String trimmed = reply.strip();
        Matcher matcher = CODE_FENCE.matcher(trimmed);
        return matcher.matches() ? matcher.group(1).strip() : trimmed;
    }
}
