package ai.pagetranslator.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans extracted page text so that fragments compare reliably across extraction,
 * request building and reintegration.
 *
 * <p>{@link #normalize(String)} is idempotent: normalizing already normalized text returns it unchanged.
 */
public class TextNormalizer {

    private static final Pattern NOISE = Pattern.compile("[\\p{Cc}&&[^\\t\\n\\r]]|[\\u00AD\\u200B-\\u200D\\u2060\\uFEFF\\uFFFD]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\p{javaWhitespace}\\u00A0\\u2007\\u202F]+");
    private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String withoutNoise = NOISE.matcher(raw).replaceAll("");
        return WHITESPACE.matcher(withoutNoise).replaceAll(" ").strip();
    }

    /**
     * Decodes literal {@code \\uXXXX} sequences that chat backends sometimes return instead of the
     * characters themselves. Sequences that would produce a quote, a backslash or a control character
     * stay escaped so the surrounding JSON remains parseable.
     */
    public String decodeUnicodeEscapes(String raw) {
        if (raw == null || raw.indexOf("\\u") < 0) {
            return raw;
        }
        Matcher matcher = UNICODE_ESCAPE.matcher(raw);
        StringBuilder decoded = new StringBuilder(raw.length());
        while (matcher.find()) {
            if (isEscapedBackslash(raw, matcher.start())) {
                matcher.appendReplacement(decoded, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            char ch = (char) Integer.parseInt(matcher.group(1), 16);
            String replacement = isStructural(ch) ? matcher.group() : String.valueOf(ch);
            matcher.appendReplacement(decoded, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(decoded);
        return decoded.toString();
    }

    private static boolean isEscapedBackslash(String raw, int backslashIndex) {
        int preceding = 0;
        for (int i = backslashIndex - 1; i >= 0 && raw.charAt(i) == '\\'; i--) {
            preceding++;
        }
        return preceding % 2 == 1;
    }

    private static boolean isStructural(char ch) {
        return ch < 0x20 || ch == '"' || ch == '\\';
    }
}
