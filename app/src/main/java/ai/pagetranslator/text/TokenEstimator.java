package ai.pagetranslator.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rough token count based on words and punctuation marks. Used for log output only.
 */
public final class TokenEstimator {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_]+|[^\\p{L}\\p{N}_\\s]");

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        Matcher matcher = TOKEN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
