package ai.pagetranslator.translate;

/**
 * Mock translator that marks every line so translated output is easy to spot.
 */
public class MockTranslator implements Translator {

    static final String PREFIX = "[MOCK] ";

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length() + 16);
        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }
            builder.append(lines[i].isEmpty() ? "" : PREFIX + lines[i]);
        }
        return builder.toString();
    }
}
