package ai.pagetranslator.translate;

/**
 * Translator used for dry-run scenarios that preserves the original text without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        return text == null ? "" : text;
    }
}
