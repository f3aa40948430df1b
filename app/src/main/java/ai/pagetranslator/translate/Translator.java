package ai.pagetranslator.translate;

/**
 * Whole-text translation backend. The result serves as page context for fragment alignment.
 */
public interface Translator {

    String translate(String text, String sourceLanguage, String targetLanguage);
}
