package ai.pagetranslator.document;

/**
 * Raised when the document engine cannot produce text, fragments or paragraphs for a page.
 */
public class ExtractionException extends PageProcessingException {

    public ExtractionException(int pageNumber, String message, Throwable cause) {
        super(pageNumber, message, cause);
    }

    public ExtractionException(int pageNumber, String message) {
        this(pageNumber, message, null);
    }
}
