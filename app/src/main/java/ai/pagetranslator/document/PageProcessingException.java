package ai.pagetranslator.document;

/**
 * Base type for failures that end the processing of a single page.
 */
public abstract class PageProcessingException extends RuntimeException {

    private final int pageNumber;

    protected PageProcessingException(int pageNumber, String message, Throwable cause) {
        super(message, cause);
        this.pageNumber = pageNumber;
    }

    public int pageNumber() {
        return pageNumber;
    }
}
