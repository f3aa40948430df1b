package ai.pagetranslator.document;

/**
 * Raised when a document cannot be opened or saved. Fatal to the whole run.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
