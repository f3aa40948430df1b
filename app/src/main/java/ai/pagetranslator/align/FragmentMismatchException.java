package ai.pagetranslator.align;

import ai.pagetranslator.document.PageProcessingException;

/**
 * Raised when a model response cannot be matched onto the page's fragments: the counts differ, an index
 * is out of place, or the claimed original text differs from the extracted text.
 */
public class FragmentMismatchException extends PageProcessingException {

    private final int fragmentIndex;
    private final String expected;
    private final String claimed;

    public FragmentMismatchException(int pageNumber, int fragmentIndex, String expected, String claimed, String message) {
        super(pageNumber, message, null);
        this.fragmentIndex = fragmentIndex;
        this.expected = expected;
        this.claimed = claimed;
    }

    /**
     * Position of the first offending fragment, or {@code -1} for a count mismatch.
     */
    public int fragmentIndex() {
        return fragmentIndex;
    }

    public String expected() {
        return expected;
    }

    public String claimed() {
        return claimed;
    }
}
