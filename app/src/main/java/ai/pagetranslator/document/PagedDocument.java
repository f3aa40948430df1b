package ai.pagetranslator.document;

import java.nio.file.Path;

/**
 * Document opened by a {@link DocumentEngine}. Pages are numbered from 1.
 */
public interface PagedDocument {

    int pageCount();

    /**
     * @param number 1-based page number
     */
    DocumentPage page(int number);

    void save(Path target);
}
