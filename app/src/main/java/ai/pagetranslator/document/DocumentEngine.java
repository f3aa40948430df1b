package ai.pagetranslator.document;

import java.nio.file.Path;

/**
 * Parses a document into pages of positioned text fragments.
 */
@FunctionalInterface
public interface DocumentEngine {

    PagedDocument open(Path source);
}
