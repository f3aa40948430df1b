package ai.pagetranslator.document;

import java.util.List;

/**
 * Single page of a {@link PagedDocument}. Fragment order is stable between calls.
 */
public interface DocumentPage {

    int number();

    String extractFullText();

    List<TextFragment> extractFragments();

    List<String> extractParagraphs();
}
