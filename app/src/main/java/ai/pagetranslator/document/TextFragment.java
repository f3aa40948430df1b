package ai.pagetranslator.document;

/**
 * Engine-owned run of positioned text. Only the text may be changed through this view;
 * layout attributes stay with the engine.
 */
public interface TextFragment {

    String text();

    void replaceText(String text);
}
