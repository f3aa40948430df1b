package ai.pagetranslator.pipeline;

/**
 * Stages of the per-page pipeline in execution order.
 */
public enum PageStage {
    EXTRACT_TEXT,
    EXTRACT_FRAGMENTS,
    EXTRACT_PARAGRAPHS,
    TRANSLATE_PAGE,
    BUILD_REQUEST,
    ALIGN,
    REINTEGRATE
}
