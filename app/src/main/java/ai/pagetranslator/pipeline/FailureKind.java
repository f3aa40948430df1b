package ai.pagetranslator.pipeline;

/**
 * Terminal failure categories of a page.
 */
public enum FailureKind {
    EXTRACTION,
    TRANSLATION,
    CHAT_BACKEND,
    ALIGNMENT_EXHAUSTED,
    FRAGMENT_MISMATCH,
    UNEXPECTED
}
