package ai.pagetranslator.diagnostics;

/**
 * Collects labeled diagnostic messages per group and stores audit artifacts per page.
 * Implementations must accept calls from concurrently running page tasks.
 */
public interface DiagnosticsSink {

    void addMessage(String group, String message);

    /**
     * Emits all messages collected for {@code group} as one block and forgets them.
     */
    void flushGroup(String group);

    void writeArtifact(int pageNumber, ArtifactKind kind, String content);

    static String pageGroup(int pageNumber) {
        return "page-" + pageNumber;
    }
}
