package ai.pagetranslator.diagnostics;

/**
 * Kinds of per-page audit artifacts and the file names they are stored under.
 */
public enum ArtifactKind {
    REQUEST("page_data_json_%d_data.json"),
    RESPONSE("translated_page_%d.json"),
    REJECTED_RESPONSE("translated_page_%d_rejected.txt");

    private final String fileNamePattern;

    ArtifactKind(String fileNamePattern) {
        this.fileNamePattern = fileNamePattern;
    }

    public String fileName(int pageNumber) {
        return fileNamePattern.formatted(pageNumber);
    }
}
