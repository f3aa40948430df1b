package ai.pagetranslator.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BoxedLogDiagnosticsSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void groupsMessagesUntilFlushed() {
        BoxedLogDiagnosticsSink sink = new BoxedLogDiagnosticsSink(Optional.empty(), 80);
        String group = DiagnosticsSink.pageGroup(2);

        sink.addMessage(group, "first");
        sink.addMessage(group, "second");
        sink.addMessage(DiagnosticsSink.pageGroup(3), "other page");

        assertThat(group).isEqualTo("page-2");
        assertThat(sink.pendingMessages(group)).containsExactly("first", "second");

        sink.flushGroup(group);

        assertThat(sink.pendingMessages(group)).isEmpty();
        assertThat(sink.pendingMessages("page-3")).containsExactly("other page");
    }

    @Test
    void flushingUnknownGroupIsHarmless() {
        BoxedLogDiagnosticsSink sink = new BoxedLogDiagnosticsSink(Optional.empty(), 80);

        sink.flushGroup("page-99");

        assertThat(sink.pendingMessages("page-99")).isEmpty();
    }

    @Test
    void writesArtifactsUnderConfiguredDirectory() throws IOException {
        Path directory = tempDir.resolve("diagnostics");
        BoxedLogDiagnosticsSink sink = new BoxedLogDiagnosticsSink(Optional.of(directory), 80);

        sink.writeArtifact(4, ArtifactKind.REQUEST, "{\"page_number\":4}");
        sink.writeArtifact(4, ArtifactKind.REJECTED_RESPONSE, "not json at all");

        assertThat(Files.readString(directory.resolve("page_data_json_4_data.json"))).isEqualTo("{\"page_number\":4}");
        assertThat(Files.readString(directory.resolve("translated_page_4_rejected.txt"))).isEqualTo("not json at all");
    }

    @Test
    void dropsArtifactsWithoutDirectory() throws IOException {
        BoxedLogDiagnosticsSink sink = new BoxedLogDiagnosticsSink(Optional.empty(), 80);

        sink.writeArtifact(1, ArtifactKind.RESPONSE, "{}");

        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }
}
