package ai.pagetranslator.diagnostics;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostics sink that logs each flushed group as a box and writes artifacts below an optional directory.
 * Without a directory, artifacts are only reported at debug level.
 */
public class BoxedLogDiagnosticsSink implements DiagnosticsSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoxedLogDiagnosticsSink.class);

    private final Map<String, List<String>> groups = new ConcurrentHashMap<>();
    private final BoxRenderer renderer;
    private final Optional<Path> artifactDirectory;

    public BoxedLogDiagnosticsSink(Optional<Path> artifactDirectory, int boxWidth) {
        this.artifactDirectory = Objects.requireNonNull(artifactDirectory, "artifactDirectory");
        this.renderer = new BoxRenderer(boxWidth);
    }

    @Override
    public void addMessage(String group, String message) {
        Objects.requireNonNull(group, "group");
        List<String> messages = groups.computeIfAbsent(group, key -> new ArrayList<>());
        synchronized (messages) {
            messages.add(message == null ? "" : message);
        }
    }

    @Override
    public void flushGroup(String group) {
        List<String> messages = groups.remove(group);
        if (messages == null) {
            LOGGER.warn("No diagnostic messages found for group: {}", group);
            return;
        }
        List<String> snapshot;
        synchronized (messages) {
            snapshot = List.copyOf(messages);
        }
        LOGGER.info("\n{}", renderer.render(group, snapshot));
    }

    @Override
    public void writeArtifact(int pageNumber, ArtifactKind kind, String content) {
        Objects.requireNonNull(kind, "kind");
        if (artifactDirectory.isEmpty()) {
            LOGGER.debug("Skipping artifact {} (no diagnostics directory configured)", kind.fileName(pageNumber));
            return;
        }
        Path target = artifactDirectory.get().resolve(kind.fileName(pageNumber));
        try {
            Files.createDirectories(artifactDirectory.get());
            Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            LOGGER.debug("Wrote diagnostic artifact {}", target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write diagnostic artifact: " + target, ex);
        }
    }

    List<String> pendingMessages(String group) {
        List<String> messages = groups.get(group);
        if (messages == null) {
            return List.of();
        }
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }
}
