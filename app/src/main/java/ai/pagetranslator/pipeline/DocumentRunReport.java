package ai.pagetranslator.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of translating a whole document: one {@link PageOutcome} per page, in page order.
 */
public record DocumentRunReport(Path output, List<PageOutcome> outcomes, Duration elapsed) {

    public DocumentRunReport {
        Objects.requireNonNull(output, "output");
        outcomes = Objects.requireNonNull(outcomes, "outcomes").stream()
                .sorted(Comparator.comparingInt(PageOutcome::pageNumber))
                .collect(Collectors.toUnmodifiableList());
        elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
    }

    public List<PageOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.succeeded()).collect(Collectors.toUnmodifiableList());
    }

    public int succeededPages() {
        return outcomes.size() - failures().size();
    }

    public boolean allSucceeded() {
        return failures().isEmpty();
    }

    public String errorSummary() {
        List<PageOutcome> failures = failures();
        if (failures.isEmpty()) {
            return "all " + outcomes.size() + " pages translated";
        }
        return failures.size() + " of " + outcomes.size() + " pages failed: " + failures.stream()
                .map(outcome -> "page %d %s%s: %s".formatted(outcome.pageNumber(),
                        outcome.failureKind().map(Enum::name).orElse("?"),
                        outcome.failedStage().map(stage -> " at " + stage).orElse(""),
                        outcome.message()))
                .collect(Collectors.joining("; "));
    }
}
