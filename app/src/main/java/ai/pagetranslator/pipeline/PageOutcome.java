package ai.pagetranslator.pipeline;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of running the pipeline for one page.
 */
public record PageOutcome(int pageNumber,
                          Optional<FailureKind> failureKind,
                          Optional<PageStage> failedStage,
                          String message,
                          int attempts,
                          int fragmentsReplaced,
                          Map<PageStage, Duration> stageTimings,
                          Optional<String> lastRawResponse) {

    public PageOutcome {
        failureKind = failureKind == null ? Optional.empty() : failureKind;
        failedStage = failedStage == null ? Optional.empty() : failedStage;
        message = Objects.requireNonNullElse(message, "");
        stageTimings = stageTimings == null || stageTimings.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(stageTimings));
        lastRawResponse = lastRawResponse == null ? Optional.empty() : lastRawResponse;
    }

    public static PageOutcome succeeded(int pageNumber, int attempts, int fragmentsReplaced, Map<PageStage, Duration> timings) {
        return new PageOutcome(pageNumber, Optional.empty(), Optional.empty(), "translated", attempts, fragmentsReplaced,
                timings, Optional.empty());
    }

    public static PageOutcome failed(int pageNumber, FailureKind kind, PageStage stage, String message, int attempts,
                                     Map<PageStage, Duration> timings, Optional<String> lastRawResponse) {
        return new PageOutcome(pageNumber, Optional.of(kind), Optional.ofNullable(stage), message, attempts, 0,
                timings, lastRawResponse);
    }

    public static PageOutcome unexpected(int pageNumber, Throwable error) {
        String message = error == null ? "unknown error" : error.getClass().getSimpleName() + ": " + error.getMessage();
        return new PageOutcome(pageNumber, Optional.of(FailureKind.UNEXPECTED), Optional.empty(), message, 0, 0,
                Map.of(), Optional.empty());
    }

    public boolean succeeded() {
        return failureKind.isEmpty();
    }

    public Duration totalTime() {
        return stageTimings.values().stream().reduce(Duration.ZERO, Duration::plus);
    }
}
