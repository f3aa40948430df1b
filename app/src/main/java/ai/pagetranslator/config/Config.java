package ai.pagetranslator.config;

import ai.pagetranslator.align.LanguagePair;
import ai.pagetranslator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path input,
        Path output,
        LanguagePair languages,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        int parallelism,
        int maxRetries,
        Optional<Path> diagnosticsDir,
        int boxWidth
) {

    public Config {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(languages, "languages");
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        diagnosticsDir = diagnosticsDir == null ? Optional.empty() : diagnosticsDir;
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("output must differ from input");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be zero or greater");
        }
        if (boxWidth < 1) {
            throw new IllegalArgumentException("boxWidth must be positive");
        }
    }
}
