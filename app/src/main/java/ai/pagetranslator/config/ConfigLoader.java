package ai.pagetranslator.config;

import ai.pagetranslator.align.AlignmentClient;
import ai.pagetranslator.align.LanguagePair;
import ai.pagetranslator.cli.CliArguments;
import ai.pagetranslator.diagnostics.BoxRenderer;
import ai.pagetranslator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SOURCE_LANG = "SOURCE_LANG";
    static final String ENV_TARGET_LANG = "TARGET_LANG";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_ALIGNMENT_MAX_RETRIES = "ALIGNMENT_MAX_RETRIES";
    static final String ENV_PAGE_PARALLELISM = "PAGE_PARALLELISM";
    static final String ENV_DIAGNOSTICS_DIR = "DIAGNOSTICS_DIR";
    static final String ENV_DIAGNOSTICS_BOX_WIDTH = "DIAGNOSTICS_BOX_WIDTH";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final int DEFAULT_PARALLELISM = 4;
    static final int DEFAULT_LLM_TIMEOUT_SECONDS = 120;
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path input = Optional.ofNullable(arguments.input())
                .orElseThrow(() -> new IllegalArgumentException("--input must be provided"));
        Path output = Optional.ofNullable(arguments.output())
                .orElseThrow(() -> new IllegalArgumentException("--output must be provided"));

        String sourceLanguage = firstNonBlank(arguments.sourceLanguage(), ENV_SOURCE_LANG, null);
        String targetLanguage = firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANG, null);
        if (sourceLanguage == null) {
            throw new IllegalArgumentException("source language must be provided via --source-lang or " + ENV_SOURCE_LANG);
        }
        if (targetLanguage == null) {
            throw new IllegalArgumentException("target language must be provided via --target-lang or " + ENV_TARGET_LANG);
        }
        LanguagePair languages = new LanguagePair(sourceLanguage, targetLanguage);

        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = env(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = env(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = provider == LlmProvider.OLLAMA
                ? Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL))
                : Optional.empty();
        int timeoutSeconds = env(ENV_LLM_TIMEOUT_SECONDS)
                .map(raw -> parseInteger(raw, ENV_LLM_TIMEOUT_SECONDS, 1))
                .orElse(DEFAULT_LLM_TIMEOUT_SECONDS);
        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl,
                Duration.ofSeconds(timeoutSeconds));

        Secrets secrets = new Secrets(env(ENV_GEMINI_API_KEY));
        if (translationMode == TranslationMode.PRODUCTION && provider == LlmProvider.GEMINI
                && secrets.geminiApiKey().isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini");
        }

        int parallelism = resolveInteger(arguments.parallelism(), "--parallelism", ENV_PAGE_PARALLELISM, 1,
                DEFAULT_PARALLELISM);
        int maxRetries = resolveInteger(arguments.maxRetries(), "--max-retries", ENV_ALIGNMENT_MAX_RETRIES, 0,
                AlignmentClient.DEFAULT_MAX_RETRIES);
        Optional<Path> diagnosticsDir = Optional.ofNullable(arguments.diagnosticsDir())
                .or(() -> env(ENV_DIAGNOSTICS_DIR).map(Path::of));
        int boxWidth = env(ENV_DIAGNOSTICS_BOX_WIDTH)
                .map(raw -> parseInteger(raw, ENV_DIAGNOSTICS_BOX_WIDTH, 1))
                .orElse(BoxRenderer.DEFAULT_WIDTH);

        return new Config(input, output, languages, translationMode, logFormat, translatorConfig, secrets,
                parallelism, maxRetries, diagnosticsDir, boxWidth);
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "gemini-1.5-pro";
            case OLLAMA -> "qwen2.5:14b-instruct";
        };
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveInteger(Integer cliValue, String optionName, String envKey, int minimum, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < minimum) {
                throw new IllegalArgumentException(optionName + " must be at least " + minimum);
            }
            return cliValue;
        }
        return env(envKey)
                .map(raw -> parseInteger(raw, envKey, minimum))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return env(envKey).orElse(defaultValue);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private static int parseInteger(String raw, String name, int minimum) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < minimum) {
                throw new IllegalArgumentException(name + " must be at least " + minimum);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
