package ai.pagetranslator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.pagetranslator.cli.CliArguments;
import ai.pagetranslator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "in.json",
                "--output", "out.json",
                "--source-lang", "en",
                "--target-lang", "ja",
                "--translation-mode", "dry-run",
                "--parallelism", "8",
                "--max-retries", "0",
                "--diagnostics-dir", "diag",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.input()).isEqualTo(Path.of("in.json"));
        assertThat(config.output()).isEqualTo(Path.of("out.json"));
        assertThat(config.languages().source()).isEqualTo("en");
        assertThat(config.languages().target()).isEqualTo("ja");
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.parallelism()).isEqualTo(8);
        assertThat(config.maxRetries()).isZero();
        assertThat(config.diagnosticsDir()).contains(Path.of("diag"));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.translatorConfig().baseUrl()).contains("http://localhost:11434");
        assertThat(config.translatorConfig().timeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(config.boxWidth()).isEqualTo(80);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_SOURCE_LANG, "German");
        envValues.put(ConfigLoader.ENV_TARGET_LANG, "French");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "mock");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "custom-gguf");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_LLM_TIMEOUT_SECONDS, "30");
        envValues.put(ConfigLoader.ENV_ALIGNMENT_MAX_RETRIES, "5");
        envValues.put(ConfigLoader.ENV_PAGE_PARALLELISM, "2");
        envValues.put(ConfigLoader.ENV_DIAGNOSTICS_DIR, "/tmp/diag");
        envValues.put(ConfigLoader.ENV_DIAGNOSTICS_BOX_WIDTH, "100");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "a.json", "--output", "b.json");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.languages().source()).isEqualTo("German");
        assertThat(config.languages().target()).isEqualTo("French");
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.translatorConfig().modelName()).isEqualTo("custom-gguf");
        assertThat(config.translatorConfig().baseUrl()).contains("http://ollama:11434");
        assertThat(config.translatorConfig().timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.maxRetries()).isEqualTo(5);
        assertThat(config.parallelism()).isEqualTo(2);
        assertThat(config.diagnosticsDir()).contains(Path.of("/tmp/diag"));
        assertThat(config.boxWidth()).isEqualTo(100);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void cliValuesOverrideEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_SOURCE_LANG, "German",
                ConfigLoader.ENV_PAGE_PARALLELISM, "2");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "a.json", "--output", "b.json", "--source-lang", "en", "--target-lang", "de",
                "--parallelism", "6");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.languages().source()).isEqualTo("en");
        assertThat(config.parallelism()).isEqualTo(6);
    }

    @Test
    void requiresGeminiKeyOnlyForProductionRuns() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_LLM_PROVIDER, "gemini");
        CliArguments production = CommandLine.populateCommand(new CliArguments(),
                "--input", "a.json", "--output", "b.json", "--source-lang", "en", "--target-lang", "de");
        CliArguments mock = CommandLine.populateCommand(new CliArguments(),
                "--input", "a.json", "--output", "b.json", "--source-lang", "en", "--target-lang", "de",
                "--translation-mode", "mock");
        ConfigLoader loader = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)));

        Throwable missingKey = catchThrowable(() -> loader.load(production));
        Config mockConfig = loader.load(mock);
        envValues.put(ConfigLoader.ENV_GEMINI_API_KEY, "secret-key");
        Config productionConfig = loader.load(production);

        assertThat(missingKey).isInstanceOf(IllegalStateException.class).hasMessageContaining("GEMINI_API_KEY");
        assertThat(mockConfig.translatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(mockConfig.translatorConfig().baseUrl()).isEmpty();
        assertThat(productionConfig.secrets().geminiApiKey()).contains("secret-key");
        assertThat(productionConfig.secrets().toString()).doesNotContain("secret-key");
    }

    @Test
    void rejectsMissingOrInvalidValues() {
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        assertThat(catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(),
                "--output", "b.json", "--source-lang", "en", "--target-lang", "de"))))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--input");
        assertThat(catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(),
                "--input", "a.json", "--output", "b.json", "--source-lang", "en"))))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("target language");
        assertThat(catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(),
                "--input", "a.json", "--output", "b.json", "--source-lang", "en", "--target-lang", "de",
                "--parallelism", "0"))))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--parallelism");
        assertThat(catchThrowable(() -> loader.load(CommandLine.populateCommand(new CliArguments(),
                "--input", "a.json", "--output", "a.json", "--source-lang", "en", "--target-lang", "de"))))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("output");
    }

    @Test
    void rejectsNonNumericEnvironmentValues() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "a.json", "--output", "b.json", "--source-lang", "en", "--target-lang", "de");
        ConfigLoader loader = new ConfigLoader(key -> ConfigLoader.ENV_ALIGNMENT_MAX_RETRIES.equals(key)
                ? Optional.of("many") : Optional.empty());

        assertThat(catchThrowable(() -> loader.load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("ALIGNMENT_MAX_RETRIES must be an integer");
    }
}
