package ai.pagetranslator.cli;

import ai.pagetranslator.config.LogFormat;
import ai.pagetranslator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "page-translator", mixinStandardHelpOptions = true,
        description = "Translates a paged document while keeping its layout fragments in place")
public class CliArguments {

    @CommandLine.Option(names = "--input", description = "Document to translate", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = "--output", description = "Where the translated document is saved", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--source-lang", description = "Source language code", paramLabel = "LANG")
    private String sourceLanguage;

    @CommandLine.Option(names = "--target-lang", description = "Target language code", paramLabel = "LANG")
    private String targetLanguage;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--parallelism", description = "Number of pages processed concurrently", paramLabel = "COUNT")
    private Integer parallelism;

    @CommandLine.Option(names = "--max-retries", description = "Alignment retries after the first attempt", paramLabel = "COUNT")
    private Integer maxRetries;

    @CommandLine.Option(names = "--diagnostics-dir", description = "Directory for request and response artifacts", paramLabel = "DIR")
    private Path diagnosticsDir;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public String sourceLanguage() {
        return sourceLanguage;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public Integer parallelism() {
        return parallelism;
    }

    public Integer maxRetries() {
        return maxRetries;
    }

    public Path diagnosticsDir() {
        return diagnosticsDir;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
