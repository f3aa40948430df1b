package ai.pagetranslator.cli;

import ai.pagetranslator.align.ChatBackend;
import ai.pagetranslator.align.ChatModelChatBackend;
import ai.pagetranslator.align.LanguagePair;
import ai.pagetranslator.align.MockChatBackend;
import ai.pagetranslator.config.Config;
import ai.pagetranslator.config.ConfigLoader;
import ai.pagetranslator.config.Secrets;
import ai.pagetranslator.config.SystemEnvironmentReader;
import ai.pagetranslator.config.TranslatorConfig;
import ai.pagetranslator.diagnostics.BoxedLogDiagnosticsSink;
import ai.pagetranslator.document.DocumentEngine;
import ai.pagetranslator.document.JsonDocumentEngine;
import ai.pagetranslator.document.PersistenceException;
import ai.pagetranslator.logging.LoggingConfigurator;
import ai.pagetranslator.pipeline.DocumentRunReport;
import ai.pagetranslator.pipeline.DocumentTranslationService;
import ai.pagetranslator.translate.ChatModelTranslator;
import ai.pagetranslator.translate.MockTranslator;
import ai.pagetranslator.translate.PassThroughTranslator;
import ai.pagetranslator.translate.TranslationMode;
import ai.pagetranslator.translate.Translator;
import ai.pagetranslator.translate.TranslatorFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_PAGES_FAILED = 2;

    private final ConfigLoader configLoader;
    private final DocumentEngine documentEngine;
    private final Function<Config, ChatModel> chatModelFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new JsonDocumentEngine(), CliApplication::createChatModel);
    }

    CliApplication(ConfigLoader configLoader, DocumentEngine documentEngine, Function<Config, ChatModel> chatModelFactory) {
        this.configLoader = configLoader;
        this.documentEngine = documentEngine;
        this.chatModelFactory = chatModelFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return EXIT_FATAL;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println("Invalid configuration: " + ex.getMessage());
            return EXIT_FATAL;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Translating {} -> {} ({} to {}, mode={}, parallelism={}, maxRetries={})",
                config.input(), config.output(), config.languages().source(), config.languages().target(),
                config.translationMode(), config.parallelism(), config.maxRetries());

        DocumentRunReport report;
        try {
            report = createTranslationService(config).translate(config.input(), config.output(),
                    config.languages().source(), config.languages().target());
        } catch (PersistenceException ex) {
            LOGGER.error("Document could not be processed: {}", ex.getMessage(), ex);
            return EXIT_FATAL;
        } catch (IllegalStateException ex) {
            LOGGER.error("Translation backend could not be initialized: {}", ex.getMessage(), ex);
            return EXIT_FATAL;
        }

        if (report.allSucceeded()) {
            return EXIT_OK;
        }
        LOGGER.warn("{} of {} pages kept their original text", report.failures().size(), report.outcomes().size());
        return EXIT_PAGES_FAILED;
    }

    DocumentTranslationService createTranslationService(Config config) {
        ObjectMapper objectMapper = new ObjectMapper();
        TranslationMode mode = config.translationMode();
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = mode.isOffline() ? null : chatModelFactory.apply(config);
        TranslatorFactory factory = new TranslatorFactory(
                () -> new ChatModelTranslator(chatModel, translatorConfig.provider().name(), translatorConfig.modelName()),
                new PassThroughTranslator(),
                new MockTranslator());
        Translator translator = factory.select(mode);

        Function<LanguagePair, ChatBackend> chatBackendFactory = mode.isOffline()
                ? languages -> new MockChatBackend(objectMapper, translator, languages)
                : languages -> new ChatModelChatBackend(chatModel, translatorConfig.provider().name());

        return new DocumentTranslationService(
                documentEngine,
                translator,
                chatBackendFactory,
                new BoxedLogDiagnosticsSink(config.diagnosticsDir(), config.boxWidth()),
                objectMapper,
                config.maxRetries(),
                config.parallelism());
    }

    static ChatModel createChatModel(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
