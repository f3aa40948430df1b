package ai.pagetranslator.pipeline;

import ai.pagetranslator.align.AlignmentClient;
import ai.pagetranslator.align.AlignmentResponseParser;
import ai.pagetranslator.align.ChatBackend;
import ai.pagetranslator.align.FragmentReintegrator;
import ai.pagetranslator.align.LanguagePair;
import ai.pagetranslator.align.TranslationRequestBuilder;
import ai.pagetranslator.diagnostics.DiagnosticsSink;
import ai.pagetranslator.document.DocumentEngine;
import ai.pagetranslator.document.PagedDocument;
import ai.pagetranslator.text.TextNormalizer;
import ai.pagetranslator.translate.Translator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Programmatic entry point: opens a document, translates all of its pages and saves the result.
 */
public class DocumentTranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTranslationService.class);

    private final DocumentEngine engine;
    private final Translator translator;
    private final Function<LanguagePair, ChatBackend> chatBackendFactory;
    private final DiagnosticsSink diagnostics;
    private final ObjectMapper objectMapper;
    private final TextNormalizer normalizer;
    private final int maxRetries;
    private final int parallelism;

    public DocumentTranslationService(DocumentEngine engine,
                                      Translator translator,
                                      Function<LanguagePair, ChatBackend> chatBackendFactory,
                                      DiagnosticsSink diagnostics,
                                      ObjectMapper objectMapper,
                                      int maxRetries,
                                      int parallelism) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.chatBackendFactory = Objects.requireNonNull(chatBackendFactory, "chatBackendFactory");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.normalizer = new TextNormalizer();
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be zero or greater");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.maxRetries = maxRetries;
        this.parallelism = parallelism;
    }

    /**
     * @throws ai.pagetranslator.document.PersistenceException if the input cannot be read or the output cannot be written
     */
    public DocumentRunReport translate(Path input, Path output, String sourceLanguage, String targetLanguage) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        LanguagePair languages = new LanguagePair(sourceLanguage, targetLanguage);
        LOGGER.info("Translating {} from {} to {} into {}", input, languages.source(), languages.target(), output);

        PagedDocument document = engine.open(input);
        return createScheduler(languages).process(document, output);
    }

    PageScheduler createScheduler(LanguagePair languages) {
        AlignmentClient alignmentClient = new AlignmentClient(
                chatBackendFactory.apply(languages),
                new AlignmentResponseParser(objectMapper, normalizer),
                objectMapper,
                diagnostics,
                languages,
                maxRetries);
        PagePipeline pipeline = new PagePipeline(
                translator,
                normalizer,
                new TranslationRequestBuilder(objectMapper, diagnostics),
                alignmentClient,
                new FragmentReintegrator(normalizer),
                diagnostics,
                languages);
        return new PageScheduler(pipeline, parallelism);
    }
}
