package ai.pagetranslator.pipeline;

import ai.pagetranslator.align.Alignment;
import ai.pagetranslator.align.AlignmentBackendException;
import ai.pagetranslator.align.AlignmentClient;
import ai.pagetranslator.align.AlignmentExhaustedException;
import ai.pagetranslator.align.FragmentMismatchException;
import ai.pagetranslator.align.FragmentReintegrator;
import ai.pagetranslator.align.LanguagePair;
import ai.pagetranslator.align.TranslationRequest;
import ai.pagetranslator.align.TranslationRequestBuilder;
import ai.pagetranslator.diagnostics.DiagnosticsSink;
import ai.pagetranslator.document.DocumentPage;
import ai.pagetranslator.document.ExtractionException;
import ai.pagetranslator.document.TextFragment;
import ai.pagetranslator.text.TextNormalizer;
import ai.pagetranslator.translate.TranslationException;
import ai.pagetranslator.translate.Translator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the fixed stage sequence for one page: extraction, whole-page translation, request building,
 * alignment and reintegration. Only alignment retries; any other failure ends the page.
 */
public class PagePipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(PagePipeline.class);
    static final String MDC_PAGE = "page";

    private final Translator translator;
    private final TextNormalizer normalizer;
    private final TranslationRequestBuilder requestBuilder;
    private final AlignmentClient alignmentClient;
    private final FragmentReintegrator reintegrator;
    private final DiagnosticsSink diagnostics;
    private final LanguagePair languages;

    public PagePipeline(Translator translator,
                        TextNormalizer normalizer,
                        TranslationRequestBuilder requestBuilder,
                        AlignmentClient alignmentClient,
                        FragmentReintegrator reintegrator,
                        DiagnosticsSink diagnostics,
                        LanguagePair languages) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.requestBuilder = Objects.requireNonNull(requestBuilder, "requestBuilder");
        this.alignmentClient = Objects.requireNonNull(alignmentClient, "alignmentClient");
        this.reintegrator = Objects.requireNonNull(reintegrator, "reintegrator");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.languages = Objects.requireNonNull(languages, "languages");
    }

    public PageOutcome run(DocumentPage page) {
        Objects.requireNonNull(page, "page");
        int pageNumber = page.number();
        String group = DiagnosticsSink.pageGroup(pageNumber);
        StageClock clock = new StageClock();
        int attempts = 0;
        MDC.put(MDC_PAGE, String.valueOf(pageNumber));
        try {
            String fullText = clock.time(PageStage.EXTRACT_TEXT,
                    () -> normalizer.normalize(extract(pageNumber, "full text", page::extractFullText)));
            List<TextFragment> fragments = clock.time(PageStage.EXTRACT_FRAGMENTS,
                    () -> extract(pageNumber, "fragments", page::extractFragments));
            List<String> fragmentTexts = clock.time(PageStage.EXTRACT_FRAGMENTS,
                    () -> extract(pageNumber, "fragment texts", () -> detach(fragments)));
            int paragraphCount = clock.time(PageStage.EXTRACT_PARAGRAPHS,
                    () -> extract(pageNumber, "paragraphs", page::extractParagraphs).size());
            diagnostics.addMessage(group, "extracted %d characters, %d fragments, %d paragraphs"
                    .formatted(fullText.length(), fragmentTexts.size(), paragraphCount));

            String translatedText = clock.time(PageStage.TRANSLATE_PAGE,
                    () -> normalizer.normalize(translator.translate(fullText, languages.source(), languages.target())));
            diagnostics.addMessage(group, "page text translated (%d characters)".formatted(translatedText.length()));

            TranslationRequest request = clock.time(PageStage.BUILD_REQUEST,
                    () -> requestBuilder.build(pageNumber, fullText, translatedText, fragmentTexts));

            Alignment alignment = clock.time(PageStage.ALIGN, () -> alignmentClient.align(request));
            attempts = alignment.attempts();

            int replaced = clock.time(PageStage.REINTEGRATE,
                    () -> reintegrator.reintegrate(pageNumber, fragments, alignment.response().textFragments()));
            diagnostics.addMessage(group, "replaced %d fragments after %d attempt(s)".formatted(replaced, alignment.attempts()));
            diagnostics.addMessage(group, "timings: " + clock.describe());
            LOGGER.info("Page {} translated: {} fragments, {} alignment attempt(s), {}", pageNumber, replaced,
                    alignment.attempts(), clock.describe());
            return PageOutcome.succeeded(pageNumber, alignment.attempts(), replaced, clock.timings());
        } catch (ExtractionException ex) {
            return fail(group, clock, FailureKind.EXTRACTION, pageNumber, ex, attempts, Optional.empty());
        } catch (TranslationException ex) {
            return fail(group, clock, FailureKind.TRANSLATION, pageNumber, ex, attempts, Optional.empty());
        } catch (AlignmentBackendException ex) {
            return fail(group, clock, FailureKind.CHAT_BACKEND, pageNumber, ex, ex.attempts(),
                    Optional.ofNullable(ex.lastRawResponse()));
        } catch (AlignmentExhaustedException ex) {
            return fail(group, clock, FailureKind.ALIGNMENT_EXHAUSTED, pageNumber, ex, ex.attempts(),
                    Optional.ofNullable(ex.lastRawResponse()));
        } catch (FragmentMismatchException ex) {
            return fail(group, clock, FailureKind.FRAGMENT_MISMATCH, pageNumber, ex, attempts, Optional.empty());
        } finally {
            diagnostics.flushGroup(group);
            MDC.remove(MDC_PAGE);
        }
    }

    private List<String> detach(List<TextFragment> fragments) {
        List<String> texts = new ArrayList<>(fragments.size());
        for (TextFragment fragment : fragments) {
            texts.add(normalizer.normalize(fragment.text()));
        }
        return texts;
    }

    private PageOutcome fail(String group, StageClock clock, FailureKind kind, int pageNumber, RuntimeException error,
                             int attempts, Optional<String> lastRawResponse) {
        PageStage stage = clock.current();
        LOGGER.error("Page {} failed at {} ({}): {}", pageNumber, stage, kind, error.getMessage());
        diagnostics.addMessage(group, "FAILED at %s (%s): %s".formatted(stage, kind, error.getMessage()));
        diagnostics.addMessage(group, "timings: " + clock.describe());
        return PageOutcome.failed(pageNumber, kind, stage, error.getMessage(), attempts, clock.timings(), lastRawResponse);
    }

    private static <T> T extract(int pageNumber, String what, Supplier<T> extraction) {
        try {
            T value = extraction.get();
            if (value == null) {
                throw new ExtractionException(pageNumber, "engine returned no " + what);
            }
            return value;
        } catch (ExtractionException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ExtractionException(pageNumber, "failed to extract " + what + ": " + ex.getMessage(), ex);
        }
    }

    private static final class StageClock {

        private final Map<PageStage, Duration> timings = new EnumMap<>(PageStage.class);
        private PageStage current = PageStage.EXTRACT_TEXT;

        <T> T time(PageStage stage, Supplier<T> action) {
            current = stage;
            long started = System.nanoTime();
            try {
                return action.get();
            } finally {
                timings.merge(stage, Duration.ofNanos(System.nanoTime() - started), Duration::plus);
            }
        }

        PageStage current() {
            return current;
        }

        Map<PageStage, Duration> timings() {
            return timings;
        }

        String describe() {
            StringBuilder builder = new StringBuilder();
            timings.forEach((stage, duration) -> {
                if (builder.length() > 0) {
                    builder.append(", ");
                }
                builder.append(stage).append('=').append(duration.toMillis()).append("ms");
            });
            return builder.toString();
        }
    }
}
