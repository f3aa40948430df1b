package ai.pagetranslator.align;

import ai.pagetranslator.diagnostics.ArtifactKind;
import ai.pagetranslator.diagnostics.DiagnosticsSink;
import ai.pagetranslator.text.TokenEstimator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the chat exchange that aligns translated text with a page's fragments.
 *
 * <p>Attempt 0 sends the full instructions with the request; later attempts send a short correction in the
 * same session, since the conversation already holds the page. A reply is accepted once it parses as JSON
 * and carries a well-formed {@code text_fragments} list. After {@code maxRetries + 1} attempts without such
 * a reply the client gives up with {@link AlignmentExhaustedException}.
 */
public class AlignmentClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentClient.class);

    public static final int DEFAULT_MAX_RETRIES = 2;

    private final ChatBackend chatBackend;
    private final AlignmentResponseParser parser;
    private final ObjectMapper objectMapper;
    private final DiagnosticsSink diagnostics;
    private final LanguagePair languages;
    private final int maxRetries;

    public AlignmentClient(ChatBackend chatBackend,
                           AlignmentResponseParser parser,
                           ObjectMapper objectMapper,
                           DiagnosticsSink diagnostics,
                           LanguagePair languages,
                           int maxRetries) {
        this.chatBackend = Objects.requireNonNull(chatBackend, "chatBackend");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.languages = Objects.requireNonNull(languages, "languages");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be zero or greater");
        }
        this.maxRetries = maxRetries;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * @throws AlignmentExhaustedException if no attempt produced a valid reply
     * @throws AlignmentBackendException   if the backend fails with a non-retryable error
     */
    public Alignment align(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        int pageNumber = request.pageNumber();
        String group = DiagnosticsSink.pageGroup(pageNumber);
        ChatSession session = ChatSession.empty();
        String prompt = AlignmentPromptFormatter.initialPrompt(toJson(request), languages);
        String lastRawResponse = null;
        RuntimeException lastFailure = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            int attemptNumber = attempt + 1;
            long started = System.nanoTime();
            LOGGER.info("Page {} alignment attempt {}/{}: sending prompt (~{} tokens, session exchanges={})",
                    pageNumber, attemptNumber, maxAttempts(), TokenEstimator.estimate(prompt), session.exchanges());

            ChatReply reply;
            try {
                reply = chatBackend.chat(prompt, session);
            } catch (ChatBackendException ex) {
                if (!ex.retryable()) {
                    diagnostics.addMessage(group, "attempt %d: chat backend failed: %s".formatted(attemptNumber, ex.getMessage()));
                    throw new AlignmentBackendException(pageNumber, attemptNumber, lastRawResponse, ex);
                }
                lastFailure = ex;
                LOGGER.warn("Page {} alignment attempt {}/{} timed out after {} ms: {}",
                        pageNumber, attemptNumber, maxAttempts(), elapsedMillis(started), ex.getMessage());
                diagnostics.addMessage(group, "attempt %d: chat backend timed out".formatted(attemptNumber));
                continue;
            }

            session = reply.session();
            lastRawResponse = reply.text();
            LOGGER.info("Page {} alignment attempt {}/{}: reply received in {} ms (~{} tokens)",
                    pageNumber, attemptNumber, maxAttempts(), elapsedMillis(started), TokenEstimator.estimate(lastRawResponse));
            try {
                TranslationResponse response = parser.parse(pageNumber, lastRawResponse);
                diagnostics.writeArtifact(pageNumber, ArtifactKind.RESPONSE, lastRawResponse);
                diagnostics.addMessage(group, "attempt %d: valid alignment with %d fragments"
                        .formatted(attemptNumber, response.textFragments().size()));
                return new Alignment(response, attemptNumber, session);
            } catch (MalformedAlignmentResponseException ex) {
                lastFailure = ex;
                LOGGER.warn("Page {} alignment attempt {}/{} rejected: {}", pageNumber, attemptNumber, maxAttempts(), ex.getMessage());
                diagnostics.addMessage(group, "attempt %d: rejected (%s)".formatted(attemptNumber, ex.getMessage()));
                prompt = AlignmentPromptFormatter.correctivePrompt(ex.reason().description());
            }
        }

        if (lastRawResponse != null) {
            diagnostics.writeArtifact(pageNumber, ArtifactKind.REJECTED_RESPONSE, lastRawResponse);
        }
        LOGGER.error("Page {} alignment exhausted after {} attempts", pageNumber, maxAttempts());
        throw new AlignmentExhaustedException(pageNumber, maxAttempts(), lastRawResponse, lastFailure);
    }

    private String toJson(TranslationRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to serialize translation request for page " + request.pageNumber(), ex);
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
