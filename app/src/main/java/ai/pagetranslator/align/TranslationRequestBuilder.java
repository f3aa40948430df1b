package ai.pagetranslator.align;

import ai.pagetranslator.diagnostics.ArtifactKind;
import ai.pagetranslator.diagnostics.DiagnosticsSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles a page's extracted data into the structure sent to the chat model and records it
 * as an audit artifact before it is sent.
 */
public class TranslationRequestBuilder {

    private final ObjectMapper objectMapper;
    private final DiagnosticsSink diagnostics;

    public TranslationRequestBuilder(ObjectMapper objectMapper, DiagnosticsSink diagnostics) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public TranslationRequest build(int pageNumber,
                                    String originalFullText,
                                    String translatedFullText,
                                    List<String> originalFragments) {
        Objects.requireNonNull(originalFragments, "originalFragments");
        List<FragmentEntry> entries = new ArrayList<>(originalFragments.size());
        for (int i = 0; i < originalFragments.size(); i++) {
            entries.add(FragmentEntry.untranslated(i, Objects.requireNonNullElse(originalFragments.get(i), "")));
        }
        TranslationRequest request = new TranslationRequest(pageNumber,
                new PageContext(originalFullText, translatedFullText), entries);
        diagnostics.writeArtifact(pageNumber, ArtifactKind.REQUEST, toJson(request));
        return request;
    }

    String toJson(TranslationRequest request) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to serialize translation request for page " + request.pageNumber(), ex);
        }
    }
}
