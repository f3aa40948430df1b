package ai.pagetranslator.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonDocumentEngineTest {

    private static final String DOCUMENT = """
            {
              "title": "Manual",
              "pages": [
                {
                  "paragraphs": [
                    {"fragments": [{"text": "Hello", "font": "Helvetica", "size": 11}, {"text": "world"}]},
                    {"fragments": [{"text": "Second paragraph", "bbox": [1, 2, 3, 4]}]}
                  ]
                },
                {"paragraphs": []}
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private final JsonDocumentEngine engine = new JsonDocumentEngine();

    @Test
    void extractsTextFragmentsAndParagraphs() throws IOException {
        PagedDocument document = engine.open(write("doc.json", DOCUMENT));

        assertThat(document.pageCount()).isEqualTo(2);
        DocumentPage first = document.page(1);
        assertThat(first.number()).isEqualTo(1);
        assertThat(first.extractParagraphs()).containsExactly("Hello world", "Second paragraph");
        assertThat(first.extractFullText()).isEqualTo("Hello world\nSecond paragraph");
        assertThat(first.extractFragments()).extracting(TextFragment::text)
                .containsExactly("Hello", "world", "Second paragraph");
        assertThat(document.page(2).extractFragments()).isEmpty();
        assertThat(document.page(2).extractFullText()).isEmpty();
    }

    @Test
    @DisplayName("Replaced fragment text is saved while every other attribute is kept")
    void savesReplacedTextAndKeepsAttributes() throws IOException {
        PagedDocument document = engine.open(write("doc.json", DOCUMENT));
        List<TextFragment> fragments = document.page(1).extractFragments();
        fragments.get(0).replaceText("Hallo");
        fragments.get(2).replaceText("Zweiter Absatz");

        Path output = tempDir.resolve("out/translated.json");
        document.save(output);

        JsonNode saved = new ObjectMapper().readTree(output.toFile());
        JsonNode paragraphs = saved.path("pages").get(0).path("paragraphs");
        assertThat(saved.path("title").asText()).isEqualTo("Manual");
        assertThat(paragraphs.get(0).path("fragments").get(0).path("text").asText()).isEqualTo("Hallo");
        assertThat(paragraphs.get(0).path("fragments").get(0).path("font").asText()).isEqualTo("Helvetica");
        assertThat(paragraphs.get(0).path("fragments").get(0).path("size").asInt()).isEqualTo(11);
        assertThat(paragraphs.get(0).path("fragments").get(1).path("text").asText()).isEqualTo("world");
        assertThat(paragraphs.get(1).path("fragments").get(0).path("text").asText()).isEqualTo("Zweiter Absatz");
        assertThat(paragraphs.get(1).path("fragments").get(0).path("bbox")).hasSize(4);
    }

    @Test
    void rejectsFragmentsWithoutText() throws IOException {
        PagedDocument document = engine.open(write("doc.json", """
                {"pages": [{"paragraphs": [{"fragments": [{"font": "Courier"}]}]}]}
                """));

        assertThatThrownBy(() -> document.page(1).extractFragments())
                .isInstanceOf(ExtractionException.class)
                .satisfies(ex -> assertThat(((ExtractionException) ex).pageNumber()).isEqualTo(1));
    }

    @Test
    void rejectsPageNumbersOutsideTheDocument() throws IOException {
        PagedDocument document = engine.open(write("doc.json", DOCUMENT));

        assertThatThrownBy(() -> document.page(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> document.page(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failsToOpenDocumentsWithoutPages() throws IOException {
        Path noPages = write("nopages.json", "{\"sections\": []}");
        Path broken = write("broken.json", "{not json");

        assertThatThrownBy(() -> engine.open(noPages)).isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> engine.open(broken)).isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> engine.open(tempDir.resolve("missing.json"))).isInstanceOf(PersistenceException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
