package ai.pagetranslator.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document engine for layout documents stored as JSON:
 *
 * <pre>
 * {"pages": [{"paragraphs": [{"fragments": [{"text": "...", "font": "...", "size": 11, "bbox": [..]}]}]}]}
 * </pre>
 *
 * Fragment attributes other than {@code text} are carried through to the saved output untouched.
 */
public class JsonDocumentEngine implements DocumentEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonDocumentEngine.class);

    static final String PAGES = "pages";
    static final String PARAGRAPHS = "paragraphs";
    static final String FRAGMENTS = "fragments";
    static final String TEXT = "text";

    private final ObjectMapper objectMapper;

    public JsonDocumentEngine() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonDocumentEngine(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public PagedDocument open(Path source) {
        Objects.requireNonNull(source, "source");
        JsonNode root;
        try {
            root = objectMapper.readTree(source.toFile());
        } catch (IOException ex) {
            throw new PersistenceException("Failed to read document " + source, ex);
        }
        if (root == null || !root.path(PAGES).isArray()) {
            throw new PersistenceException("Document " + source + " has no '" + PAGES + "' array", null);
        }
        ArrayNode pages = (ArrayNode) root.get(PAGES);
        LOGGER.info("Opened {} with {} pages", source, pages.size());
        return new JsonPagedDocument((ObjectNode) root, pages);
    }

    private final class JsonPagedDocument implements PagedDocument {

        private final ObjectNode root;
        private final List<JsonDocumentPage> pages;

        private JsonPagedDocument(ObjectNode root, ArrayNode pageNodes) {
            this.root = root;
            List<JsonDocumentPage> loaded = new ArrayList<>(pageNodes.size());
            for (int i = 0; i < pageNodes.size(); i++) {
                loaded.add(new JsonDocumentPage(i + 1, pageNodes.get(i)));
            }
            this.pages = List.copyOf(loaded);
        }

        @Override
        public int pageCount() {
            return pages.size();
        }

        @Override
        public DocumentPage page(int number) {
            if (number < 1 || number > pages.size()) {
                throw new IllegalArgumentException("page number %d outside 1..%d".formatted(number, pages.size()));
            }
            return pages.get(number - 1);
        }

        @Override
        public void save(Path target) {
            Objects.requireNonNull(target, "target");
            try {
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                objectMapper.writeValue(target.toFile(), root);
            } catch (IOException ex) {
                throw new PersistenceException("Failed to save document " + target, ex);
            }
        }
    }

    private static final class JsonDocumentPage implements DocumentPage {

        private final int number;
        private final JsonNode node;

        private JsonDocumentPage(int number, JsonNode node) {
            this.number = number;
            this.node = node;
        }

        @Override
        public int number() {
            return number;
        }

        @Override
        public String extractFullText() {
            return String.join("\n", extractParagraphs());
        }

        @Override
        public List<TextFragment> extractFragments() {
            List<TextFragment> fragments = new ArrayList<>();
            for (JsonNode paragraph : paragraphs()) {
                fragments.addAll(fragmentsOf(paragraph));
            }
            return List.copyOf(fragments);
        }

        @Override
        public List<String> extractParagraphs() {
            List<String> paragraphs = new ArrayList<>();
            for (JsonNode paragraph : paragraphs()) {
                paragraphs.add(fragmentsOf(paragraph).stream()
                        .map(TextFragment::text)
                        .collect(Collectors.joining(" ")));
            }
            return List.copyOf(paragraphs);
        }

        private List<JsonNode> paragraphs() {
            if (!node.isObject()) {
                throw new ExtractionException(number, "page entry is not an object");
            }
            JsonNode paragraphs = node.path(PARAGRAPHS);
            if (paragraphs.isMissingNode()) {
                return List.of();
            }
            if (!paragraphs.isArray()) {
                throw new ExtractionException(number, "'" + PARAGRAPHS + "' is not an array");
            }
            List<JsonNode> result = new ArrayList<>(paragraphs.size());
            paragraphs.forEach(result::add);
            return result;
        }

        private List<TextFragment> fragmentsOf(JsonNode paragraph) {
            JsonNode fragments = paragraph.path(FRAGMENTS);
            if (fragments.isMissingNode()) {
                return List.of();
            }
            if (!fragments.isArray()) {
                throw new ExtractionException(number, "'" + FRAGMENTS + "' is not an array");
            }
            List<TextFragment> result = new ArrayList<>(fragments.size());
            for (JsonNode fragment : fragments) {
                if (!fragment.isObject() || !fragment.path(TEXT).isTextual()) {
                    throw new ExtractionException(number, "fragment without textual '" + TEXT + "' attribute");
                }
                result.add(new JsonTextFragment((ObjectNode) fragment));
            }
            return result;
        }
    }

    private static final class JsonTextFragment implements TextFragment {

        private final ObjectNode node;

        private JsonTextFragment(ObjectNode node) {
            this.node = node;
        }

        @Override
        public String text() {
            return node.path(TEXT).asText("");
        }

        @Override
        public void replaceText(String text) {
            node.put(TEXT, Objects.requireNonNull(text, "text"));
        }
    }
}
