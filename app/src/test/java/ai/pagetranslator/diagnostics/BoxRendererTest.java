package ai.pagetranslator.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class BoxRendererTest {

    @Test
    void drawsTitledBoxWithPaddedLines() {
        BoxRenderer renderer = new BoxRenderer(60);

        String box = renderer.render("page-3", List.of("extracted 12 fragments", "", "done"));

        String[] lines = box.split("\n");
        assertThat(lines[0]).isEqualTo("Group: page-3");
        assertThat(lines[1]).startsWith("╔").endsWith("╗").hasSize(60);
        assertThat(lines[2]).isEqualTo("║ extracted 12 fragments" + " ".repeat(56 - 22) + " ║");
        assertThat(lines[3]).isEqualTo("║ " + " ".repeat(56) + " ║");
        assertThat(lines[4]).startsWith("║ done");
        assertThat(lines[5]).startsWith("╚").endsWith("╝").hasSize(60);
        assertThat(lines).hasSize(6);
    }

    @Test
    void wrapsLongMessagesAtTheInnerWidth() {
        BoxRenderer renderer = new BoxRenderer(60);

        String box = renderer.render("g", List.of("x".repeat(70)));

        String[] lines = box.split("\n");
        assertThat(lines).hasSize(5);
        assertThat(lines[2]).isEqualTo("║ " + "x".repeat(56) + " ║");
        assertThat(lines[3]).isEqualTo("║ " + "x".repeat(14) + " ".repeat(42) + " ║");
    }

    @Test
    void fallsBackToDefaultWidthWhenTooNarrow() {
        assertThat(new BoxRenderer(20).width()).isEqualTo(BoxRenderer.DEFAULT_WIDTH);
        assertThat(new BoxRenderer(100).width()).isEqualTo(100);
    }
}
