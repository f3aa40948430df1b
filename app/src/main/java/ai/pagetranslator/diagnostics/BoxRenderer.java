package ai.pagetranslator.diagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws a titled box around a list of messages, wrapping long lines to the box width.
 */
public final class BoxRenderer {

    public static final int MIN_WIDTH = 60;
    public static final int DEFAULT_WIDTH = 80;

    private static final char TOP_LEFT = '╔';
    private static final char TOP_RIGHT = '╗';
    private static final char BOTTOM_LEFT = '╚';
    private static final char BOTTOM_RIGHT = '╝';
    private static final char HORIZONTAL = '═';
    private static final char VERTICAL = '║';

    private final int width;

    public BoxRenderer(int width) {
        this.width = width >= MIN_WIDTH ? width : DEFAULT_WIDTH;
    }

    public int width() {
        return width;
    }

    public String render(String title, List<String> messages) {
        int innerWidth = width - 4;
        String horizontal = String.valueOf(HORIZONTAL).repeat(width - 2);
        StringBuilder builder = new StringBuilder();
        builder.append("Group: ").append(title).append('\n');
        builder.append(TOP_LEFT).append(horizontal).append(TOP_RIGHT).append('\n');
        for (String line : wrap(messages, innerWidth)) {
            builder.append(VERTICAL).append(' ')
                    .append(line)
                    .append(" ".repeat(innerWidth - line.length()))
                    .append(' ').append(VERTICAL).append('\n');
        }
        builder.append(BOTTOM_LEFT).append(horizontal).append(BOTTOM_RIGHT);
        return builder.toString();
    }

    private static List<String> wrap(List<String> messages, int innerWidth) {
        List<String> lines = new ArrayList<>();
        for (String message : messages) {
            for (String physical : message.split("\\R", -1)) {
                if (physical.isEmpty()) {
                    lines.add("");
                    continue;
                }
                for (int start = 0; start < physical.length(); start += innerWidth) {
                    lines.add(physical.substring(start, Math.min(physical.length(), start + innerWidth)));
                }
            }
        }
        return lines;
    }
}
