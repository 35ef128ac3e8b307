package ai.tabulator.extract;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Single-line text a candidate renders to, split at its alignment anchor. Widths and the anchor are
 * measured from the start of the line's indentation.
 */
public record Rendering(String head, String tail) {

    private static final Pattern LINE_BREAK_RUN = Pattern.compile("\\s*\\n\\s*");

    public Rendering {
        Objects.requireNonNull(head, "head");
        Objects.requireNonNull(tail, "tail");
    }

    /**
     * Joins a multi-line source fragment into one line: every whitespace run holding a newline becomes
     * one space, then the result is trimmed.
     */
    public static String collapse(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        return LINE_BREAK_RUN.matcher(source).replaceAll(" ").strip();
    }

    public static String spaces(int count) {
        return count <= 0 ? "" : " ".repeat(count);
    }

    public String text() {
        return head + tail;
    }

    public int anchor() {
        return head.length();
    }

    public int width() {
        return head.length() + tail.length();
    }

    public String padded(int column) {
        return head + spaces(column - anchor()) + tail;
    }

    public int paddedWidth(int column) {
        return Math.max(column, anchor()) + tail.length();
    }
}
