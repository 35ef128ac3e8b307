package ai.tabulator.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable source buffer with a line index. Lines are 1-based, columns 0-based and offsets are
 * char indices into the underlying string.
 */
public final class SourceText {

    private final String text;
    private final List<Integer> lineStarts;

    public SourceText(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.lineStarts = indexLines(text);
    }

    private static List<Integer> indexLines(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return Collections.unmodifiableList(starts);
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    /**
     * Number of lines, counting a trailing partial line but not the empty remainder after a final newline.
     */
    public int lineCount() {
        int count = lineStarts.size();
        if (count > 1 && lineStarts.get(count - 1) == text.length()) {
            return count - 1;
        }
        return count;
    }

    public int lineStart(int line) {
        checkLine(line);
        return lineStarts.get(line - 1);
    }

    /**
     * Offset of the end of the line, excluding the line terminator.
     */
    public int lineEnd(int line) {
        checkLine(line);
        int end = line < lineStarts.size() ? lineStarts.get(line) - 1 : text.length();
        if (end > lineStart(line) && text.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    public String line(int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }

    public int lineLength(int line) {
        return lineEnd(line) - lineStart(line);
    }

    /**
     * Width of the leading whitespace of the line; a blank line reports its full length.
     */
    public int indentation(int line) {
        int start = lineStart(line);
        int end = lineEnd(line);
        int i = start;
        while (i < end && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i - start;
    }

    public boolean isBlank(int line) {
        return line(line).isBlank();
    }

    public int lineOf(int offset) {
        checkOffset(offset);
        int low = 0;
        int high = lineStarts.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts.get(mid) <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    public int columnOf(int offset) {
        return offset - lineStart(lineOf(offset));
    }

    public String slice(int start, int end) {
        checkOffset(start);
        checkOffset(end);
        if (end < start) {
            throw new IllegalArgumentException("Inverted range: " + start + ".." + end);
        }
        return text.substring(start, end);
    }

    /**
     * Builds a span for the half-open range, using the last character's line as the last line.
     */
    public Span span(int start, int end) {
        checkOffset(start);
        checkOffset(end);
        if (end < start) {
            throw new IllegalArgumentException("Inverted range: " + start + ".." + end);
        }
        int firstLine = lineOf(start);
        int lastLine = end > start ? lineOf(end - 1) : firstLine;
        return new Span(start, end, firstLine, lastLine, start - lineStart(firstLine));
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.size()) {
            throw new IllegalArgumentException("Line out of range: " + line);
        }
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset out of range: " + offset);
        }
    }
}
