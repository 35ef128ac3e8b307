package ai.tabulator.tree;

/**
 * Half-open source range with its line extent and the column of its first character.
 */
public record Span(int start, int end, int firstLine, int lastLine, int column) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span boundaries: " + start + ".." + end);
        }
        if (firstLine < 1 || lastLine < firstLine) {
            throw new IllegalArgumentException("Invalid span lines: " + firstLine + ".." + lastLine);
        }
    }

    public boolean isSingleLine() {
        return firstLine == lastLine;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    public int length() {
        return end - start;
    }
}
