package ai.tabulator.edit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Non-overlapping edits of one pass, all expressed against the original buffer and applied in a
 * single rewrite.
 */
public final class EditSet {

    private static final Comparator<Edit> BY_POSITION = Comparator.comparingInt(Edit::start).thenComparingInt(Edit::end);

    private final List<Edit> edits = new ArrayList<>();

    public static EditSet empty() {
        return new EditSet();
    }

    /**
     * Adds the edit unless it conflicts with one already accepted.
     *
     * @return {@code false} when the edit was rejected
     */
    public boolean add(Edit edit) {
        Objects.requireNonNull(edit, "edit");
        int position = Collections.binarySearch(edits, edit, BY_POSITION);
        int insertAt = position >= 0 ? position : -position - 1;
        if (insertAt > 0 && edits.get(insertAt - 1).conflictsWith(edit)) {
            return false;
        }
        if (insertAt < edits.size() && edits.get(insertAt).conflictsWith(edit)) {
            return false;
        }
        edits.add(insertAt, edit);
        return true;
    }

    public List<Edit> edits() {
        return Collections.unmodifiableList(edits);
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    public String apply(String source) {
        Objects.requireNonNull(source, "source");
        if (edits.isEmpty()) {
            return source;
        }
        StringBuilder rewritten = new StringBuilder(source.length() + 64);
        int cursor = 0;
        for (Edit edit : edits) {
            if (edit.end() > source.length()) {
                throw new IllegalArgumentException("Edit " + edit.start() + ".." + edit.end()
                        + " exceeds source length " + source.length());
            }
            rewritten.append(source, cursor, edit.start());
            rewritten.append(edit.replacement());
            cursor = edit.end();
        }
        rewritten.append(source, cursor, source.length());
        return rewritten.toString();
    }
}
