package dev.spellkit.affix.table;

import dev.spellkit.affix.model.AffixFormatException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Growable table fed one directive line at a time, tracking whether its optional leading count line was seen.
 *
 * @param <T> entry type
 */
public final class EntryTable<T> {

    private static final int MAX_PRESIZE = 1 << 14;

    private final String directive;
    private final ArrayList<T> entries = new ArrayList<>();
    private TableState state = TableState.UNTOUCHED;

    public EntryTable(String directive) {
        this.directive = Objects.requireNonNull(directive, "directive");
    }

    /**
     * Consumes one parameter line. On first touch a bare non-negative integer is taken as a size hint; any other
     * line is handed to {@code parser}.
     *
     * @throws AffixFormatException if the parser rejects the line
     */
    public void accept(String parameterText, Function<String, T> parser) {
        Objects.requireNonNull(parameterText, "parameterText");
        if (state == TableState.UNTOUCHED) {
            OptionalInt hint = parseCapacityHint(parameterText);
            if (hint.isPresent()) {
                entries.ensureCapacity(Math.min(hint.getAsInt(), MAX_PRESIZE));
                state = TableState.SIZE_HINTED;
                return;
            }
        }
        state = TableState.POPULATED;
        entries.add(Objects.requireNonNull(parser.apply(parameterText), directive + " entry"));
    }

    public void addAll(List<T> defaults) {
        entries.addAll(defaults);
    }

    public TableState state() {
        return state;
    }

    public boolean isTouched() {
        return state != TableState.UNTOUCHED;
    }

    public List<T> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public List<T> freeze() {
        return List.copyOf(entries);
    }

    static OptionalInt parseCapacityHint(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalInt.empty();
            }
        }
        try {
            return OptionalInt.of(Integer.parseInt(trimmed));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }
}
