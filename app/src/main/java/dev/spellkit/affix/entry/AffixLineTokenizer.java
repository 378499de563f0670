package dev.spellkit.affix.entry;

import dev.spellkit.affix.table.TableParsers;
import java.util.List;
import java.util.Optional;

/**
 * Classifies PFX/SFX parameter text by field count: three fields form a header, four or more an entry whose
 * fields past the condition are morphology. A field starting with {@code #} after the first three starts a
 * trailing comment.
 */
public final class AffixLineTokenizer {

    private static final int HEADER_FIELDS = 3;

    private AffixLineTokenizer() {
    }

    public static Optional<AffixLine> tokenize(String parameters) {
        List<String> fields = withoutTrailingComment(TableParsers.splitFields(parameters));
        if (fields.size() == HEADER_FIELDS) {
            return Optional.of(new AffixLine.HeaderLine(
                    fields.get(0),
                    fields.get(1).startsWith("Y"),
                    parseCount(fields.get(2))));
        }
        if (fields.size() > HEADER_FIELDS) {
            String morphology = String.join(" ", fields.subList(4, fields.size()));
            return Optional.of(new AffixLine.BodyLine(fields.get(0), fields.get(1), fields.get(2), fields.get(3), morphology));
        }
        return Optional.empty();
    }

    private static List<String> withoutTrailingComment(List<String> fields) {
        for (int i = HEADER_FIELDS; i < fields.size(); i++) {
            if (fields.get(i).startsWith("#")) {
                return fields.subList(0, i);
            }
        }
        return fields;
    }

    private static int parseCount(String raw) {
        try {
            return Math.max(0, Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
