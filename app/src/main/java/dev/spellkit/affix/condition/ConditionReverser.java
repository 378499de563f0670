package dev.spellkit.affix.condition;

/**
 * Rewrites condition text written for one word edge into the equivalent text for the opposite edge.
 */
public final class ConditionReverser {

    private ConditionReverser() {
    }

    /**
     * Reverses the atom order of {@code conditionText} while keeping every class intact, so {@code "[^ab]c"}
     * becomes {@code "c[^ba]"}.
     *
     * <p>Members of a class are reversed too, except for {@code ^} members, which keep their position so that a
     * positive class never starts with {@code ^}. Applying the method twice returns the original text. A bracket
     * that does not belong to a complete class is treated as a literal and turned around.
     */
    public static String reverse(String conditionText) {
        if (conditionText == null || conditionText.isEmpty()) {
            return conditionText;
        }
        StringBuilder reversed = new StringBuilder(conditionText.length());
        int position = 0;
        while (position < conditionText.length()) {
            char c = conditionText.charAt(position);
            int close = c == '[' ? classEnd(conditionText, position) : -1;
            String atom;
            if (close < 0) {
                atom = String.valueOf(flipBracket(c));
                position++;
            } else {
                atom = reverseClass(conditionText.substring(position, close + 1));
                position = close + 1;
            }
            reversed.insert(0, atom);
        }
        return reversed.toString();
    }

    private static int classEnd(String text, int open) {
        return text.indexOf(']', open + 1);
    }

    private static String reverseClass(String classText) {
        boolean negated = classText.length() > 2 && classText.charAt(1) == '^';
        int membersStart = negated ? 2 : 1;
        char[] members = classText.substring(membersStart, classText.length() - 1).toCharArray();
        int left = 0;
        int right = members.length - 1;
        while (left < right) {
            if (members[left] == '^') {
                left++;
            } else if (members[right] == '^') {
                right--;
            } else {
                char swap = members[left];
                members[left++] = members[right];
                members[right--] = swap;
            }
        }
        return (negated ? "[^" : "[") + new String(members) + "]";
    }

    private static char flipBracket(char c) {
        if (c == '[') {
            return ']';
        }
        return c == ']' ? '[' : c;
    }
}
