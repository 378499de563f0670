package dev.spellkit.affix.flag;

/**
 * Opaque identifier of an affix or dictionary flag.
 *
 * <p>The wrapped value is the code point for {@link FlagMode#CHAR} and {@link FlagMode#UNI} flags, the two
 * characters packed into the high and low halves for {@link FlagMode#LONG} flags and the decimal value for
 * {@link FlagMode#NUM} flags. Two flags are equal iff they wrap the same value.
 */
public record FlagValue(int value) implements Comparable<FlagValue> {

    public static FlagValue ofChar(int codePoint) {
        return new FlagValue(codePoint);
    }

    public static FlagValue ofPair(char first, char second) {
        return new FlagValue((first << 16) | second);
    }

    public static FlagValue ofNumber(int number) {
        if (number < 0) {
            throw new IllegalArgumentException("numeric flags must not be negative: " + number);
        }
        return new FlagValue(number);
    }

    @Override
    public int compareTo(FlagValue other) {
        return Integer.compareUnsigned(value, other.value);
    }
}
