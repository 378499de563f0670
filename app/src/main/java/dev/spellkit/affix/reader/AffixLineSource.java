package dev.spellkit.affix.reader;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Supplies the lines of an affix file one at a time.
 */
public interface AffixLineSource extends Closeable {

    /**
     * @return the next line without its terminator, or {@code null} at end of input
     */
    String readLine() throws IOException;

    /**
     * Called after a {@code SET} directive was accepted. Sources that decode bytes use the new charset for every
     * following line; sources of already decoded text ignore it.
     */
    default void switchEncoding(Charset encoding) {
    }

    /**
     * The charset the source chose on its own, such as UTF-8 after a byte order mark. Known once the first line
     * has been read.
     */
    default Optional<Charset> detectedEncoding() {
        return Optional.empty();
    }

    @Override
    default void close() throws IOException {
    }

    static AffixLineSource of(List<String> lines) {
        Iterator<String> iterator = List.copyOf(Objects.requireNonNull(lines, "lines")).iterator();
        return () -> iterator.hasNext() ? iterator.next() : null;
    }
}
