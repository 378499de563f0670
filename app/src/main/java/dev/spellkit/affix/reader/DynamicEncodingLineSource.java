package dev.spellkit.affix.reader;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads byte lines from a stream and decodes each with the charset in effect when it is read, so that lines after
 * a {@code SET} directive are decoded with the declared encoding. A leading UTF-8 byte order mark selects UTF-8
 * and is dropped.
 */
public final class DynamicEncodingLineSource implements AffixLineSource {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final InputStream input;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(128);
    private Charset encoding;
    private Charset bomEncoding;
    private boolean started;
    private boolean exhausted;

    public DynamicEncodingLineSource(InputStream input, Charset initialEncoding) {
        this.input = new BufferedInputStream(Objects.requireNonNull(input, "input"));
        this.encoding = Objects.requireNonNull(initialEncoding, "initialEncoding");
    }

    public Charset encoding() {
        return encoding;
    }

    @Override
    public Optional<Charset> detectedEncoding() {
        return Optional.ofNullable(bomEncoding);
    }

    @Override
    public void switchEncoding(Charset encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    @Override
    public String readLine() throws IOException {
        if (!started) {
            started = true;
            skipByteOrderMark();
        }
        if (exhausted) {
            return null;
        }
        buffer.reset();
        int b;
        while ((b = input.read()) != -1) {
            if (b == '\n') {
                return decode();
            }
            if (b == '\r') {
                input.mark(1);
                if (input.read() != '\n') {
                    input.reset();
                }
                return decode();
            }
            buffer.write(b);
        }
        exhausted = true;
        return buffer.size() == 0 ? null : decode();
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    private String decode() {
        String line = buffer.toString(encoding);
        if (!line.isEmpty() && line.charAt(0) == '\uFEFF') {
            return line.substring(1);
        }
        return line;
    }

    private void skipByteOrderMark() throws IOException {
        input.mark(UTF8_BOM.length);
        for (byte expected : UTF8_BOM) {
            if (input.read() != (expected & 0xFF)) {
                input.reset();
                return;
            }
        }
        encoding = StandardCharsets.UTF_8;
        bomEncoding = encoding;
    }
}
