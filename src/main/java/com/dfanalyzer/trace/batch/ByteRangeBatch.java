package com.dfanalyzer.trace.batch;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch over a byte range of an uncompressed shard. The batch owns every line
 * that starts inside {@code [offset, offset + length)}; the last owned line is
 * read to its end even when that lies past the range.
 */
public class ByteRangeBatch extends TraceBatch {

    private final long offset;
    private final long length;

    public ByteRangeBatch(int ordinal, Path file, long offset, long length) {
        super(ordinal, file);
        if (offset < 0 || length <= 0) {
            throw new IllegalArgumentException("Invalid byte range " + offset + "+" + length);
        }
        this.offset = offset;
        this.length = length;
    }

    public long getOffset() {
        return offset;
    }

    public long getLength() {
        return length;
    }

    @Override
    public List<String> readLines() throws IOException {
        List<String> lines = new ArrayList<>();
        long limit = offset + length;
        try (FileInputStream fis = new FileInputStream(getFile().toFile())) {
            long position = Math.max(0, offset - 1);
            fis.getChannel().position(position);
            InputStream in = new BufferedInputStream(fis, 1 << 16);

            if (offset > 0) {
                // the previous byte tells whether a line starts exactly at offset
                int b = in.read();
                position++;
                while (b != -1 && b != '\n') {
                    b = in.read();
                    position++;
                }
                if (b == -1) {
                    return lines;
                }
            }

            ByteArrayOutputStream line = new ByteArrayOutputStream(1024);
            while (position < limit) {
                line.reset();
                int b;
                while ((b = in.read()) != -1) {
                    position++;
                    if (b == '\n') {
                        break;
                    }
                    line.write(b);
                }
                if (b == -1 && line.size() == 0) {
                    break;
                }
                lines.add(decode(line.toByteArray()));
                if (b == -1) {
                    break;
                }
            }
        }
        return lines;
    }

    private static String decode(byte[] bytes) {
        int end = bytes.length;
        if (end > 0 && bytes[end - 1] == '\r') {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "#" + getOrdinal() + " " + getFile().getFileName() + "@" + offset + "+" + length;
    }
}
