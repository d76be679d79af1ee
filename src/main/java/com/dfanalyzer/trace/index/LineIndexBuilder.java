package com.dfanalyzer.trace.index;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;
import java.util.zip.ZipException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans a gzip compressed shard once and writes its line index sidecar.
 * <p>
 * Every line start is recorded as an offset into the decompressed stream.
 * Gzip member boundaries are recorded as checkpoints so that a query can
 * start inflating at the member that contains its first line. Lines matching
 * the record boundary pattern contribute their numeric id, which must be
 * unique within the shard.
 */
public class LineIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(LineIndexBuilder.class);

    public static final String DEFAULT_RECORD_PATTERN = "\"id\":\\s*([0-9]+)";

    static final long MAGIC = 0x4446545a49445831L; // "DFTZIDX1"
    static final int VERSION = 1;
    static final int HEADER_SIZE = 8 + 4 + 8 * 5;

    private static final long CHECKPOINT_SPACING = 1024 * 1024;
    private static final int MAX_SCANNED_LINE_PREFIX = 64 * 1024;

    private static final int FTEXT_FHCRC = 0x02;
    private static final int FEXTRA = 0x04;
    private static final int FNAME = 0x08;
    private static final int FCOMMENT = 0x10;

    private final Pattern recordPattern;

    public LineIndexBuilder() {
        this(DEFAULT_RECORD_PATTERN);
    }

    public LineIndexBuilder(String recordPattern) {
        this.recordPattern = Pattern.compile(recordPattern);
    }

    /**
     * Builds the index of {@code shard} into {@code target}, overwriting it.
     */
    public void build(Path shard, Path target) throws IOException {
        long start = System.currentTimeMillis();
        long shardLength = Files.size(shard);
        ScanState state = new ScanState();

        try (InputStream in = Files.newInputStream(shard)) {
            CompressedInput input = new CompressedInput(in);
            byte[] out = new byte[64 * 1024];
            int members = 0;
            while (true) {
                long memberStart = input.position();
                int id1 = input.read();
                if (id1 == -1) {
                    break;
                }
                if (id1 != 0x1f) {
                    if (members == 0) {
                        throw new LineIndexException("Not a gzip shard: " + shard);
                    }
                    logger.debug("Ignoring {} trailing bytes after last gzip member of {}",
                            shardLength - memberStart, shard);
                    break;
                }
                readHeader(input, shard);
                if (state.uncompressed == 0 || state.uncompressed - state.lastCheckpoint >= CHECKPOINT_SPACING) {
                    state.addCheckpoint(memberStart, state.uncompressed);
                }
                inflateMember(input, out, state, shard);
                input.skip(8); // CRC32 and ISIZE
                members++;
            }
            state.finishLine();
            logger.debug("Scanned {} gzip member(s) of {}", members, shard);
        }

        write(target, shardLength, state);
        logger.info("Indexed {} lines of {} in {} ms", state.lineCount, shard, System.currentTimeMillis() - start);
    }

    private void readHeader(CompressedInput input, Path shard) throws IOException {
        if (input.read() != 0x8b || input.read() != 8) {
            throw new ZipException("Bad gzip member header in " + shard);
        }
        int flags = input.read();
        if (flags < 0) {
            throw new ZipException("Truncated gzip header in " + shard);
        }
        input.skip(6); // MTIME, XFL, OS
        if ((flags & FEXTRA) != 0) {
            int xlen = input.read() | (input.read() << 8);
            input.skip(xlen);
        }
        if ((flags & FNAME) != 0) {
            input.skipZeroTerminated();
        }
        if ((flags & FCOMMENT) != 0) {
            input.skipZeroTerminated();
        }
        if ((flags & FTEXT_FHCRC) != 0) {
            input.skip(2);
        }
    }

    private void inflateMember(CompressedInput input, byte[] out, ScanState state, Path shard) throws IOException {
        Inflater inflater = new Inflater(true);
        try {
            while (!inflater.finished()) {
                if (inflater.needsInput()) {
                    if (!input.fill()) {
                        throw new ZipException("Unexpected end of gzip stream in " + shard);
                    }
                    input.handTo(inflater);
                }
                int n;
                try {
                    n = inflater.inflate(out);
                } catch (DataFormatException e) {
                    throw new ZipException("Corrupt deflate data in " + shard + ": " + e.getMessage());
                }
                if (n == 0 && inflater.needsDictionary()) {
                    throw new ZipException("Gzip member requires a preset dictionary in " + shard);
                }
                for (int i = 0; i < n; i++) {
                    state.accept(out[i]);
                }
            }
            input.takeBack(inflater.getRemaining());
        } finally {
            inflater.end();
        }
    }

    private void write(Path target, long shardLength, ScanState state) throws IOException {
        long[][] ids = state.sortedIds();
        CRC32 crc = new CRC32();
        try (OutputStream raw = Files.newOutputStream(target);
                DataOutputStream out = new DataOutputStream(
                        new CheckedOutputStream(new BufferedOutputStream(raw, 1 << 16), crc))) {
            out.writeLong(MAGIC);
            out.writeInt(VERSION);
            out.writeLong(shardLength);
            out.writeLong(state.uncompressed);
            out.writeLong(state.lineCount);
            out.writeLong(state.checkpoints.size());
            out.writeLong(ids.length);
            for (int i = 0; i < state.lineCount; i++) {
                out.writeLong(state.lineOffsets[i]);
            }
            for (long[] checkpoint : state.checkpoints) {
                out.writeLong(checkpoint[0]);
                out.writeLong(checkpoint[1]);
            }
            for (long[] id : ids) {
                out.writeLong(id[0]);
                out.writeLong(id[1]);
            }
            out.flush();
            // the checksum covers everything above, so it goes to the raw stream
            DataOutputStream trailer = new DataOutputStream(raw);
            trailer.writeLong(crc.getValue());
            trailer.flush();
        }
    }

    private class ScanState {
        long uncompressed;
        long lastCheckpoint;
        final List<long[]> checkpoints = new ArrayList<>();

        long[] lineOffsets = new long[1024];
        int lineCount;
        boolean atLineStart = true;

        byte[] line = new byte[1024];
        int lineLength;

        final Map<Long, Long> idToLine = new HashMap<>();

        void addCheckpoint(long compressed, long uncompressedOffset) {
            checkpoints.add(new long[] { compressed, uncompressedOffset });
            lastCheckpoint = uncompressedOffset;
        }

        void accept(byte b) throws LineIndexException {
            if (atLineStart) {
                if (lineCount == Integer.MAX_VALUE - 8) {
                    throw new LineIndexException("Shard has too many lines to index");
                }
                if (lineCount == lineOffsets.length) {
                    lineOffsets = Arrays.copyOf(lineOffsets, lineOffsets.length * 2);
                }
                lineOffsets[lineCount++] = uncompressed;
                atLineStart = false;
                lineLength = 0;
            }
            uncompressed++;
            if (b == '\n') {
                matchRecordId();
                atLineStart = true;
                return;
            }
            if (lineLength < MAX_SCANNED_LINE_PREFIX) {
                if (lineLength == line.length) {
                    line = Arrays.copyOf(line, line.length * 2);
                }
                line[lineLength++] = b;
            }
        }

        void finishLine() throws LineIndexException {
            if (!atLineStart) {
                matchRecordId();
                atLineStart = true;
            }
        }

        private void matchRecordId() throws LineIndexException {
            if (lineLength == 0) {
                return;
            }
            Matcher matcher = recordPattern.matcher(new String(line, 0, lineLength, StandardCharsets.ISO_8859_1));
            if (!matcher.find()) {
                return;
            }
            long lineNumber = lineCount - 1;
            long id;
            try {
                id = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                throw new LineIndexException("Record id on line " + lineNumber + " is not numeric", e);
            }
            Long previous = idToLine.putIfAbsent(id, lineNumber);
            if (previous != null) {
                throw new LineIndexException("Record id " + id + " is not unique (lines " + previous + " and "
                        + lineNumber + ")");
            }
        }

        long[][] sortedIds() {
            long[][] ids = new long[idToLine.size()][];
            int i = 0;
            for (Map.Entry<Long, Long> e : idToLine.entrySet()) {
                ids[i++] = new long[] { e.getKey(), e.getValue() };
            }
            Arrays.sort(ids, (a, b) -> Long.compare(a[0], b[0]));
            return ids;
        }
    }

    /**
     * Buffered view of the compressed bytes that knows its absolute position,
     * so member boundaries can be recorded.
     */
    private static class CompressedInput {
        private final InputStream in;
        private final byte[] buf = new byte[64 * 1024];
        private int pos;
        private int limit;
        private long base;

        CompressedInput(InputStream in) {
            this.in = in;
        }

        long position() {
            return base + pos;
        }

        boolean fill() throws IOException {
            if (pos < limit) {
                return true;
            }
            base += limit;
            pos = 0;
            limit = 0;
            int n = in.read(buf);
            if (n <= 0) {
                return false;
            }
            limit = n;
            return true;
        }

        int read() throws IOException {
            if (!fill()) {
                return -1;
            }
            return buf[pos++] & 0xff;
        }

        void skip(long n) throws IOException {
            for (long i = 0; i < n; i++) {
                if (read() == -1) {
                    throw new ZipException("Unexpected end of gzip stream");
                }
            }
        }

        void skipZeroTerminated() throws IOException {
            int b;
            while ((b = read()) != 0) {
                if (b == -1) {
                    throw new ZipException("Unexpected end of gzip header");
                }
            }
        }

        void handTo(Inflater inflater) {
            inflater.setInput(buf, pos, limit - pos);
            pos = limit;
        }

        void takeBack(int remaining) {
            pos = limit - remaining;
        }
    }
}
