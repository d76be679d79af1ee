package com.dfanalyzer.trace.index;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;
import java.util.zip.GZIPInputStream;

/**
 * Read side of a shard's line index sidecar.
 * <p>
 * Checkpoints are held in memory; line offsets and record ids are read from
 * the sidecar on demand. Instances are safe for concurrent queries.
 */
public class LineIndex implements Closeable {

    private final Path shard;
    private final Path sidecar;
    private final FileChannel channel;

    private final long uncompressedLength;
    private final long lineCount;
    private final long idCount;
    private final long[] checkpointCompressed;
    private final long[] checkpointUncompressed;

    private final long lineOffsetsStart;
    private final long idsStart;

    private LineIndex(Path shard, Path sidecar, FileChannel channel, long uncompressedLength, long lineCount,
            long idCount, long[] checkpointCompressed, long[] checkpointUncompressed) {
        this.shard = shard;
        this.sidecar = sidecar;
        this.channel = channel;
        this.uncompressedLength = uncompressedLength;
        this.lineCount = lineCount;
        this.idCount = idCount;
        this.checkpointCompressed = checkpointCompressed;
        this.checkpointUncompressed = checkpointUncompressed;
        this.lineOffsetsStart = LineIndexBuilder.HEADER_SIZE;
        this.idsStart = lineOffsetsStart + lineCount * 8 + checkpointCompressed.length * 16L;
    }

    /**
     * Opens and fully validates the sidecar of {@code shard}.
     *
     * @throws IndexInvalidException if the sidecar does not describe the shard
     */
    public static LineIndex open(Path shard, Path sidecar) throws IOException {
        long shardLength = Files.size(shard);
        long sidecarLength = Files.size(sidecar);
        if (sidecarLength < LineIndexBuilder.HEADER_SIZE + 8) {
            throw new IndexInvalidException("Index " + sidecar + " is truncated");
        }

        long uncompressedLength;
        long lineCount;
        long checkpointCount;
        long idCount;
        long[] cpCompressed;
        long[] cpUncompressed;
        CRC32 crc = new CRC32();
        try (DataInputStream in = new DataInputStream(new CheckedInputStream(
                new BufferedInputStream(Files.newInputStream(sidecar), 1 << 16), crc))) {
            if (in.readLong() != LineIndexBuilder.MAGIC) {
                throw new IndexInvalidException("Index " + sidecar + " has a bad magic number");
            }
            int version = in.readInt();
            if (version != LineIndexBuilder.VERSION) {
                throw new IndexInvalidException("Index " + sidecar + " has unsupported version " + version);
            }
            long recordedShardLength = in.readLong();
            if (recordedShardLength != shardLength) {
                throw new IndexInvalidException("Index " + sidecar + " was built for a shard of "
                        + recordedShardLength + " bytes, shard now has " + shardLength);
            }
            uncompressedLength = in.readLong();
            lineCount = in.readLong();
            checkpointCount = in.readLong();
            idCount = in.readLong();
            if (lineCount < 0 || checkpointCount < 0 || idCount < 0 || checkpointCount > Integer.MAX_VALUE
                    || LineIndexBuilder.HEADER_SIZE + 8 * lineCount + 16 * (checkpointCount + idCount)
                            + 8 != sidecarLength) {
                throw new IndexInvalidException("Index " + sidecar + " has inconsistent section sizes");
            }

            long previous = -1;
            for (long i = 0; i < lineCount; i++) {
                long offset = in.readLong();
                if (offset <= previous || offset >= uncompressedLength) {
                    throw new IndexInvalidException("Index " + sidecar + " has out of order offset at line " + i);
                }
                previous = offset;
            }

            cpCompressed = new long[(int) checkpointCount];
            cpUncompressed = new long[(int) checkpointCount];
            for (int i = 0; i < checkpointCount; i++) {
                cpCompressed[i] = in.readLong();
                cpUncompressed[i] = in.readLong();
                if (i > 0 && (cpCompressed[i] <= cpCompressed[i - 1] || cpUncompressed[i] < cpUncompressed[i - 1])) {
                    throw new IndexInvalidException("Index " + sidecar + " has out of order checkpoints");
                }
            }
            if (lineCount > 0 && (checkpointCount == 0 || cpUncompressed[0] != 0)) {
                throw new IndexInvalidException("Index " + sidecar + " has no checkpoint at the stream start");
            }

            long previousId = Long.MIN_VALUE;
            for (long i = 0; i < idCount; i++) {
                long id = in.readLong();
                long line = in.readLong();
                if ((i > 0 && id <= previousId) || line < 0 || line >= lineCount) {
                    throw new IndexInvalidException("Index " + sidecar + " has an invalid record id section");
                }
                previousId = id;
            }

            long computed = crc.getValue();
            long stored = in.readLong();
            if (computed != stored) {
                throw new IndexInvalidException("Index " + sidecar + " failed its checksum");
            }
        } catch (EOFException e) {
            throw new IndexInvalidException("Index " + sidecar + " is truncated");
        }

        FileChannel channel = FileChannel.open(sidecar, StandardOpenOption.READ);
        return new LineIndex(shard, sidecar, channel, uncompressedLength, lineCount, idCount, cpCompressed,
                cpUncompressed);
    }

    public Path getShard() {
        return shard;
    }

    public Path getSidecar() {
        return sidecar;
    }

    /**
     * Number of lines in the shard; valid line numbers are {@code [0, maxLine)}.
     */
    public long maxLine() {
        return lineCount;
    }

    public long getUncompressedLength() {
        return uncompressedLength;
    }

    public int getCheckpointCount() {
        return checkpointCompressed.length;
    }

    /**
     * Returns lines {@code start..end} inclusive, in order, without their line
     * terminators.
     */
    public List<String> queryLines(long start, long end) throws IOException {
        if (start < 0 || end < start || end >= lineCount) {
            throw new IllegalArgumentException("Line range [" + start + ", " + end + "] is outside [0, "
                    + lineCount + ") of " + shard);
        }
        long startOffset = lineOffset(start);
        long endOffset = end + 1 < lineCount ? lineOffset(end + 1) : uncompressedLength;
        long length = endOffset - startOffset;
        if (length > Integer.MAX_VALUE - 8) {
            throw new LineIndexException("Line range [" + start + ", " + end + "] of " + shard + " is too large");
        }

        int cp = checkpointFor(startOffset);
        byte[] data;
        try (FileInputStream fis = new FileInputStream(shard.toFile())) {
            fis.getChannel().position(checkpointCompressed[cp]);
            InputStream gz = new GZIPInputStream(new BufferedInputStream(fis, 1 << 16), 1 << 16);
            try {
                gz.skipNBytes(startOffset - checkpointUncompressed[cp]);
            } catch (EOFException e) {
                throw new IndexInvalidException("Shard " + shard + " is shorter than its index");
            }
            data = gz.readNBytes((int) length);
        }
        if (data.length != length) {
            throw new IndexInvalidException("Shard " + shard + " is shorter than its index");
        }

        List<String> lines = new ArrayList<>((int) (end - start + 1));
        int lineStart = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == '\n') {
                lines.add(decode(data, lineStart, i));
                lineStart = i + 1;
            }
        }
        if (lineStart < data.length) {
            lines.add(decode(data, lineStart, data.length));
        }
        if (lines.size() != end - start + 1) {
            throw new IndexInvalidException("Index " + sidecar + " expected " + (end - start + 1) + " lines in ["
                    + start + ", " + end + "] but found " + lines.size());
        }
        return lines;
    }

    /**
     * Returns every line of the shard, inflating it once from the start. Used
     * when the shard has too few checkpoints for ranged queries to seek.
     */
    public List<String> readAllLines() throws IOException {
        List<String> lines = new ArrayList<>((int) Math.min(lineCount, Integer.MAX_VALUE - 8));
        long remaining = uncompressedLength;
        try (InputStream gz = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(shard), 1 << 16),
                1 << 16)) {
            ByteArrayOutputStream line = new ByteArrayOutputStream(1024);
            byte[] buffer = new byte[1 << 16];
            while (remaining > 0) {
                int n = gz.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                if (n < 0) {
                    throw new IndexInvalidException("Shard " + shard + " is shorter than its index");
                }
                int lineStart = 0;
                for (int i = 0; i < n; i++) {
                    if (buffer[i] == '\n') {
                        line.write(buffer, lineStart, i - lineStart);
                        lines.add(decode(line.toByteArray(), 0, line.size()));
                        line.reset();
                        lineStart = i + 1;
                    }
                }
                line.write(buffer, lineStart, n - lineStart);
                remaining -= n;
            }
            if (line.size() > 0) {
                lines.add(decode(line.toByteArray(), 0, line.size()));
            }
        }
        if (lines.size() != lineCount) {
            throw new IndexInvalidException("Index " + sidecar + " expected " + lineCount + " lines but found "
                    + lines.size());
        }
        return lines;
    }

    /**
     * Line number of the record whose boundary id is {@code id}, or -1.
     */
    public long lineOfRecord(long id) throws IOException {
        long lo = 0;
        long hi = idCount - 1;
        while (lo <= hi) {
            long mid = (lo + hi) >>> 1;
            long midId = readLong(idsStart + mid * 16);
            if (midId < id) {
                lo = mid + 1;
            } else if (midId > id) {
                hi = mid - 1;
            } else {
                return readLong(idsStart + mid * 16 + 8);
            }
        }
        return -1;
    }

    long lineOffset(long line) throws IOException {
        return readLong(lineOffsetsStart + line * 8);
    }

    private int checkpointFor(long offset) {
        int i = Arrays.binarySearch(checkpointUncompressed, offset);
        if (i < 0) {
            i = -i - 2;
        } else {
            // several members may start at the same offset when some are empty
            while (i > 0 && checkpointUncompressed[i - 1] == offset) {
                i--;
            }
        }
        return Math.max(i, 0);
    }

    private long readLong(long position) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(8);
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, position + buffer.position());
            if (n < 0) {
                throw new IndexInvalidException("Index " + sidecar + " ended unexpectedly");
            }
        }
        return buffer.getLong(0);
    }

    private static String decode(byte[] data, int from, int to) {
        int end = to;
        if (end > from && data[end - 1] == '\r') {
            end--;
        }
        return new String(data, from, end - from, StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
