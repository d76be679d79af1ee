package com.dfanalyzer.trace;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Writes trace shards for tests.
 */
public final class TraceFixtures {

    private TraceFixtures() {
    }

    /**
     * Writes each group of lines as its own gzip member, concatenated into one
     * file.
     */
    @SafeVarargs
    public static Path writeGzipMembers(Path file, List<String>... members) throws IOException {
        ByteArrayOutputStream shard = new ByteArrayOutputStream();
        for (List<String> member : members) {
            ByteArrayOutputStream compressed = new ByteArrayOutputStream();
            try (GZIPOutputStream gz = new GZIPOutputStream(compressed)) {
                for (String line : member) {
                    gz.write((line + "\n").getBytes(StandardCharsets.UTF_8));
                }
            }
            shard.write(compressed.toByteArray());
        }
        Files.write(file, shard.toByteArray());
        return file;
    }

    public static Path writePlain(Path file, List<String> lines) throws IOException {
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }

    /** Event lines {@code "id":from .. "id":to-1} of a posix read. */
    public static List<String> readEvents(int from, int to) {
        List<String> lines = new ArrayList<>();
        for (int i = from; i < to; i++) {
            lines.add(event(i, "read", "POSIX", 1000 + i * 10L, 5, "{\"ret\":4096,\"fhash\":\"f1\",\"hhash\":\"h1\"}"));
        }
        return lines;
    }

    public static String event(long id, String name, String cat, long ts, long dur, String args) {
        return "{\"id\":" + id + ",\"name\":\"" + name + "\",\"cat\":\"" + cat + "\",\"pid\":10,\"tid\":11,\"ts\":"
                + ts + ",\"dur\":" + dur + ",\"ph\":\"X\",\"args\":" + args + "}";
    }

    public static String hashEntry(long id, String marker, String name, String hash, String hostHash) {
        return "{\"id\":" + id + ",\"name\":\"" + marker + "\",\"cat\":\"dftracer\",\"pid\":10,\"tid\":11,"
                + "\"ph\":\"M\",\"args\":{\"hhash\":\"" + hostHash + "\",\"name\":\"" + name + "\",\"value\":\""
                + hash + "\"}}";
    }
}
