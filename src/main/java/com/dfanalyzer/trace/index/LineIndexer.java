package com.dfanalyzer.trace.index;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out {@link LineIndex} handles, building each shard's sidecar at most
 * once.
 * <p>
 * Builds are serialized per sidecar by a JVM-wide monitor and, across
 * processes, by an exclusive lock on {@code <sidecar>.lock}. Monitors are
 * keyed by the real path of the shard, so aliases of one shard share a
 * monitor. The sidecar is
 * written to a temporary file and moved into place atomically, so a reader
 * never observes a partial index.
 */
public class LineIndexer {

    private static final Logger logger = LoggerFactory.getLogger(LineIndexer.class);

    public static final String INDEX_SUFFIX = ".zindex";

    private static final ConcurrentMap<Path, Object> BUILD_LOCKS = new ConcurrentHashMap<>();

    private static final long LOCK_RETRY_MILLIS = 50;

    private final LineIndexBuilder builder;

    public LineIndexer() {
        this(new LineIndexBuilder());
    }

    public LineIndexer(LineIndexBuilder builder) {
        this.builder = builder;
    }

    public static Path sidecarFor(Path shard) {
        return shard.resolveSibling(shard.getFileName() + INDEX_SUFFIX);
    }

    /**
     * Returns a handle on the shard's index, reusing a valid sidecar and
     * (re)building it otherwise.
     *
     * @throws IOException if the shard cannot be read or the index cannot be
     *             built
     */
    public LineIndex ensureIndex(Path shard) throws IOException {
        if (!Files.isReadable(shard)) {
            throw new LineIndexException("Cannot read shard " + shard);
        }
        Path sidecar = sidecarFor(shard).toAbsolutePath().normalize();
        Object monitor = BUILD_LOCKS.computeIfAbsent(sidecarFor(shard.toRealPath()), k -> new Object());
        synchronized (monitor) {
            LineIndex existing = openIfValid(shard, sidecar);
            if (existing != null) {
                return existing;
            }
            Path lockFile = sidecar.resolveSibling(sidecar.getFileName() + ".lock");
            try (FileChannel lockChannel = FileChannel.open(lockFile, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE);
                    FileLock lock = acquire(lockChannel, lockFile)) {
                // another process may have finished the build while we waited
                existing = openIfValid(shard, sidecar);
                if (existing != null) {
                    return existing;
                }
                Path tmp = Files.createTempFile(sidecar.getParent(), sidecar.getFileName().toString(), ".tmp");
                try {
                    builder.build(shard, tmp);
                    Files.move(tmp, sidecar, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } finally {
                    Files.deleteIfExists(tmp);
                }
            }
            logger.debug("Created index {} for {}", sidecar, shard);
            return LineIndex.open(shard, sidecar);
        }
    }

    /**
     * Blocks until the exclusive lock is held. Another channel of this JVM
     * holding the lock is waited out like another process would be.
     */
    private static FileLock acquire(FileChannel channel, Path lockFile) throws IOException {
        while (true) {
            try {
                return channel.lock();
            } catch (OverlappingFileLockException e) {
                logger.debug("Waiting for {} held elsewhere in this JVM", lockFile);
                try {
                    Thread.sleep(LOCK_RETRY_MILLIS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new LineIndexException("Interrupted while waiting for " + lockFile, ie);
                }
            }
        }
    }

    private LineIndex openIfValid(Path shard, Path sidecar) throws IOException {
        if (!Files.exists(sidecar)) {
            return null;
        }
        try {
            return LineIndex.open(shard, sidecar);
        } catch (IndexInvalidException e) {
            logger.warn("Rebuilding index for {}: {}", shard, e.getMessage());
            Files.deleteIfExists(sidecar);
            return null;
        }
    }
}
