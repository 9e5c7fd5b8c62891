package org.foxesworld.zimbridge.engine.writer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/** Streams a file from disk in fixed-size chunks. */
public final class FileProvider implements ContentProvider {

    private static final Logger log = LogManager.getLogger(FileProvider.class);

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

    private final Path path;
    private final int chunkSize;
    private final long size;

    private FileChannel channel;
    private boolean done;

    public FileProvider(Path path) {
        this(path, DEFAULT_CHUNK_SIZE);
    }

    public FileProvider(Path path, int chunkSize) {
        this.path = Objects.requireNonNull(path, "path");
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        this.chunkSize = chunkSize;
        try {
            this.size = Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + path, e);
        }
    }

    @Override
    public long getSize() {
        return size;
    }

    @Override
    public Blob feed() {
        if (done) return Blob.empty();
        try {
            if (channel == null) channel = FileChannel.open(path, StandardOpenOption.READ);

            ByteBuffer chunk = ByteBuffer.allocate(chunkSize);
            while (chunk.hasRemaining()) {
                if (channel.read(chunk) < 0) break;
            }
            chunk.flip();
            if (!chunk.hasRemaining()) {
                close();
                return Blob.empty();
            }
            return Blob.of(chunk);
        } catch (IOException e) {
            close();
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    @Override
    public void close() {
        done = true;
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close {}", path, e);
        } finally {
            channel = null;
        }
    }
}
