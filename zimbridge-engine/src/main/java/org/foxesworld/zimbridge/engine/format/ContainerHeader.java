package org.foxesworld.zimbridge.engine.format;

import org.foxesworld.zimbridge.engine.writer.Compression;

import java.util.UUID;

/** @param checksum stored MD5 of the file, {@code null} when the archive carries none */
public record ContainerHeader(UUID uuid, Compression compression, boolean indexed, String language, int mainTarget,
                              byte[] checksum) {

    public boolean hasChecksum() {
        return checksum != null;
    }
}
