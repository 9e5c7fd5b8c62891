package org.foxesworld.zimbridge.engine.format;

import java.util.List;

/**
 * Parsed directory of a container.
 *
 * @param dataStart absolute position of the data region in the file
 */
public record ContainerIndex(ContainerHeader header, List<DirEntry> entries, long dataStart, long dataLength) {

    /** Number of leading file bytes covered by the checksum. */
    public long checksummedLength() {
        return dataStart + dataLength;
    }
}
