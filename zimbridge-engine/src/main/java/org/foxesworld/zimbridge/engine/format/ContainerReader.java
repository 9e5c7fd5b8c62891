package org.foxesworld.zimbridge.engine.format;

import org.foxesworld.zimbridge.engine.ArchiveException;
import org.foxesworld.zimbridge.engine.writer.Compression;
import org.foxesworld.zimbridge.engine.writer.GeoPosition;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class ContainerReader {

    private ContainerReader() {
    }

    public static ContainerIndex read(ByteBuffer file) {
        ByteBuffer in = file.duplicate();
        try {
            if (in.getInt() != ContainerFormat.MAGIC) throw new ArchiveException("Not an archive: bad magic");
            short version = in.getShort();
            if (version != ContainerFormat.VERSION) throw new ArchiveException("Unsupported archive version " + version);

            UUID uuid = new UUID(in.getLong(), in.getLong());
            Compression compression = Compression.fromOrdinal(in.get());
            byte flags = in.get();
            boolean indexed = (flags & ContainerFormat.FLAG_INDEXED) != 0;
            boolean checksummed = (flags & ContainerFormat.FLAG_CHECKSUM) != 0;
            String language = readString(in);
            int mainTarget = in.getInt();
            int count = in.getInt();
            if (count < 0) throw new ArchiveException("Corrupt directory: negative entry count");

            List<DirEntry> entries = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                EntryKind kind = EntryKind.fromCode(in.get());
                String path = readString(in);
                String title = readString(in);
                String mimetype = readString(in);
                int hints = in.getInt();
                long offset = in.getLong();
                long length = in.getLong();
                int target = in.getInt();
                IndexRecord index = readIndex(in);
                entries.add(new DirEntry(i, kind, path, title, mimetype, offset, length, hints, target, index));
            }

            long dataLength = in.getLong();
            long dataStart = in.position();
            long trailer = checksummed ? ContainerFormat.CHECKSUM_LENGTH : 0;
            if (dataLength < 0 || dataStart + dataLength + trailer > in.limit()) {
                throw new ArchiveException("Truncated archive: data region incomplete");
            }
            byte[] checksum = null;
            if (checksummed) {
                checksum = new byte[ContainerFormat.CHECKSUM_LENGTH];
                in.position((int) (dataStart + dataLength));
                in.get(checksum);
            }

            for (DirEntry e : entries) {
                if (e.offset() < 0 || e.length() < 0 || e.offset() + e.length() > dataLength) {
                    throw new ArchiveException("Corrupt entry '" + e.path() + "': content out of bounds");
                }
                if (e.isRedirect() && (e.target() < 0 || e.target() >= count)) {
                    throw new ArchiveException("Corrupt redirect '" + e.path() + "'");
                }
            }

            ContainerHeader header = new ContainerHeader(uuid, compression, indexed, language, mainTarget, checksum);
            return new ContainerIndex(header, List.copyOf(entries), dataStart, dataLength);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new ArchiveException("Corrupt archive directory", e);
        }
    }

    private static IndexRecord readIndex(ByteBuffer in) {
        if (in.get() == 0) return null;
        String title = readString(in);
        String keywords = readString(in);
        int wordCount = in.getInt();
        int contentLength = in.getInt();
        GeoPosition position = null;
        if (in.get() != 0) position = new GeoPosition(in.getDouble(), in.getDouble());
        return new IndexRecord(title, keywords, wordCount, contentLength, position);
    }

    private static String readString(ByteBuffer in) {
        int len = in.getInt();
        if (len < 0 || len > in.remaining()) throw new ArchiveException("Corrupt string length " + len);
        byte[] b = new byte[len];
        in.get(b);
        return new String(b, StandardCharsets.UTF_8);
    }
}
