package org.foxesworld.zimbridge.engine.format;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.engine.writer.Compression;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Serializes a finished entry set. Not thread-safe; used once per archive. */
public final class ContainerWriter {

    private static final Logger log = LogManager.getLogger(ContainerWriter.class);

    private static final Comparator<WriteEntry> ORDER = Comparator
            .comparing((WriteEntry e) -> e.kind() == EntryKind.METADATA)
            .thenComparing(WriteEntry::path);

    private final UUID uuid;
    private final Compression compression;
    private final boolean indexed;
    private final String language;
    private final String mainPath;
    private final boolean checksum;

    public ContainerWriter(UUID uuid, Compression compression, boolean indexed, String language, String mainPath) {
        this(uuid, compression, indexed, language, mainPath, true);
    }

    /** @param checksum whether to append an MD5 trailer over the whole file */
    public ContainerWriter(UUID uuid, Compression compression, boolean indexed, String language, String mainPath,
                           boolean checksum) {
        this.uuid = uuid;
        this.compression = compression;
        this.indexed = indexed;
        this.language = language == null ? "" : language;
        this.mainPath = mainPath;
        this.checksum = checksum;
    }

    /** @return the number of directory entries written */
    public int write(OutputStream target, List<WriteEntry> input) throws IOException {
        List<WriteEntry> entries = new ArrayList<>(input.size());
        for (WriteEntry e : input) {
            if (e != null) entries.add(e);
        }
        entries.sort(ORDER);

        // redirects with a dangling target are dropped before ids are assigned
        Map<String, WriteEntry> byPath = new HashMap<>();
        for (WriteEntry e : entries) {
            if (e.kind() != EntryKind.METADATA) byPath.put(e.path(), e);
        }
        entries.removeIf(e -> {
            if (e.kind() != EntryKind.REDIRECT || byPath.containsKey(e.targetPath())) return false;
            log.warn("[zim] Skipping redirect '{}': target '{}' does not exist", e.path(), e.targetPath());
            return true;
        });

        Map<String, Integer> ids = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            WriteEntry e = entries.get(i);
            if (e.kind() != EntryKind.METADATA) ids.put(e.path(), i);
        }

        int mainTarget = -1;
        if (mainPath != null) {
            mainTarget = ids.getOrDefault(mainPath, -1);
            if (mainTarget < 0) log.warn("[zim] Main path '{}' does not exist, archive has no main entry", mainPath);
        }

        // data layout: one slot per distinct content array
        Map<byte[], Long> offsets = new IdentityHashMap<>();
        List<byte[]> blocks = new ArrayList<>();
        long dataLength = 0;
        for (WriteEntry e : entries) {
            byte[] c = e.content();
            if (c == null || offsets.containsKey(c)) continue;
            offsets.put(c, dataLength);
            blocks.add(c);
            dataLength += c.length;
        }

        MessageDigest digest = checksum ? ContainerFormat.checksumDigest() : null;
        DataOutputStream out = new DataOutputStream(digest == null ? target : new DigestOutputStream(target, digest));
        out.writeInt(ContainerFormat.MAGIC);
        out.writeShort(ContainerFormat.VERSION);
        out.writeLong(uuid.getMostSignificantBits());
        out.writeLong(uuid.getLeastSignificantBits());
        out.writeByte(compression.ordinal());
        int flags = (indexed ? ContainerFormat.FLAG_INDEXED : 0) | (checksum ? ContainerFormat.FLAG_CHECKSUM : 0);
        out.writeByte(flags);
        writeString(out, language);
        out.writeInt(mainTarget);
        out.writeInt(entries.size());

        for (WriteEntry e : entries) {
            out.writeByte(e.kind().ordinal());
            writeString(out, e.path());
            writeString(out, e.title());
            writeString(out, e.mimetype());
            out.writeInt(e.hintFlags());
            byte[] c = e.content();
            out.writeLong(c == null ? 0L : offsets.get(c));
            out.writeLong(c == null ? 0L : c.length);
            out.writeInt(e.kind() == EntryKind.REDIRECT ? ids.get(e.targetPath()) : -1);
            writeIndex(out, e.index());
        }

        out.writeLong(dataLength);
        for (byte[] b : blocks) out.write(b);
        out.flush();
        if (digest != null) {
            target.write(digest.digest());
            target.flush();
        }

        log.debug("[zim] Wrote {} entries, {} data bytes", entries.size(), dataLength);
        return entries.size();
    }

    private static void writeIndex(DataOutputStream out, IndexRecord r) throws IOException {
        if (r == null) {
            out.writeByte(0);
            return;
        }
        out.writeByte(1);
        writeString(out, r.title());
        writeString(out, r.keywords());
        out.writeInt(r.wordCount());
        out.writeInt(r.contentLength());
        if (r.position() == null) {
            out.writeByte(0);
        } else {
            out.writeByte(1);
            out.writeDouble(r.position().latitude());
            out.writeDouble(r.position().longitude());
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }
}
