package org.foxesworld.zimbridge.engine.format;

import org.foxesworld.zimbridge.engine.writer.Hint;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/**
 * Layout of the archive container.
 *
 * <pre>
 * int    magic
 * short  version
 * long   uuid msb, long uuid lsb
 * byte   compression ordinal
 * byte   flags (bit 0: full-text indexed, bit 1: checksum trailer)
 * str    indexing language
 * int    main entry target id, -1 when unset
 * int    entry count
 * entry* kind, path, title, mimetype, hint flags, offset, length, target, index record
 * long   data length
 * byte*  data
 * byte16 MD5 of every byte before it, when flagged
 * </pre>
 * Strings are an int byte length followed by UTF-8. All numbers are big-endian.
 */
public final class ContainerFormat {

    public static final int MAGIC = 0x4B5A494D; // "KZIM"
    public static final short VERSION = 1;

    static final int FLAG_INDEXED = 1;
    static final int FLAG_CHECKSUM = 2;

    public static final int CHECKSUM_LENGTH = 16;

    private ContainerFormat() {
    }

    public static MessageDigest checksumDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }

    /** Hints with a non-zero value are set. */
    public static int hintFlags(Map<Hint, Long> hints) {
        int flags = 0;
        if (hints == null) return flags;
        for (Map.Entry<Hint, Long> e : hints.entrySet()) {
            if (e.getKey() != null && e.getValue() != null && e.getValue() != 0L) flags |= e.getKey().flag();
        }
        return flags;
    }
}
