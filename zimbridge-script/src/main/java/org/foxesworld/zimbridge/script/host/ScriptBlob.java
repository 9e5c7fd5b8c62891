package org.foxesworld.zimbridge.script.host;

import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.writer.Blob;
import org.graalvm.polyglot.HostAccess;

import java.nio.ByteBuffer;

/**
 * An engine {@link Blob} as seen from JS. Returned from a content provider's {@code feed()}, it
 * is handed to the engine as is, without re-reading guest memory.
 */
public final class ScriptBlob {

    private final Wrapper<Blob> blob;

    public ScriptBlob(Blob blob) {
        this.blob = Wrapper.of(blob);
    }

    public Blob blob() {
        return blob.get();
    }

    @HostAccess.Export
    public int size() {
        return blob.map(Blob::size);
    }

    @HostAccess.Export
    public String text() {
        return blob.map(Blob::text);
    }

    /** Unsigned byte value. */
    @HostAccess.Export
    public int byteAt(int index) {
        return blob.get().data().get(index) & 0xFF;
    }

    /** Read-only buffer over the same memory. */
    @HostAccess.Export
    public ByteBuffer buffer() {
        return blob.get().data();
    }

    @Override
    public String toString() {
        return "ScriptBlob{size=" + size() + '}';
    }
}
