package org.foxesworld.zimbridge.script.reader;

import org.foxesworld.zimbridge.core.BufferView;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;

/** One active view on item content. Reads fail once released. */
public final class ScriptBuffer {

    private final BufferView.View view;

    ScriptBuffer(BufferView.View view) {
        this.view = view;
    }

    @HostAccess.Export
    public int size() {
        return view.size();
    }

    /** Unsigned byte value. */
    @HostAccess.Export
    public int byteAt(int index) {
        return view.byteAt(index) & 0xFF;
    }

    @HostAccess.Export
    public String text() {
        return view.text();
    }

    /**
     * Array-like access to the bytes ({@code buf.bytes()[i]}, {@code .length}). Each element read
     * goes through this view, so the array stops working once the view is released.
     */
    @HostAccess.Export
    public ProxyArray bytes() {
        return new Bytes(view);
    }

    @HostAccess.Export
    public boolean isReleased() {
        return view.isReleased();
    }

    @HostAccess.Export
    public void release() {
        view.close();
    }

    private static final class Bytes implements ProxyArray {
        private final BufferView.View view;

        Bytes(BufferView.View view) {
            this.view = view;
        }

        @Override
        public Object get(long index) {
            if (index < 0 || index >= view.size()) throw new ArrayIndexOutOfBoundsException((int) index);
            return view.byteAt((int) index) & 0xFF;
        }

        @Override
        public void set(long index, Value value) {
            throw new UnsupportedOperationException("archive content is read-only");
        }

        @Override
        public long getSize() {
            return view.size();
        }
    }
}
