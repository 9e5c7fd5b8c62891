package org.foxesworld.zimbridge.script.host;

import org.foxesworld.zimbridge.engine.writer.ContentProvider;
import org.graalvm.polyglot.HostAccess;

import java.util.Objects;

/**
 * A host-implemented content provider exposed to JS ({@code zim.StringProvider},
 * {@code zim.FileProvider}). When a script returns one from {@code get_contentprovider}, the
 * engine drains the host provider directly and never dispatches back into the script.
 */
public final class HostContentProvider {

    private final ContentProvider provider;

    public HostContentProvider(ContentProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public ContentProvider provider() {
        return provider;
    }

    @HostAccess.Export
    public long get_size() {
        return provider.getSize();
    }

    @HostAccess.Export
    public ScriptBlob feed() {
        return new ScriptBlob(provider.feed());
    }
}
