package org.foxesworld.zimbridge.script.reader;

import org.foxesworld.zimbridge.core.Wrapper;
import org.foxesworld.zimbridge.engine.reader.Entry;
import org.graalvm.polyglot.HostAccess;

public final class ScriptEntry {

    private final Wrapper<Entry> entry;

    public ScriptEntry(Entry entry) {
        this.entry = Wrapper.of(entry);
    }

    @HostAccess.Export
    public String path() {
        return entry.map(Entry::getPath);
    }

    @HostAccess.Export
    public String title() {
        return entry.map(Entry::getTitle);
    }

    @HostAccess.Export
    public boolean isRedirect() {
        return entry.map(Entry::isRedirect);
    }

    @HostAccess.Export
    public int index() {
        return entry.map(Entry::getIndex);
    }

    /** The item behind this entry, following redirects. */
    @HostAccess.Export
    public ScriptItemView item() {
        return new ScriptItemView(entry.map(Entry::getItem));
    }

    @HostAccess.Export
    public ScriptEntry redirectEntry() {
        return new ScriptEntry(entry.map(Entry::getRedirectEntry));
    }

    @Override
    public String toString() {
        return "ScriptEntry{" + entry.get() + '}';
    }
}
