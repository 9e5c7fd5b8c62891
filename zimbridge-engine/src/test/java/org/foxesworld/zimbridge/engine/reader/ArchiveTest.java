package org.foxesworld.zimbridge.engine.reader;

import org.foxesworld.zimbridge.engine.ArchiveException;
import org.foxesworld.zimbridge.engine.format.ContainerWriter;
import org.foxesworld.zimbridge.engine.format.EntryKind;
import org.foxesworld.zimbridge.engine.format.WriteEntry;
import org.foxesworld.zimbridge.engine.writer.Blob;
import org.foxesworld.zimbridge.engine.writer.Compression;
import org.foxesworld.zimbridge.engine.writer.Creator;
import org.foxesworld.zimbridge.engine.writer.StringProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveTest {

    @TempDir
    Path dir;

    Path file;

    @BeforeEach
    void build() throws IOException {
        file = dir.resolve("read.zim");
        Creator creator = new Creator();
        creator.startCreation(file);
        for (String p : new String[]{"c", "a", "b"}) {
            creator.addMetadata("meta-" + p, p.toUpperCase());
            creator.addRedirection("r" + p, "", p, null);
        }
        creator.addItem(new SimpleItem("a", "Alpha", "aaa"));
        creator.addItem(new SimpleItem("b", "Beta", "bbbb"));
        creator.addItem(new SimpleItem("c", "", "c"));
        creator.finishCreation();
    }

    @Test
    void entriesAreOrderedByPath() throws IOException {
        try (Archive archive = Archive.open(file)) {
            assertEquals(6, archive.getEntryCount());
            assertEquals(9, archive.getAllEntryCount());
            assertEquals("a", archive.getEntryById(0).getPath());
            assertEquals("rc", archive.getEntryById(5).getPath());
            assertEquals(1, archive.getEntryByPath("b").getIndex());
            assertThrows(ArchiveException.class, () -> archive.getEntryById(6));
            assertThrows(ArchiveException.class, () -> archive.getEntryByPath("zzz"));
            assertFalse(archive.hasMainEntry());
        }
    }

    @Test
    void dataIsAReadOnlySliceOfTheMapping() throws IOException {
        try (Archive archive = Archive.open(file)) {
            Item item = archive.getEntryByPath("b").getItem();
            assertEquals(4, item.getSize());

            Blob data = item.getData();
            ByteBuffer buf = data.data();
            assertTrue(buf.isReadOnly());
            assertEquals(0, buf.position());
            assertEquals(4, buf.remaining());
            assertThrows(ReadOnlyBufferException.class, () -> buf.put(0, (byte) 'x'));
            assertEquals("bbbb", data.text());
        }
    }

    @Test
    void slicesOutliveTheArchiveHandle() throws IOException {
        Blob data;
        Archive archive = Archive.open(file);
        data = archive.getEntryByPath("a").getItem().getData();
        archive.close();

        assertEquals("aaa", data.text());
        assertThrows(IllegalStateException.class, () -> archive.getEntryByPath("a"));
    }

    @Test
    void titleFallsBackToPath() throws IOException {
        try (Archive archive = Archive.open(file)) {
            assertEquals("c", archive.getEntryByPath("c").getTitle());
            assertTrue(archive.hasEntryByTitle("Beta"));
            assertEquals("C", new String(archive.getMetadata("meta-c")));
        }
    }

    @Test
    void checksumIsWrittenAtFinish() throws IOException {
        try (Archive archive = Archive.open(file)) {
            assertTrue(archive.hasChecksum());
            String checksum = archive.getChecksum();
            assertTrue(checksum.matches("[0-9a-f]{32}"), checksum);
            assertNotEquals(archive.getUuid().toString().replace("-", ""), checksum);
            assertTrue(archive.check());
            assertFalse(archive.hasTitleIndex());
        }
    }

    @Test
    void corruptedContentFailsCheck() throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        // last data byte, just before the 16-byte trailer
        bytes[bytes.length - 17] ^= 0x55;
        Path damaged = dir.resolve("damaged.zim");
        Files.write(damaged, bytes);

        try (Archive archive = Archive.open(damaged)) {
            assertTrue(archive.hasChecksum());
            assertFalse(archive.check());
        }
    }

    @Test
    void archiveWithoutChecksumNeverChecksOut() throws IOException {
        Path bare = dir.resolve("bare.zim");
        byte[] content = "x".getBytes();
        try (OutputStream out = Files.newOutputStream(bare)) {
            new ContainerWriter(UUID.randomUUID(), Compression.NONE, false, "", null, false).write(out, List.of(
                    new WriteEntry(EntryKind.ITEM, "x", "X", "text/plain", content, 0, null, null)));
        }

        try (Archive archive = Archive.open(bare)) {
            assertFalse(archive.hasChecksum());
            assertEquals("", archive.getChecksum());
            assertFalse(archive.check());
            assertEquals("x", archive.getEntryByPath("x").getItem().getData().text());
        }
    }

    @Test
    void truncatedChecksumIsRejected() throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        Path cut = dir.resolve("cut.zim");
        Files.write(cut, Arrays.copyOf(bytes, bytes.length - 4));
        assertThrows(ArchiveException.class, () -> Archive.open(cut));
    }

    @Test
    void rejectsForeignFiles() throws IOException {
        Path junk = dir.resolve("junk.zim");
        Files.write(junk, "definitely not an archive".getBytes());
        assertThrows(ArchiveException.class, () -> Archive.open(junk));
    }

    private record SimpleItem(String path, String title, String content)
            implements org.foxesworld.zimbridge.engine.writer.Item {
        @Override public String getPath() { return path; }
        @Override public String getTitle() { return title; }
        @Override public String getMimeType() { return "text/plain"; }
        @Override public org.foxesworld.zimbridge.engine.writer.ContentProvider getContentProvider() {
            return new StringProvider(content);
        }
    }
}
