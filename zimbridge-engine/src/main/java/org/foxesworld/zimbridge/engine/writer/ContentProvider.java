package org.foxesworld.zimbridge.engine.writer;

/**
 * Streams the content of one entry.
 *
 * <p>The engine calls {@link #getSize()} once, then {@link #feed()} until it returns an empty
 * blob. The bytes fed must add up to the declared size. One provider is drained by one worker;
 * calls on the same provider are never concurrent.</p>
 */
public interface ContentProvider extends AutoCloseable {

    long getSize();

    /** Next chunk; an empty blob signals end of stream. */
    Blob feed();

    /** Called by the engine once the provider is drained or abandoned. */
    @Override
    default void close() {
    }
}
