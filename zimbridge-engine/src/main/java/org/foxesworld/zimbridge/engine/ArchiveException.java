package org.foxesworld.zimbridge.engine;

/** Raised by the archive engine itself (bad input, incoherent content, unreadable file). */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
