package org.foxesworld.zimbridge.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorRecordTest {

    @Test
    void clearRecordDoesNotRaise() {
        ErrorRecord err = new ErrorRecord();

        assertFalse(err.isSet());
        assertDoesNotThrow(err::raiseIfSet);
    }

    @Test
    void firstFailureWins() {
        ErrorRecord err = new ErrorRecord();
        err.set(ErrorKind.FOREIGN_RAISED, "Error: disk on fire");
        err.set(ErrorKind.EMPTY_RESULT, "later");

        BridgeException e = assertThrows(BridgeException.class, err::raiseIfSet);
        assertEquals(ErrorKind.FOREIGN_RAISED, e.kind());
        assertEquals("Error: disk on fire", e.detail());
        assertTrue(e.getMessage().contains("disk on fire"));
        assertFalse(err.isSet());
    }
}
