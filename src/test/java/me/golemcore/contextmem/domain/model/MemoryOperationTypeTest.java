package me.golemcore.contextmem.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryOperationTypeTest {

    @Test
    void mapsAccessOperations() {
        assertEquals(MemoryOperationType.VIEW, MemoryOperationType.from(AccessOperation.VIEW));
        assertEquals(MemoryOperationType.CREATE, MemoryOperationType.from(AccessOperation.CREATE));
        assertEquals(MemoryOperationType.STR_REPLACE, MemoryOperationType.from(AccessOperation.UPDATE));
    }

    @Test
    void deleteAndRenameDoNotTouchContent() {
        assertTrue(MemoryOperationType.VIEW.touchesContent());
        assertTrue(MemoryOperationType.INSERT.touchesContent());
        assertFalse(MemoryOperationType.DELETE.touchesContent());
        assertFalse(MemoryOperationType.RENAME.touchesContent());
    }
}
