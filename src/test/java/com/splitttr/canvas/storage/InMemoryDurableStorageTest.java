package com.splitttr.canvas.storage;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDurableStorageTest {

    @Test
    void storesCopiesSoCallersCannotMutateSnapshots() {
        var storage = new InMemoryDurableStorage();
        byte[] value = {1, 2, 3};

        storage.put("doc-1", value);
        value[0] = 42;
        storage.get("doc-1").orElseThrow()[1] = 42;

        assertArrayEquals(new byte[] {1, 2, 3}, storage.get("doc-1").orElseThrow());
        assertEquals(Set.of("doc-1"), storage.keys());
    }
}
