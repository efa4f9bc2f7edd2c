package com.splitttr.canvas.storage;

import java.util.Optional;

/**
 * Durable key/value storage for room snapshots. Rooms use their document id as the
 * key. Calls may block; rooms only make them from their own mailbox.
 */
public interface DurableStorage {

    /**
     * @throws StorageException if the backend cannot be read
     */
    Optional<byte[]> get(String key);

    /**
     * @throws StorageException if the write was not acknowledged
     */
    void put(String key, byte[] value);
}
