package com.splitttr.canvas.storage;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

import java.util.Optional;

/**
 * Keeps snapshots in the canvas document service, keyed by canvas id.
 */
public class RemoteDurableStorage implements DurableStorage {

    private final SnapshotClient client;

    public RemoteDurableStorage(SnapshotClient client) {
        this.client = client;
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            var snapshot = client.getSnapshot(key);
            if (snapshot == null || snapshot.state() == null || snapshot.state().length == 0) {
                return Optional.empty();
            }
            return Optional.of(snapshot.state());
        } catch (WebApplicationException e) {
            if (e.getResponse() != null && e.getResponse().getStatus() == Response.Status.NOT_FOUND.getStatusCode()) {
                return Optional.empty();
            }
            throw new StorageException("canvas-service rejected snapshot read for " + key, e);
        } catch (RuntimeException e) {
            throw new StorageException("canvas-service unreachable reading " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        try {
            client.putSnapshot(key, new SnapshotUpdateRequest(value));
        } catch (RuntimeException e) {
            throw new StorageException("Failed to store snapshot for " + key, e);
        }
    }
}
