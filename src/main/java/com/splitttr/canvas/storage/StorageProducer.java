package com.splitttr.canvas.storage;

import com.splitttr.canvas.config.CollabConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * Picks where room snapshots live.
 *
 * canvas.collab.storage.provider:
 *  - memory (default, lost on restart)
 *  - file   (canvas.collab.storage.directory)
 *  - remote (canvas document service over REST)
 */
@ApplicationScoped
public class StorageProducer {

    private static final Logger log = Logger.getLogger(StorageProducer.class);

    @Inject
    CollabConfig config;

    @Inject
    @RestClient
    SnapshotClient snapshotClient;

    public String provider() {
        String provider = config.storage().provider();
        return provider == null ? "memory" : provider.trim().toLowerCase();
    }

    @Produces
    @Singleton
    public DurableStorage durableStorage() {
        String provider = provider();
        log.infof("Room snapshots use the %s storage provider", provider);
        return switch (provider) {
            case "file" -> new FileDurableStorage(config.storage().directory()
                .orElse(Path.of("data", "snapshots")));
            case "remote" -> new RemoteDurableStorage(snapshotClient);
            case "memory" -> new InMemoryDurableStorage();
            default -> throw new IllegalArgumentException("Unknown storage provider: " + provider);
        };
    }
}
