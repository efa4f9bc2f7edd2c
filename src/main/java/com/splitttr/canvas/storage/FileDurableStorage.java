package com.splitttr.canvas.storage;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.Optional;

/**
 * One file per key under a directory. Writes go to a temp file that replaces the
 * target, so a reader never sees a half written snapshot.
 */
public class FileDurableStorage implements DurableStorage {

    private static final Logger log = Logger.getLogger(FileDurableStorage.class);
    private static final String SUFFIX = ".snapshot";

    private final Path directory;

    public FileDurableStorage(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + directory, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        Path target = fileFor(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "put-", ".tmp");
            Files.write(temp, value);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageException("Failed to write " + key, e);
        }
    }

    public Path directory() {
        return directory;
    }

    // keys are document ids, so encode them rather than trust them as file names
    Path fileFor(String key) {
        String name = Base64.getUrlEncoder().withoutPadding()
            .encodeToString(key.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(name + SUFFIX);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debugf(e, "Could not remove temp file %s", temp);
        }
    }
}
