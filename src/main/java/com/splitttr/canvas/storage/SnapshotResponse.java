package com.splitttr.canvas.storage;

import java.time.Instant;

// state travels base64 encoded
public record SnapshotResponse(
    String id,
    byte[] state,
    Instant updatedAt,
    long version
) {}
