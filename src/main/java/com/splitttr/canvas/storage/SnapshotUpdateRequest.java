package com.splitttr.canvas.storage;

public record SnapshotUpdateRequest(byte[] state) {}
