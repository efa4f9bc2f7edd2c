package com.splitttr.canvas.crdt;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Binary frame shared by updates and snapshots: {@code {"v":1,"entries":[...]}} in CBOR.
 */
final class DeltaCodec {

    static final int FORMAT_VERSION = 1;

    private static final CBORMapper mapper = CBORMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    record Frame(int v, List<LwwEntry> entries) {}

    private DeltaCodec() {
    }

    static byte[] encode(Collection<LwwEntry> entries) {
        try {
            return mapper.writeValueAsBytes(new Frame(FORMAT_VERSION, new ArrayList<>(entries)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode canvas entries", e);
        }
    }

    static List<LwwEntry> decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MalformedUpdateException("Empty update");
        }
        Frame frame;
        try {
            frame = mapper.readValue(bytes, Frame.class);
        } catch (IOException e) {
            throw new MalformedUpdateException("Update is not a canvas frame", e);
        }
        if (frame == null || frame.v() != FORMAT_VERSION) {
            throw new MalformedUpdateException("Unsupported update format");
        }
        if (frame.entries() == null) {
            throw new MalformedUpdateException("Update has no entries");
        }
        for (LwwEntry entry : frame.entries()) {
            validate(entry);
        }
        return frame.entries();
    }

    private static void validate(LwwEntry entry) {
        if (entry == null) {
            throw new MalformedUpdateException("Null entry");
        }
        if (entry.key() == null || entry.key().isEmpty()) {
            throw new MalformedUpdateException("Entry without key");
        }
        if (entry.replica() == null || entry.replica().isEmpty()) {
            throw new MalformedUpdateException("Entry " + entry.key() + " without replica");
        }
        if (entry.clock() < 0 || entry.clock() > LwwEntry.MAX_CLOCK) {
            throw new MalformedUpdateException("Entry " + entry.key() + " has a clock out of range");
        }
        if (!entry.deleted() && entry.value() == null) {
            throw new MalformedUpdateException("Entry " + entry.key() + " has no value");
        }
    }
}
