package com.splitttr.canvas.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.canvas.message.EnvelopeException.Reason;

/**
 * Parses, validates and serializes wire envelopes. Stateless apart from the size
 * bound, so one instance is shared by every room.
 */
public class EnvelopeCodec {

    public static final int DEFAULT_MAX_MESSAGE_BYTES = 2 * 1024 * 1024;
    public static final String TOO_LARGE_MESSAGE = "Message too large";

    private static final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final int maxMessageBytes;

    public EnvelopeCodec() {
        this(DEFAULT_MAX_MESSAGE_BYTES);
    }

    public EnvelopeCodec(int maxMessageBytes) {
        if (maxMessageBytes <= 0) {
            throw new IllegalArgumentException("maxMessageBytes must be positive");
        }
        this.maxMessageBytes = maxMessageBytes;
    }

    public int maxMessageBytes() {
        return maxMessageBytes;
    }

    public Envelope decode(String raw) {
        if (raw == null) {
            throw new EnvelopeException(Reason.MALFORMED, "Empty frame");
        }
        checkSize(utf8Length(raw));

        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new EnvelopeException(Reason.MALFORMED, "Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeException(Reason.MALFORMED, "Frame is not a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new EnvelopeException(Reason.MALFORMED, "Missing type");
        }
        EnvelopeType type = EnvelopeType.fromWire(typeNode.asText())
            .orElseThrow(() -> new EnvelopeException(Reason.UNKNOWN_TYPE, "Unknown type: " + typeNode.asText()));

        return switch (type) {
            case UPDATE -> {
                JsonNode update = root.get("update");
                if (!Envelope.isByteArray(update)) {
                    throw new EnvelopeException(Reason.MALFORMED, "update payload must be a byte array");
                }
                yield Envelope.update(update);
            }
            case AWARENESS -> {
                JsonNode state = root.get("state");
                if (state == null || state.isNull()) {
                    throw new EnvelopeException(Reason.MALFORMED, "awareness payload missing");
                }
                yield Envelope.awareness(state);
            }
            case SYNC -> new Envelope(EnvelopeType.SYNC, root.get("state"), null, null);
            case PING -> Envelope.ping();
            case PONG -> Envelope.pong();
            default -> throw new EnvelopeException(Reason.UNKNOWN_TYPE, "Unknown type: " + type.wireName());
        };
    }

    /**
     * Binary frames carry no envelope. They are size checked so an oversized one
     * still earns a notice, and are otherwise ignored.
     */
    public void checkBinary(int length) {
        checkSize(length);
    }

    public String encode(Envelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + envelope.type() + " envelope", e);
        }
    }

    private void checkSize(long bytes) {
        if (bytes > maxMessageBytes) {
            throw new EnvelopeException(Reason.TOO_LARGE, TOO_LARGE_MESSAGE);
        }
    }

    private long utf8Length(String raw) {
        int chars = raw.length();
        // a char is 1 to 3 UTF-8 bytes, so most frames never need the full count
        if (chars > maxMessageBytes || (long) chars * 3 <= maxMessageBytes) {
            return chars;
        }
        long bytes = 0;
        for (int i = 0; i < chars; i++) {
            char c = raw.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < chars && Character.isLowSurrogate(raw.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }
}
