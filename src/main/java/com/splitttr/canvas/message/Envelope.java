package com.splitttr.canvas.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * One wire message. Which payload field is set depends on {@link #type()}:
 * {@code sync} carries the snapshot bytes in {@code state}, {@code update} carries
 * the delta bytes in {@code update}, {@code awareness} carries an opaque
 * {@code state}, and {@code error} carries a human readable {@code message}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(
    EnvelopeType type,
    JsonNode state,
    JsonNode update,
    String message
) {

    public static Envelope sync(byte[] snapshot) {
        return new Envelope(EnvelopeType.SYNC, toByteArrayNode(snapshot), null, null);
    }

    public static Envelope update(byte[] delta) {
        return new Envelope(EnvelopeType.UPDATE, null, toByteArrayNode(delta), null);
    }

    public static Envelope update(JsonNode update) {
        return new Envelope(EnvelopeType.UPDATE, null, update, null);
    }

    public static Envelope awareness(JsonNode state) {
        return new Envelope(EnvelopeType.AWARENESS, state, null, null);
    }

    public static Envelope ping() {
        return new Envelope(EnvelopeType.PING, null, null, null);
    }

    public static Envelope pong() {
        return new Envelope(EnvelopeType.PONG, null, null, null);
    }

    public static Envelope error(String message) {
        return new Envelope(EnvelopeType.ERROR, null, null, message);
    }

    /**
     * The delta carried by an {@code update} envelope. The codec has already checked
     * that every element is a byte value.
     */
    @JsonIgnore
    public byte[] updateBytes() {
        return toBytes(update);
    }

    /**
     * The snapshot carried by a {@code sync} envelope.
     */
    @JsonIgnore
    public byte[] stateBytes() {
        return toBytes(state);
    }

    static ArrayNode toByteArrayNode(byte[] bytes) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(bytes.length);
        for (byte b : bytes) {
            array.add(b & 0xFF);
        }
        return array;
    }

    static boolean isByteArray(JsonNode node) {
        if (node == null || !node.isArray()) return false;
        for (JsonNode element : node) {
            if (!element.isIntegralNumber()) return false;
            int value = element.asInt();
            if (value < 0 || value > 255) return false;
        }
        return true;
    }

    private static byte[] toBytes(JsonNode node) {
        if (!isByteArray(node)) {
            throw new IllegalStateException("Payload is not a byte array");
        }
        byte[] bytes = new byte[node.size()];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) node.get(i).asInt();
        }
        return bytes;
    }
}
