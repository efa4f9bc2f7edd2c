package com.splitttr.canvas.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum EnvelopeType {
    SYNC("sync", true),
    UPDATE("update", true),
    AWARENESS("awareness", true),
    PING("ping", true),
    PONG("pong", true),
    // server -> client notices only, never accepted inbound
    ERROR("error", false);

    private final String wireName;
    private final boolean inbound;

    EnvelopeType(String wireName, boolean inbound) {
        this.wireName = wireName;
        this.inbound = inbound;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire discriminant against the closed set a client may send.
     */
    public static Optional<EnvelopeType> fromWire(String name) {
        for (EnvelopeType type : values()) {
            if (type.inbound && type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
