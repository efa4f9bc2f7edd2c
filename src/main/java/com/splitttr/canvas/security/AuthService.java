package com.splitttr.canvas.security;

import com.splitttr.canvas.config.CollabConfig;
import io.quarkus.runtime.LaunchMode;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;

@ApplicationScoped
public class AuthService {

    static final String DEV_IDENTITY_HEADER = "X-User-Email";

    @Inject
    JsonWebToken jwt;

    @Inject
    CollabConfig config;

    /**
     * Get the current user's id from the JWT subject.
     * Returns null if not authenticated.
     */
    public String getCurrentUserId() {
        try {
            return jwt.getSubject();
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * Verified identity for a connecting socket, or null. Outside prod mode the
     * dev header may stand in for a token when enabled.
     */
    public String resolveIdentity(WebSocketConnection connection) {
        String subject = getCurrentUserId();
        if (subject != null && !subject.isBlank()) {
            return subject;
        }
        if (config.auth().devHeaderEnabled() && LaunchMode.current() != LaunchMode.NORMAL) {
            String devIdentity = connection.handshakeRequest().header(DEV_IDENTITY_HEADER);
            if (devIdentity != null && !devIdentity.isBlank()) {
                return devIdentity.trim();
            }
        }
        return null;
    }
}
