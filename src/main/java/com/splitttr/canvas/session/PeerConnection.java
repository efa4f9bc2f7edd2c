package com.splitttr.canvas.session;

import java.util.concurrent.CompletionStage;

/**
 * The transport side of a session. Sends never block; a failed delivery completes
 * the returned stage exceptionally.
 */
public interface PeerConnection {

    String id();

    boolean isOpen();

    CompletionStage<Void> send(String frame);

    void close(int code, String reason);
}
