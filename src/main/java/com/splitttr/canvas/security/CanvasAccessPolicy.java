package com.splitttr.canvas.security;

/**
 * Decides whether an authenticated user may open a canvas. The decision belongs
 * to the canvas service; this is the seam it plugs into.
 */
public interface CanvasAccessPolicy {

    boolean canJoin(String userId, String canvasId);
}
