package com.splitttr.canvas.api;

import com.splitttr.canvas.room.CanvasRoom;
import com.splitttr.canvas.room.RoomDirectory;
import com.splitttr.canvas.room.RoomStatus;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Read-only view of the rooms open in this process.
 */
@Path("/api/rooms")
@Produces(MediaType.APPLICATION_JSON)
public class RoomResource {

    @Inject
    RoomDirectory rooms;

    @GET
    public CompletionStage<List<RoomStatus>> list() {
        List<CompletableFuture<RoomStatus>> statuses = rooms.rooms().stream()
            .map(room -> room.describe().toCompletableFuture())
            .toList();
        return CompletableFuture.allOf(statuses.toArray(CompletableFuture[]::new))
            .thenApply(ignored -> statuses.stream().map(CompletableFuture::join).toList());
    }

    @GET
    @Path("/{id}")
    public CompletionStage<RoomStatus> get(@PathParam("id") String id) {
        CanvasRoom room = rooms.find(id).orElseThrow(() -> new RoomNotFoundException(id));
        return room.describe();
    }

    public static class RoomNotFoundException extends RuntimeException {
        public RoomNotFoundException(String id) { super("No open room for canvas " + id); }
    }
}
