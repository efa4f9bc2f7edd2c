package com.splitttr.canvas.storage;

import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

@RegisterRestClient(configKey = "canvas-service")
@Path("/api/canvases")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface SnapshotClient {

    @GET
    @Path("/{id}/snapshot")
    SnapshotResponse getSnapshot(@PathParam("id") String id);

    @PUT
    @Path("/{id}/snapshot")
    SnapshotResponse putSnapshot(@PathParam("id") String id, SnapshotUpdateRequest req);
}
