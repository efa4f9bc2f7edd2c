package com.splitttr.canvas.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

public class ExceptionMappers {

    public record ErrorBody(String error) {}

    @Provider
    public static class RoomNotFoundMapper implements ExceptionMapper<RoomResource.RoomNotFoundException> {
        @Override
        public Response toResponse(RoomResource.RoomNotFoundException e) {
            return Response.status(404).type(MediaType.APPLICATION_JSON).entity(new ErrorBody(e.getMessage())).build();
        }
    }
}
