package com.splitttr.gateway.client;

import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

@RegisterRestClient(configKey = "contents-service")
@Path("/api/contents")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface ContentsClient {

    @GET
    @Path("/{path: .+}")
    ContentsPayload get(@PathParam("path") String path,
                        @QueryParam("format") String format,
                        @QueryParam("type") String type,
                        @QueryParam("content") int content);

    @PUT
    @Path("/{path: .+}")
    ContentsPayload save(@PathParam("path") String path, ContentsPayload model);
}
