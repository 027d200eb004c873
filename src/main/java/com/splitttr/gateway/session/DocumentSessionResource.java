package com.splitttr.gateway.session;

import com.splitttr.gateway.contents.ContentNotFoundException;
import com.splitttr.gateway.security.AuthService;
import io.quarkus.security.Authenticated;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

/**
 * Creates a new session for a given document or returns the existing one.
 */
@Authenticated
@Path("/api/collaboration/session")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DocumentSessionResource {

    private static final Logger LOG = Logger.getLogger(DocumentSessionResource.class);

    @Inject
    DocumentSessionService sessionService;

    @Inject
    AuthService authService;

    @PUT
    @Path("/{path: .+}")
    public Response open(@PathParam("path") String path, SessionRequest request) {
        if (request == null || request.format() == null || request.type() == null) {
            throw new BadRequestException("Both 'format' and 'type' are required");
        }
        LOG.debugf("Session requested for %s by %s", path, authService.getCurrentUserName());
        try {
            DocumentSessionService.Outcome outcome = sessionService.open(path, request.format(), request.type());
            return Response.status(outcome.created() ? Response.Status.CREATED : Response.Status.OK)
                    .entity(outcome.session())
                    .build();
        } catch (ContentNotFoundException e) {
            throw new NotFoundException("File '" + path + "' does not exist", e);
        }
    }
}
