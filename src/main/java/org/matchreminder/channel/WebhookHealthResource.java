package org.matchreminder.channel;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

/**
 * Reports the webhook registration: 200 while it matches, 503 with the current status otherwise.
 */
@Path("/health/webhook")
public class WebhookHealthResource {

    private final ChannelHealthMonitor monitor;

    public WebhookHealthResource(ChannelHealthMonitor monitor) {
        this.monitor = monitor;
    }

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    public Response status() {
        RegistrationStatus status = monitor.getStatus();
        Response.Status code = status == RegistrationStatus.MATCHED
                ? Response.Status.OK
                : Response.Status.SERVICE_UNAVAILABLE;
        return Response.status(code).entity(status.name()).build();
    }
}
