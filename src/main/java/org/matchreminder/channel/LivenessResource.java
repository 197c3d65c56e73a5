package org.matchreminder.channel;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

@Path("/")
public class LivenessResource {
    static final String LIVENESS_TEXT = "Match Reminder Bot is running!";

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    public String alive() {
        return LIVENESS_TEXT;
    }
}
