package org.sqlgate.resources;

import org.sqlgate.dto.PolicyView;
import org.sqlgate.guard.GuardPolicy;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

@Path("/policy")
@Produces(MediaType.APPLICATION_JSON)
public class PolicyResource {
    // Policy is immutable, so the view is built once
    private final PolicyView view;

    public PolicyResource(GuardPolicy policy) {
        this.view = PolicyView.of(policy);
    }

    @GET
    public PolicyView policy() {
        return view;
    }
}
