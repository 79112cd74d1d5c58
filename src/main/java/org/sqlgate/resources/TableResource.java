package org.sqlgate.resources;

import org.sqlgate.dto.TableDescription;
import org.sqlgate.repo.SchemaInspector;

import javax.ws.rs.GET;
import javax.ws.rs.NotFoundException;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;
import java.sql.SQLException;
import java.util.List;

// Tables the agent may reference, so it can plan queries the whitelist will accept
@Path("/tables")
@Produces(MediaType.APPLICATION_JSON)
public class TableResource {
    private final SchemaInspector inspector;

    public TableResource(SchemaInspector inspector) {
        this.inspector = inspector;
    }

    @GET
    public List<String> tables() throws SQLException {
        return inspector.listTables();
    }

    // Unlisted and missing tables both answer 404
    @GET
    @Path("/{name}")
    public TableDescription describe(@PathParam("name") String name) throws SQLException {
        return inspector.describe(name)
                .orElseThrow(() -> new NotFoundException("table " + name + " not found"));
    }
}
