package org.epistula.backup.controller;

import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.epistula.backup.service.SchemaLifecycleService;

import java.util.Map;

@Slf4j
@Path("/api/v1/tenants")
@Produces(MediaType.APPLICATION_JSON)
public class TenantController {

    private final SchemaLifecycleService lifecycleService;

    public TenantController(SchemaLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @GET
    @Path("/{tenantId}/lifecycle")
    public Response lifecycleState(@PathParam("tenantId") int tenantId) {
        return Response.ok(Map.of("tenantId", tenantId, "state", lifecycleService.currentState(tenantId))).build();
    }

    @DELETE
    @Path("/{tenantId}")
    @Operation(summary = "Delete a tenant, its schemas and its snapshots")
    public Response deleteTenant(@PathParam("tenantId") int tenantId) {
        log.info("Deletion of tenant {} requested", tenantId);
        return Response.ok(lifecycleService.deleteTenant(tenantId)).build();
    }
}
