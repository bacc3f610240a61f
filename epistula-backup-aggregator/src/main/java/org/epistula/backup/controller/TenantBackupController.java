package org.epistula.backup.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.epistula.backup.dto.BulkDeletionRequest;
import org.epistula.backup.dto.SchedulerStatus;
import org.epistula.backup.dto.SnapshotMetadataRequest;
import org.epistula.backup.service.DailySnapshotScheduler;
import org.epistula.backup.service.SchemaDumpService;
import org.epistula.backup.service.SchemaLifecycleService;
import org.epistula.backup.service.SchemaRestoreService;
import org.epistula.backup.service.SnapshotCatalogService;
import org.epistula.backup.service.SnapshotStore;

import java.util.Map;

@Slf4j
@Path("/api/v1/backups")
@Tag(name = "Tenant schema backups")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TenantBackupController {

    private final SnapshotCatalogService catalogService;
    private final SnapshotStore snapshotStore;
    private final SchemaDumpService dumpService;
    private final SchemaRestoreService restoreService;
    private final SchemaLifecycleService lifecycleService;
    private final DailySnapshotScheduler scheduler;

    public TenantBackupController(SnapshotCatalogService catalogService,
                                  SnapshotStore snapshotStore,
                                  SchemaDumpService dumpService,
                                  SchemaRestoreService restoreService,
                                  SchemaLifecycleService lifecycleService,
                                  DailySnapshotScheduler scheduler) {
        this.catalogService = catalogService;
        this.snapshotStore = snapshotStore;
        this.dumpService = dumpService;
        this.restoreService = restoreService;
        this.lifecycleService = lifecycleService;
        this.scheduler = scheduler;
    }

    @GET
    @Path("/all")
    @Operation(summary = "List snapshots of every tenant")
    public Response listAllSnapshots() {
        return Response.ok(catalogService.listAllSnapshots()).build();
    }

    @GET
    @Path("/{tenantId}")
    @Operation(summary = "List snapshots of a tenant, newest first")
    public Response listSnapshots(@PathParam("tenantId") int tenantId) {
        return Response.ok(catalogService.listSnapshots(tenantId)).build();
    }

    @POST
    @Path("/{tenantId}/create")
    @Operation(summary = "Take a manual snapshot of the tenant schema")
    public Response createSnapshot(@PathParam("tenantId") int tenantId) {
        log.info("Manual snapshot requested for tenant {}", tenantId);
        return Response.status(Response.Status.CREATED).entity(dumpService.createManualSnapshot(tenantId)).build();
    }

    @POST
    @Path("/{tenantId}/{filename}/restore")
    @Operation(summary = "Restore a snapshot into the production schema or into the temporary schema")
    public Response restore(@PathParam("tenantId") int tenantId,
                            @PathParam("filename") String filename,
                            @QueryParam("toTemp") @DefaultValue("false") boolean toTemp) {
        log.info("Restore of {} requested for tenant {}, toTemp={}", filename, tenantId, toTemp);
        return Response.ok(restoreService.restore(tenantId, filename, toTemp)).build();
    }

    @POST
    @Path("/{tenantId}/{filename}/mirror")
    @Operation(summary = "Upload an existing snapshot to object storage")
    public Response mirrorSnapshot(@PathParam("tenantId") int tenantId, @PathParam("filename") String filename) {
        boolean mirrored = dumpService.mirrorSnapshot(tenantId, filename);
        return Response.ok(Map.of("filename", filename, "mirrored", mirrored)).build();
    }

    @GET
    @Path("/{tenantId}/{filename}/meta")
    public Response getMetadata(@PathParam("tenantId") int tenantId, @PathParam("filename") String filename) {
        return Response.ok(catalogService.getMetadata(tenantId, filename)).build();
    }

    @PUT
    @Path("/{tenantId}/{filename}/meta")
    public Response saveMetadata(@PathParam("tenantId") int tenantId,
                                 @PathParam("filename") String filename,
                                 @Valid @NotNull SnapshotMetadataRequest request) {
        return Response.ok(catalogService.saveMetadata(tenantId, filename, request)).build();
    }

    @DELETE
    @Path("/{tenantId}/{filename}")
    @Operation(summary = "Delete a snapshot locally, from object storage and its metadata")
    public Response deleteSnapshot(@PathParam("tenantId") int tenantId,
                                   @PathParam("filename") String filename,
                                   @QueryParam("deleteFromRemote") @DefaultValue("true") boolean deleteFromRemote) {
        return Response.ok(snapshotStore.deleteSnapshot(tenantId, filename, deleteFromRemote)).build();
    }

    @DELETE
    @Path("/{tenantId}/manage/bulk-delete")
    public Response deleteSnapshots(@PathParam("tenantId") int tenantId, @Valid @NotNull BulkDeletionRequest request) {
        return Response.ok(snapshotStore.deleteSnapshots(tenantId, request.getFilenames(), request.isDeleteFromRemote())).build();
    }

    @DELETE
    @Path("/{tenantId}/manage/delete-all")
    public Response deleteAllSnapshots(@PathParam("tenantId") int tenantId,
                                       @QueryParam("deleteFromRemote") @DefaultValue("true") boolean deleteFromRemote) {
        return Response.ok(snapshotStore.deleteAllSnapshots(tenantId, deleteFromRemote)).build();
    }

    @POST
    @Path("/{tenantId}/promote-temp")
    @Operation(summary = "Replace the production schema with the validated temporary schema")
    public Response promote(@PathParam("tenantId") int tenantId) {
        return Response.ok(lifecycleService.promote(tenantId)).build();
    }

    @DELETE
    @Path("/{tenantId}/temp-schema")
    @Operation(summary = "Drop the temporary schema and its catalog row")
    public Response discardTemp(@PathParam("tenantId") int tenantId) {
        return Response.ok(lifecycleService.discardTemp(tenantId)).build();
    }

    @GET
    @Path("/{tenantId}/temp-status")
    public Response tempStatus(@PathParam("tenantId") int tenantId) {
        return Response.ok(lifecycleService.getTempStatus(tenantId)).build();
    }

    @POST
    @Path("/{tenantId}/ensure-temp-registry")
    public Response ensureTempWorkspace(@PathParam("tenantId") int tenantId) {
        int tempTenantId = lifecycleService.ensureTempWorkspace(tenantId);
        return Response.ok(Map.of("tenantId", tenantId, "tempTenantId", tempTenantId)).build();
    }

    @GET
    @Path("/scheduler")
    public Response schedulerStatus() {
        return Response.ok(SchedulerStatus.builder().running(scheduler.isRunning()).build()).build();
    }

    @POST
    @Path("/scheduler/start")
    public Response startScheduler() {
        boolean changed = scheduler.start();
        return Response.ok(SchedulerStatus.builder().running(scheduler.isRunning()).changed(changed).build()).build();
    }

    @POST
    @Path("/scheduler/stop")
    public Response stopScheduler() {
        boolean changed = scheduler.stop();
        return Response.ok(SchedulerStatus.builder().running(scheduler.isRunning()).changed(changed).build()).build();
    }
}
