package org.epistula.backup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.epistula.backup.exceptions.OperationAlreadyRunningException;

import static org.epistula.backup.controller.error.Utils.buildDefaultResponse;

@Provider
public class OperationAlreadyRunningExceptionMapper implements ExceptionMapper<OperationAlreadyRunningException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(OperationAlreadyRunningException e) {
        return buildDefaultResponse(uriInfo, e, Response.Status.CONFLICT);
    }
}
