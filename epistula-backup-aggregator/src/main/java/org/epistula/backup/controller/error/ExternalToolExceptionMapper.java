package org.epistula.backup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.epistula.backup.exceptions.ExternalToolException;
import org.epistula.backup.exceptions.RestoreTimeoutException;

import static org.epistula.backup.controller.error.Utils.buildDefaultResponse;

@Provider
public class ExternalToolExceptionMapper implements ExceptionMapper<ExternalToolException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(ExternalToolException e) {
        Response.Status status = e instanceof RestoreTimeoutException
                ? Response.Status.GATEWAY_TIMEOUT
                : Response.Status.INTERNAL_SERVER_ERROR;
        return buildDefaultResponse(uriInfo, e, status);
    }
}
