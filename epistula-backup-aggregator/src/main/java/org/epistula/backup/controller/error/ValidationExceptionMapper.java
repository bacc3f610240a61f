package org.epistula.backup.controller.error;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.epistula.backup.exceptions.ValidationException;

import static org.epistula.backup.controller.error.Utils.buildDefaultResponse;

@Provider
public class ValidationExceptionMapper implements ExceptionMapper<ValidationException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(ValidationException e) {
        Response.StatusType status = e.getStatus() != null
                ? Response.Status.fromStatusCode(e.getStatus())
                : Response.Status.BAD_REQUEST;
        return buildDefaultResponse(uriInfo, e, status);
    }
}
