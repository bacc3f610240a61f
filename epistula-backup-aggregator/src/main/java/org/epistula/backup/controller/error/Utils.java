package org.epistula.backup.controller.error;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.epistula.backup.dto.ErrorResponse;
import org.epistula.backup.exceptions.ErrorCodeException;

import java.util.UUID;

@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Utils {

    public static Response buildDefaultResponse(UriInfo uriInfo, ErrorCodeException e, Response.StatusType status) {
        String path = uriInfo != null ? uriInfo.getPath() : null;
        if (status.getFamily() == Response.Status.Family.SERVER_ERROR) {
            log.error("Request {} failed: {}", path, e.getMessage(), e);
        } else {
            log.warn("Request {} rejected: {}", path, e.getMessage());
        }
        ErrorResponse body = ErrorResponse.builder()
                .id(UUID.randomUUID().toString())
                .code(e.getErrorCode().getCode())
                .reason(e.getErrorCode().getTitle())
                .message(e.getDetail())
                .status(String.valueOf(status.getStatusCode()))
                .path(path)
                .build();
        return Response.status(status).type(MediaType.APPLICATION_JSON_TYPE).entity(body).build();
    }
}
