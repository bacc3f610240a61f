package org.epistula.backup.controller.error;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.epistula.backup.dto.ErrorResponse;
import org.epistula.backup.exceptions.InvalidSnapshotNameException;
import org.epistula.backup.exceptions.OperationAlreadyRunningException;
import org.epistula.backup.exceptions.RestoreFailedException;
import org.epistula.backup.exceptions.RestoreTimeoutException;
import org.epistula.backup.exceptions.TenantNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class ExceptionMappersTest {

    @Mock
    UriInfo uriInfo;

    @BeforeEach
    void setUp() {
        lenient().when(uriInfo.getPath()).thenReturn("/api/v1/backups/5");
    }

    @Test
    void missingTenantIsNotFound() {
        ResourceNotFoundExceptionMapper mapper = new ResourceNotFoundExceptionMapper();
        mapper.uriInfo = uriInfo;

        Response response = mapper.toResponse(new TenantNotFoundException(5));

        assertEquals(404, response.getStatus());
        ErrorResponse body = (ErrorResponse) response.getEntity();
        assertEquals("EPISTULA-BACKUP-4001", body.getCode());
        assertEquals("Tenant with id 5 is not registered", body.getMessage());
        assertEquals("/api/v1/backups/5", body.getPath());
    }

    @Test
    void validationErrorsUseTheirStatus() {
        ValidationExceptionMapper mapper = new ValidationExceptionMapper();
        mapper.uriInfo = uriInfo;

        assertEquals(400, mapper.toResponse(new InvalidSnapshotNameException("../x", "'..' is not allowed")).getStatus());
        assertEquals(409, mapper.toResponse(new OperationAlreadyRunningException("promote", 5)).getStatus());
    }

    @Test
    void toolFailuresAreServerErrors() {
        ExternalToolExceptionMapper mapper = new ExternalToolExceptionMapper();
        mapper.uriInfo = uriInfo;

        assertEquals(504, mapper.toResponse(new RestoreTimeoutException("uni_5_temp", Duration.ofSeconds(300), null)).getStatus());
        assertEquals(500, mapper.toResponse(new RestoreFailedException("uni_5", 3, "ERROR")).getStatus());
    }
}
