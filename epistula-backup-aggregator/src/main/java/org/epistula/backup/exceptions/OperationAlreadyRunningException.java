package org.epistula.backup.exceptions;

import jakarta.ws.rs.core.Response;

public class OperationAlreadyRunningException extends ValidationException {

    public OperationAlreadyRunningException(String operation, int tenantId) {
        super(ErrorCodes.EPISTULA_BACKUP_4006, ErrorCodes.EPISTULA_BACKUP_4006.getDetail(operation, tenantId));
        setStatus(Response.Status.CONFLICT.getStatusCode());
    }
}
