package org.epistula.backup.exceptions;

import lombok.Getter;

@Getter
public class TenantNotFoundException extends ResourceNotFoundException {
    private final int tenantId;

    public TenantNotFoundException(int tenantId) {
        super(ErrorCodes.EPISTULA_BACKUP_4001, ErrorCodes.EPISTULA_BACKUP_4001.getDetail(tenantId));
        this.tenantId = tenantId;
    }
}
