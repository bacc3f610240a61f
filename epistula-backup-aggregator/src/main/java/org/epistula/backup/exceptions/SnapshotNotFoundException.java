package org.epistula.backup.exceptions;

public class SnapshotNotFoundException extends ResourceNotFoundException {

    public SnapshotNotFoundException(int tenantId, String filename) {
        super(ErrorCodes.EPISTULA_BACKUP_4002, ErrorCodes.EPISTULA_BACKUP_4002.getDetail(filename, tenantId));
    }
}
