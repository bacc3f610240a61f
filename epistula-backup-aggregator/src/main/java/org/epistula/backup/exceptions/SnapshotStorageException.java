package org.epistula.backup.exceptions;

public class SnapshotStorageException extends ErrorCodeException {

    public SnapshotStorageException(String reason, Throwable cause) {
        super(ErrorCodes.EPISTULA_BACKUP_5004, ErrorCodes.EPISTULA_BACKUP_5004.getDetail(reason), cause);
    }
}
