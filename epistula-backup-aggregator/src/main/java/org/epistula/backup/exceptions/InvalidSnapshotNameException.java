package org.epistula.backup.exceptions;

public class InvalidSnapshotNameException extends ValidationException {

    public InvalidSnapshotNameException(String filename, String reason) {
        super(ErrorCodes.EPISTULA_BACKUP_4004, ErrorCodes.EPISTULA_BACKUP_4004.getDetail(filename, reason));
    }
}
