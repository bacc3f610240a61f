package org.epistula.backup.exceptions;

public class InvalidSchemaNameException extends ValidationException {

    public InvalidSchemaNameException(String schema, String reason) {
        super(ErrorCodes.EPISTULA_BACKUP_4005, ErrorCodes.EPISTULA_BACKUP_4005.getDetail(schema, reason));
    }
}
