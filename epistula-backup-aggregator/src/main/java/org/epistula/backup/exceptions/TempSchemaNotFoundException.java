package org.epistula.backup.exceptions;

public class TempSchemaNotFoundException extends ResourceNotFoundException {

    public TempSchemaNotFoundException(String tempSchema, String reason) {
        super(ErrorCodes.EPISTULA_BACKUP_4003, ErrorCodes.EPISTULA_BACKUP_4003.getDetail(tempSchema, reason));
    }
}
