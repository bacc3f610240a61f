package org.epistula.backup.exceptions;

public class RestoreFailedException extends ExternalToolException {

    public RestoreFailedException(String schema, int exitCode, String stderr) {
        super(ErrorCodes.EPISTULA_BACKUP_5002, ErrorCodes.EPISTULA_BACKUP_5002.getDetail(schema, exitCode, stderr),
                schema, exitCode, stderr, null);
    }
}
