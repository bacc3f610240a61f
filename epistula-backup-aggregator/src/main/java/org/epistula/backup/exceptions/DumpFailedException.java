package org.epistula.backup.exceptions;

public class DumpFailedException extends ExternalToolException {

    public DumpFailedException(String schema, int exitCode, String stderr) {
        super(ErrorCodes.EPISTULA_BACKUP_5001, ErrorCodes.EPISTULA_BACKUP_5001.getDetail(schema, exitCode, stderr),
                schema, exitCode, stderr, null);
    }
}
