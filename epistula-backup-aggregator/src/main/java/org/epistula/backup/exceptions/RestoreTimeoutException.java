package org.epistula.backup.exceptions;

import java.time.Duration;

public class RestoreTimeoutException extends ExternalToolException {

    public RestoreTimeoutException(String schema, Duration timeout, Throwable cause) {
        super(ErrorCodes.EPISTULA_BACKUP_5003, ErrorCodes.EPISTULA_BACKUP_5003.getDetail(schema, timeout.toSeconds()),
                schema, -1, null, cause);
    }
}
