package org.epistula.backup.exceptions;

import lombok.Getter;

@Getter
public abstract class ExternalToolException extends ErrorCodeException {
    private final String schema;
    private final int exitCode;
    private final String stderr;

    protected ExternalToolException(ErrorCode errorCode, String detail, String schema, int exitCode, String stderr, Throwable cause) {
        super(errorCode, detail, cause);
        this.schema = schema;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }
}
