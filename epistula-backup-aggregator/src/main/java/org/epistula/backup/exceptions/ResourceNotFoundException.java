package org.epistula.backup.exceptions;

public abstract class ResourceNotFoundException extends ErrorCodeException {

    protected ResourceNotFoundException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
