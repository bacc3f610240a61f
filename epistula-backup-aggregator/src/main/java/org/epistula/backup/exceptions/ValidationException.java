package org.epistula.backup.exceptions;

import lombok.Getter;
import lombok.Setter;

@Getter
public abstract class ValidationException extends ErrorCodeException {
    @Setter
    private Integer status;

    protected ValidationException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }
}
