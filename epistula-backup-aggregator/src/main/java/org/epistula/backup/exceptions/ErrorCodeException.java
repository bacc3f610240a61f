package org.epistula.backup.exceptions;

import lombok.Getter;

@Getter
public class ErrorCodeException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String detail;

    public ErrorCodeException(ErrorCode errorCode, String detail) {
        this(errorCode, detail, null);
    }

    public ErrorCodeException(ErrorCode errorCode, String detail, Throwable cause) {
        super(String.format("[%s] %s", errorCode.getCode(), detail), cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }
}
