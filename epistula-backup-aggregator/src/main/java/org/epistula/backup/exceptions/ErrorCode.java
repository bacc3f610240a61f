package org.epistula.backup.exceptions;

public interface ErrorCode {

    String getCode();

    String getTitle();

    String getDetail();

    default String getDetail(Object... args) {
        return String.format(getDetail(), args);
    }
}
