package org.epistula.backup.service;

import lombok.Value;

@Value
public class ToolExecution {
    String command;
    int exitCode;
    String stderr;

    public boolean isSuccessful() {
        return exitCode == 0;
    }
}
