package org.epistula.backup.exceptions;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCodes implements ErrorCode {

    EPISTULA_BACKUP_4001(
            "EPISTULA-BACKUP-4001",
            "Tenant not found",
            "Tenant with id %s is not registered"),
    EPISTULA_BACKUP_4002(
            "EPISTULA-BACKUP-4002",
            "Snapshot not found",
            "Snapshot '%s' does not exist for tenant %s"),
    EPISTULA_BACKUP_4003(
            "EPISTULA-BACKUP-4003",
            "Temporary schema not found",
            "Temporary schema '%s' does not exist: %s"),
    EPISTULA_BACKUP_4004(
            "EPISTULA-BACKUP-4004",
            "Invalid snapshot name",
            "Invalid snapshot name '%s': %s"),
    EPISTULA_BACKUP_4005(
            "EPISTULA-BACKUP-4005",
            "Invalid schema name",
            "Schema identifier '%s' is not allowed: %s"),
    EPISTULA_BACKUP_4006(
            "EPISTULA-BACKUP-4006",
            "Operation already running",
            "Operation '%s' cannot start, another lifecycle operation is running for tenant %s"),
    EPISTULA_BACKUP_5001(
            "EPISTULA-BACKUP-5001",
            "Schema dump failed",
            "pg_dump of schema '%s' exited with code %s: %s"),
    EPISTULA_BACKUP_5002(
            "EPISTULA-BACKUP-5002",
            "Schema restore failed",
            "psql restore into schema '%s' exited with code %s: %s"),
    EPISTULA_BACKUP_5003(
            "EPISTULA-BACKUP-5003",
            "Schema restore timed out",
            "psql restore into schema '%s' did not finish within %s seconds"),
    EPISTULA_BACKUP_5004(
            "EPISTULA-BACKUP-5004",
            "Snapshot storage failure",
            "Snapshot storage operation failed: %s");

    private final String code;
    private final String title;
    private final String detail;
}
