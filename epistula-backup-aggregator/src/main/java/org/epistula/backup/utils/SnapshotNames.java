package org.epistula.backup.utils;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.epistula.backup.exceptions.InvalidSnapshotNameException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Snapshot files are named {@code <schema>_<label>.sql.gz}. The label is either the UTC day ({@code yyyyMMdd})
 * or a prefixed UTC timestamp such as {@code prerestore_20240501_101500}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SnapshotNames {

    public static final String EXTENSION = ".sql.gz";
    public static final String PRE_RESTORE = "prerestore";
    public static final String PRE_PROMOTE = "pre_promote";
    public static final String MANUAL = "manual";

    public static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    public static String fileName(String schema, String label) {
        return requireValid(schema + "_" + label + EXTENSION);
    }

    public static String dailyLabel(Instant now) {
        return DAY_FORMAT.format(now);
    }

    public static String timestampedLabel(String prefix, Instant now) {
        return prefix + "_" + TIMESTAMP_FORMAT.format(now);
    }

    public static boolean hasSnapshotExtension(String filename) {
        return filename != null && filename.endsWith(EXTENSION);
    }

    /**
     * Rejects names that could escape the tenant directory.
     */
    public static String requireValid(String filename) {
        if (StringUtils.isBlank(filename)) {
            throw new InvalidSnapshotNameException(String.valueOf(filename), "name is blank");
        }
        if (filename.contains("/") || filename.contains("\\")) {
            throw new InvalidSnapshotNameException(filename, "path separators are not allowed");
        }
        if (filename.contains("..")) {
            throw new InvalidSnapshotNameException(filename, "'..' is not allowed");
        }
        return filename;
    }
}
