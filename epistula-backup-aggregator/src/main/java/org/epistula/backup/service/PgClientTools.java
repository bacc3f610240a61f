package org.epistula.backup.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * The PostgreSQL command line clients used for schema snapshots.
 */
public interface PgClientTools {

    /**
     * Runs {@code pg_dump} for a single schema and writes the plain SQL output to {@code target}.
     * The caller owns {@code target} and closes it.
     */
    ToolExecution dumpSchema(String schema, OutputStream target) throws IOException;

    /**
     * Feeds {@code script} to {@code psql} over standard input. The process is killed once {@code timeout} elapses.
     */
    ToolExecution executeSql(InputStream script, Duration timeout) throws IOException, TimeoutException;
}
