package org.epistula.backup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.epistula.backup.PgConnectionSettings;
import org.epistula.backup.config.PostgresConnectionConfigSource;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@ApplicationScoped
public class PgClientProcessTools implements PgClientTools {

    private static final int MAX_STDERR_BYTES = 64 * 1024;

    private final AsyncOperations asyncOperations;
    private final String pgDumpBinary;
    private final String psqlBinary;
    private final PgConnectionSettings connection;

    @Inject
    public PgClientProcessTools(AsyncOperations asyncOperations,
                                @ConfigProperty(name = "epistula.backups.tools.pg-dump", defaultValue = "pg_dump") String pgDumpBinary,
                                @ConfigProperty(name = "epistula.backups.tools.psql", defaultValue = "psql") String psqlBinary,
                                @ConfigProperty(name = PostgresConnectionConfigSource.PG_HOST) String host,
                                @ConfigProperty(name = PostgresConnectionConfigSource.PG_PORT) String port,
                                @ConfigProperty(name = PostgresConnectionConfigSource.PG_DATABASE) String database,
                                @ConfigProperty(name = PostgresConnectionConfigSource.PG_USERNAME) String username,
                                @ConfigProperty(name = PostgresConnectionConfigSource.PG_PASSWORD) Optional<String> password) {
        this(asyncOperations, pgDumpBinary, psqlBinary, new PgConnectionSettings(host, port, database, username, password.orElse("")));
    }

    PgClientProcessTools(AsyncOperations asyncOperations, String pgDumpBinary, String psqlBinary, PgConnectionSettings connection) {
        this.asyncOperations = asyncOperations;
        this.pgDumpBinary = pgDumpBinary;
        this.psqlBinary = psqlBinary;
        this.connection = connection;
    }

    @Override
    public ToolExecution dumpSchema(String schema, OutputStream target) throws IOException {
        List<String> command = connectionArguments(pgDumpBinary);
        command.add("-n");
        command.add(schema);
        try {
            return run(command, null, target, null);
        } catch (TimeoutException e) {
            throw new IllegalStateException("pg_dump runs without a timeout", e);
        }
    }

    @Override
    public ToolExecution executeSql(InputStream script, Duration timeout) throws IOException, TimeoutException {
        return run(connectionArguments(psqlBinary), script, null, timeout);
    }

    private List<String> connectionArguments(String binary) {
        List<String> command = new ArrayList<>();
        command.add(binary);
        command.add("-h");
        command.add(connection.getHost());
        command.add("-p");
        command.add(connection.getPort());
        command.add("-U");
        command.add(connection.getUsername());
        command.add("-d");
        command.add(connection.getDatabase());
        return command;
    }

    /**
     * Starts {@code command}, pumps {@code stdin} into it and its standard output into {@code stdout}.
     * A {@code null} stdin closes the process input immediately, a {@code null} stdout discards the output
     * and a {@code null} timeout waits for as long as the process runs.
     */
    ToolExecution run(List<String> command, InputStream stdin, OutputStream stdout, Duration timeout)
            throws IOException, TimeoutException {
        String rendered = String.join(" ", command);
        ProcessBuilder builder = new ProcessBuilder(command);
        Map<String, String> environment = builder.environment();
        environment.put("PGPASSWORD", connection.getPassword() == null ? "" : connection.getPassword());
        if (stdout == null) {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }
        Process process = builder.start();
        log.debug("Started '{}' with pid {}", rendered, process.pid());

        ExecutorService pool = asyncOperations.getToolIoPool();
        CompletableFuture<String> stderr;
        CompletableFuture<Void> feeder;
        CompletableFuture<Void> drain;
        try {
            stderr = CompletableFuture.supplyAsync(() -> readBounded(process.getErrorStream()), pool);
            feeder = CompletableFuture.runAsync(() -> feed(rendered, stdin, process.getOutputStream()), pool);
            drain = stdout == null
                    ? CompletableFuture.completedFuture(null)
                    : CompletableFuture.runAsync(() -> copy(process.getInputStream(), stdout), pool);
        } catch (RejectedExecutionException e) {
            process.destroyForcibly();
            log.error("No stream pump thread left for '{}', the process was killed", rendered);
            throw new IOException("No stream pump thread available for '" + rendered + "'", e);
        }

        try {
            if (timeout == null) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.error("'{}' did not finish within {} seconds and was killed", rendered, timeout.toSeconds());
                throw new TimeoutException("'" + rendered + "' did not finish within " + timeout.toSeconds() + " seconds");
            }
            drain.join();
            feeder.join();
            return new ToolExecution(rendered, process.exitValue(), stderr.join());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for '" + rendered + "'", e);
        } catch (CompletionException e) {
            process.destroyForcibly();
            if (e.getCause() instanceof UncheckedIOException) {
                throw ((UncheckedIOException) e.getCause()).getCause();
            }
            throw e;
        }
    }

    private void feed(String rendered, InputStream source, OutputStream processInput) {
        try (OutputStream in = processInput) {
            if (source != null) {
                source.transferTo(in);
            }
        } catch (IOException e) {
            // the process stopped reading, its exit code reports the failure
            log.warn("Could not write the whole input to '{}': {}", rendered, e.getMessage());
        }
    }

    private static void copy(InputStream source, OutputStream target) {
        try (InputStream in = source) {
            in.transferTo(target);
            target.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String readBounded(InputStream source) {
        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        try (InputStream in = source) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                int room = MAX_STDERR_BYTES - collected.size();
                if (room > 0) {
                    collected.write(buffer, 0, Math.min(room, read));
                }
            }
        } catch (IOException e) {
            log.debug("Standard error stream closed early: {}", e.getMessage());
        }
        return collected.toString(StandardCharsets.UTF_8).trim();
    }
}
