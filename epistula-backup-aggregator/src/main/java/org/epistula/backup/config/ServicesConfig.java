package org.epistula.backup.config;

import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import javax.sql.DataSource;
import java.net.URI;
import java.time.Clock;

@Dependent
@Slf4j
public class ServicesConfig {

    public static final String LOCK_TABLE = "public.shedlock";

    @Produces
    @Singleton
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .withTableName(LOCK_TABLE)
                        .usingDbTime()
                        .build()
        );
    }

    @Produces
    @Singleton
    public S3Client snapshotMirrorClient(@ConfigProperty(name = "epistula.backups.mirror.endpoint") String endpoint,
                                         @ConfigProperty(name = "epistula.backups.mirror.access-key") String accessKey,
                                         @ConfigProperty(name = "epistula.backups.mirror.secret-key") String secretKey,
                                         @ConfigProperty(name = "epistula.backups.mirror.region", defaultValue = "us-east-1") String region) {
        log.info("Creating object storage client for endpoint {}", endpoint);
        return S3Client.builder()
                .endpointOverride(URI.create(endpoint))
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey)))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .httpClientBuilder(UrlConnectionHttpClient.builder())
                .build();
    }

    public void closeSnapshotMirrorClient(@Disposes S3Client client) {
        client.close();
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
