package org.epistula.backup.storage;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@ApplicationScoped
public class S3ObjectStorage implements ObjectStorage {

    private static final String GZIP_CONTENT_TYPE = "application/gzip";

    private final S3Client s3Client;

    public S3ObjectStorage(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public void ensureBucket(String bucket) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (NoSuchBucketException e) {
            log.info("Bucket {} does not exist, creating it", bucket);
            s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
        }
    }

    @Override
    public void put(String bucket, String key, Path file) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(GZIP_CONTENT_TYPE)
                .build();
        s3Client.putObject(request, RequestBody.fromFile(file));
        log.debug("Uploaded {} to {}/{}", file, bucket, key);
    }

    @Override
    public void remove(String bucket, String key) {
        s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        log.debug("Removed {}/{}", bucket, key);
    }

    @Override
    public List<String> list(String bucket, String prefix) {
        ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
        return s3Client.listObjectsV2Paginator(request).contents().stream()
                .map(S3Object::key)
                .collect(Collectors.toList());
    }
}
