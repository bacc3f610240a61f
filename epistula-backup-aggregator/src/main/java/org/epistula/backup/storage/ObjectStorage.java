package org.epistula.backup.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Remote object store holding mirrored snapshots. Implementations throw unchecked exceptions on failure.
 */
public interface ObjectStorage {

    void ensureBucket(String bucket);

    void put(String bucket, String key, Path file);

    void remove(String bucket, String key);

    List<String> list(String bucket, String prefix);
}
