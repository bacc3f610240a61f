package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotInfo {
    private String filename;
    private long sizeBytes;
    private Instant createdAt;
    private boolean mirrored;
    private String title;
    private String description;
    @JsonIgnore
    private Path path;
}
