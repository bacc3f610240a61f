package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotCreatedResponse {
    private int tenantId;
    private String filename;
    private long sizeBytes;
    private boolean mirrored;
}
