package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantDeletionResult {
    private int tenantId;
    private String schemaName;
    private boolean tempWorkspace;
    private List<String> droppedSchemas;
    private String preservedSnapshotDirectory;
    private int purgedSnapshots;
}
