package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreResult {
    private int tenantId;
    private String snapshot;
    private String productionSchema;
    private String targetSchema;
    private boolean toTemp;
    private Integer tempTenantId;
    private String safetySnapshot;
    private LifecycleState state;
}
