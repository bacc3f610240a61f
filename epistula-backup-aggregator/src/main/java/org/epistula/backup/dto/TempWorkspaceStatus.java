package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TempWorkspaceStatus {
    private int tenantId;
    private String tenantName;
    private String productionSchema;
    private String tempSchema;
    private boolean hasTempSchema;
    private Integer tempTenantId;
    private LifecycleState state;
    private Long facultyCount;
    private Long userCount;
    private String statsError;
}
