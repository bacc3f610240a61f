package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionResult {
    private int tenantId;
    private String productionSchema;
    private String promotedFrom;
    private String safetySnapshot;
    private LifecycleState state;
}
