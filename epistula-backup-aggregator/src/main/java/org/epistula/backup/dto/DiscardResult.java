package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscardResult {
    private int tenantId;
    private String tempSchema;
    private boolean catalogRowRemoved;
    private LifecycleState state;
}
