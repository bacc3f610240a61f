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
public class AllSnapshotsResponse {
    private List<TenantSnapshots> tenants;
    private int totalSnapshots;
}
