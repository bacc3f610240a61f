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
public class BulkDeletionResult {
    private int tenantId;
    private int requested;
    private int deleted;
    private int failed;
    private List<DeletionResult> results;
}
