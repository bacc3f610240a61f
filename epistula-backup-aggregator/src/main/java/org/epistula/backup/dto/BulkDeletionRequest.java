package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkDeletionRequest {
    @NotEmpty
    private List<String> filenames;
    @Builder.Default
    private boolean deleteFromRemote = true;
}
