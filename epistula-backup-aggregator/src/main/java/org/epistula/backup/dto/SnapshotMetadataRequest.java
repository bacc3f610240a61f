package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Size;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotMetadataRequest {
    @Size(max = 255)
    private String title;
    @Size(max = 5000)
    private String description;
    private Integer createdBy;
}
