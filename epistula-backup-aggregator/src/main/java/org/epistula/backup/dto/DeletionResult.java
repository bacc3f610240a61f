package org.epistula.backup.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of removing one snapshot. Each store is cleaned independently, so a partial result is possible.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionResult {
    private int tenantId;
    private String filename;
    private boolean deletedLocal;
    private boolean remoteRequested;
    private boolean deletedRemote;
    private String remoteError;
    private boolean deletedMetadata;
    private String error;

    @JsonIgnore
    public boolean isComplete() {
        return error == null && deletedLocal && deletedMetadata && (!remoteRequested || deletedRemote);
    }
}
