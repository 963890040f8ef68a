package com.ledgerbook.backup.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreRequest {

    /**
     * Stored name of the backup, as returned by the backup listing.
     */
    @NotBlank(message = "backupId is required")
    private String backupId;
}
