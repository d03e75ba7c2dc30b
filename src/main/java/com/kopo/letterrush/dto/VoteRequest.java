package com.kopo.letterrush.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(name = "VoteRequest", description = "Accept or reject a peer answer after the round ended")
public class VoteRequest {
    @Schema(description = "true = accept, false = reject", requiredMode = Schema.RequiredMode.REQUIRED)
    private Boolean accepted;
}
