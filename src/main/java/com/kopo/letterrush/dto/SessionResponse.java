package com.kopo.letterrush.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "SessionResponse", description = "Credentials of the player that created or joined a room")
public class SessionResponse {
    private String code;
    private Long playerId;
    @Schema(description = "Bearer token for write actions")
    private String token;
}
