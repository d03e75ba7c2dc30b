package com.kopo.letterrush.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(name = "JoinRoomRequest", description = "Room join data")
public class JoinRoomRequest {
    @Schema(description = "Room code", example = "AB12CD", requiredMode = Schema.RequiredMode.REQUIRED)
    private String code;
    @Schema(description = "Display name, unique within the room", example = "Bartek", requiredMode = Schema.RequiredMode.REQUIRED)
    private String playerName;
}
