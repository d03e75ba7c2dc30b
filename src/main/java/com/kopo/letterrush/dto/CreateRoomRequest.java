package com.kopo.letterrush.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import java.util.List;

@Data
@Schema(name = "CreateRoomRequest", description = "Room creation data; the creator becomes the host")
public class CreateRoomRequest {
    @Schema(description = "Host display name", example = "Ania", requiredMode = Schema.RequiredMode.REQUIRED)
    private String playerName;
    @Schema(description = "Number of rounds, 1-20 (default 5)", example = "5")
    private Integer totalRounds;
    @Schema(description = "Active categories (default: panstwo, miasto, imie, zwierze, rzecz, roslina)")
    private List<String> categories;
    @Schema(description = "Seconds after the first submission before the round ends, 0-60 (default 10, 0 = no timer)", example = "10")
    private Integer timerDuration;
}
