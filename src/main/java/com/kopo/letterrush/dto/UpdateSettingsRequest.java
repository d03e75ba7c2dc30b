package com.kopo.letterrush.dto;

import lombok.Data;

@Data
public class UpdateSettingsRequest {
    private Integer totalRounds;
    private Integer timerDuration;
}
