package com.kopo.letterrush.dto;

import lombok.Data;

@Data
public class ModerateRequest {
    private Boolean rejected;
}
