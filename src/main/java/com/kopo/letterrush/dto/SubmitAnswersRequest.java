package com.kopo.letterrush.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import java.util.Map;

@Data
@Schema(name = "SubmitAnswersRequest", description = "Answers of one player for the active round")
public class SubmitAnswersRequest {
    @Schema(description = "category -> word; blank words are ignored", example = "{\"miasto\": \"Berlin\"}")
    private Map<String, String> answers;
}
