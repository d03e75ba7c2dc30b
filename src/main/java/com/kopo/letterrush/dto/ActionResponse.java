package com.kopo.letterrush.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResponse {
    private boolean success;
    private Boolean rejected;

    public static ActionResponse ok() {
        return new ActionResponse(true, null);
    }

    public static ActionResponse voted(boolean rejected) {
        return new ActionResponse(true, rejected);
    }
}
