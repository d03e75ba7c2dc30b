package com.kopo.letterrush.dto;

import lombok.Data;
import java.util.List;

@Data
public class UpdateCategoriesRequest {
    private List<String> categories;
}
