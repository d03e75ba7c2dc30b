package com.kopo.letterrush.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Hidden;

@RestController
@Hidden
public class HomeController {

    @GetMapping("/")
    public String home() {
        return "Letter Rush server is running. API docs: /swagger-ui.html";
    }
}
