package com.example.chatterbox.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@Tag(name = "Home Controller", description = "Service banner")
public class HomeController {

    @Value("${chatterbox.home.banner:<h1>Chatterbox API</h1>}")
    private String banner;

    @Operation(summary = "HTML banner")
    @GetMapping(value = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String home() {
        return banner;
    }
}
