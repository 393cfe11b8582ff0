package com.bko.askservice.ask.web.dto;

public record ErrorResponseDto(String error) { }
