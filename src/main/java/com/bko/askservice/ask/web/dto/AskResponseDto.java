package com.bko.askservice.ask.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

public record AskResponseDto(
        String response,
        @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode raw
) { }
