package com.bko.askservice.ask.web;

import com.bko.askservice.ask.web.dto.AskRequestDto;
import com.bko.askservice.ask.web.dto.AskResponseDto;
import com.bko.askservice.llm.AskResult;
import com.bko.askservice.llm.LlmProvider;
import com.bko.askservice.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AskController {
    private static final Logger logger = LoggerFactory.getLogger(AskController.class);

    private final LlmProvider llmProvider;

    public AskController(LlmProvider llmProvider) {
        this.llmProvider = llmProvider;
    }

    @PostMapping(value = "/ask", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public AskResponseDto ask(@RequestBody AskRequestDto request) throws LlmProviderException {
        logger.info("Received question: {}", request.question());
        AskResult result = llmProvider.ask(request.question());
        logger.info("Successfully generated response");
        return new AskResponseDto(result.answer(), result.raw().orElse(null));
    }
}
