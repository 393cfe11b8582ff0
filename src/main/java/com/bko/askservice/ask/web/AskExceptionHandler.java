package com.bko.askservice.ask.web;

import com.bko.askservice.ask.web.dto.ErrorResponseDto;
import com.bko.askservice.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to the JSON error body. Provider detail goes to the log only.
 */
@RestControllerAdvice
public class AskExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(AskExceptionHandler.class);

    static final String PROVIDER_FAILURE = "Failed to generate response";
    static final String BAD_REQUEST = "Request body must be JSON with a question field";

    @ExceptionHandler(LlmProviderException.class)
    public ResponseEntity<ErrorResponseDto> providerFailure(LlmProviderException e) {
        logger.error("Failed to generate response: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponseDto(PROVIDER_FAILURE));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> unreadableRequest(HttpMessageNotReadableException e) {
        logger.warn("Rejected /ask request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponseDto(BAD_REQUEST));
    }
}
