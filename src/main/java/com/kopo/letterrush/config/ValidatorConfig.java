package com.kopo.letterrush.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kopo.letterrush.service.validation.AnswerValidator;
import com.kopo.letterrush.service.validation.FallbackAnswerValidator;
import com.kopo.letterrush.service.validation.GeminiAnswerValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Chooses the answer judge once at startup: Gemini when an API key is configured,
 * the starts-with-letter rule otherwise. The fallback bean is always present because
 * the pipeline also needs it when the Gemini call fails.
 */
@Configuration
public class ValidatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(ValidatorConfig.class);

    @Value("${gemini.api.key:}")
    private String apiKey;

    @Value("${gemini.api.url}")
    private String apiUrl;

    @Value("${gemini.timeout.connect-ms:3000}")
    private int connectTimeoutMs;

    @Value("${gemini.timeout.read-ms:15000}")
    private int readTimeoutMs;

    @Bean
    public FallbackAnswerValidator fallbackAnswerValidator() {
        return new FallbackAnswerValidator();
    }

    @Bean
    @Primary
    public AnswerValidator primaryAnswerValidator(FallbackAnswerValidator fallbackAnswerValidator,
                                                  ObjectMapper objectMapper) {
        if (apiKey == null || apiKey.isBlank()) {
            logger.info("No Gemini API key configured, answers are judged by the fallback rule");
            return fallbackAnswerValidator;
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        logger.info("Gemini judge enabled (connect timeout {} ms, read timeout {} ms)", connectTimeoutMs, readTimeoutMs);
        return new GeminiAnswerValidator(new RestTemplate(requestFactory), objectMapper, apiUrl, apiKey);
    }
}
