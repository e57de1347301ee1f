package com.judgmentrag.config;

import java.time.Duration;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import com.judgmentrag.exception.ConfigurationException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class OllamaConfig {

    @Value("${spring.ai.ollama.base-url:}")
    private String baseUrl;

    @Value("${spring.ai.ollama.chat.options.model:}")
    private String model;

    @Value("${spring.ai.ollama.chat.options.temperature:0.2}")
    private Double temperature;

    @Value("${spring.ai.ollama.chat.options.num-predict:2048}")
    private Integer numPredict;

    @Value("${spring.ai.ollama.chat.options.top-k:40}")
    private Integer topK;

    @Value("${spring.ai.ollama.chat.options.top-p:0.9}")
    private Double topP;

    @Value("${spring.ai.ollama.chat.options.repeat-penalty:1.1}")
    private Double repeatPenalty;

    @Value("${legal-rag.llm.connect-timeout:5s}")
    private Duration connectTimeout;

    // above the longest time limiter, so the limiter fires first
    @Value("${legal-rag.llm.read-timeout:150s}")
    private Duration readTimeout;

    @Bean
    public OllamaApi ollamaApi() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationException("spring.ai.ollama.base-url is not configured");
        }
        log.info("Initializing Ollama API with base URL: {}", baseUrl);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);

        return OllamaApi.builder()
                .baseUrl(baseUrl)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();
    }

    @Bean
    public OllamaOptions defaultOllamaOptions() {
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("spring.ai.ollama.chat.options.model is not configured");
        }
        return OllamaOptions.builder()
                .model(model)
                .temperature(temperature)
                .numPredict(numPredict) // Max output tokens
                .topK(topK)
                .topP(topP)
                .repeatPenalty(repeatPenalty)
                .build();
    }

    @Bean
    public ChatModel chatModel(OllamaApi ollamaApi, OllamaOptions defaultOllamaOptions) {
        log.info("Chat model: {}", defaultOllamaOptions.getModel());
        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(defaultOllamaOptions)
                .build();
    }
}
