package com.docqa.config;

import java.time.Duration;

import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class OllamaConfig {

    private final ModelConfig modelConfig;

    @Value("${doc-qa.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${doc-qa.ollama.model:llama3.1}")
    private String model;

    @Value("${doc-qa.ollama.temperature:0.3}")
    private Double temperature;

    @Value("${doc-qa.ollama.num-predict:2048}")
    private Integer numPredict;

    @Value("${doc-qa.ollama.top-k:40}")
    private Integer topK;

    @Value("${doc-qa.ollama.top-p:0.9}")
    private Double topP;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Initializing Ollama API with base URL: {} (read timeout {}s)",
                baseUrl, modelConfig.getLlmTimeoutSeconds());

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(Duration.ofSeconds(modelConfig.getLlmTimeoutSeconds()));

        return OllamaApi.builder()
                .baseUrl(baseUrl)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();
    }

    @Bean
    public OllamaOptions defaultOllamaOptions() {
        return OllamaOptions.builder()
                .model(model)
                .temperature(temperature)
                .numPredict(numPredict) // Max output tokens
                .topK(topK)
                .topP(topP)
                .build();
    }

    @Bean
    public OllamaChatModel ollamaChatModel(
            OllamaApi ollamaApi,
            OllamaOptions ollamaOptions,
            ObjectProvider<ObservationRegistry> observationRegistry) {

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(ollamaOptions)
                .observationRegistry(observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(ModelManagementOptions.builder().build())
                .build();
    }
}
