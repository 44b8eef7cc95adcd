package com.ai.studyassistant.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RagConfig wires the Spring AI ChatClient to Ollama and exposes the
 * {@link RagProperties} tuning knobs.
 *
 * <p>
 * The same ChatClient serves both the streaming and the synchronous
 * generation paths, so the fallback after a failed stream hits the same
 * model with the same prompt.
 * </p>
 *
 * OllamaChatModel and OllamaEmbeddingModel are auto-configured by
 * spring-ai-starter-model-ollama using the properties:
 * <pre>
 *   spring.ai.ollama.base-url=http://localhost:11434
 *   spring.ai.ollama.chat.options.model=llama3.2
 *   spring.ai.ollama.embedding.options.model=nomic-embed-text
 * </pre>
 */
@Configuration
@EnableConfigurationProperties(RagProperties.class)
public class RagConfig {

    /**
     * Creates a ChatClient backed by the local Ollama model.
     *
     * @param ollamaChatModel injected automatically by Spring AI Ollama auto-config
     * @return a ChatClient that sends prompts to Ollama
     */
    @Bean
    public ChatClient chatClient(OllamaChatModel ollamaChatModel) {
        return ChatClient.builder(ollamaChatModel).build();
    }
}
