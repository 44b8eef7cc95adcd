package com.ai.studyassistant.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * {@link GenerationClient} backed by the Spring AI {@link ChatClient}.
 *
 * <p>
 * Spring AI drives the Ollama streaming API through WebClient, so
 * cancelling the returned Flux closes the HTTP connection to the model.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatClientGenerationClient implements GenerationClient {

    private final ChatClient chatClient;

    @Override
    public Flux<String> stream(String prompt) {
        log.debug("Opening model stream, promptLength={}", prompt.length());
        return chatClient.prompt(prompt).stream().content();
    }

    @Override
    public String call(String prompt) {
        log.debug("Calling model synchronously, promptLength={}", prompt.length());
        return chatClient.prompt(prompt).call().content();
    }
}
