package com.ai.studyassistant.client;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import reactor.core.publisher.Flux;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatClientGenerationClientTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatClientGenerationClient client = new ChatClientGenerationClient(chatClient);

    @Test
    void streamsContentFromTheChatClient() {
        when(chatClient.prompt("prompt").stream().content()).thenReturn(Flux.just("A", "B"));

        assertThat(client.stream("prompt").collectList().block()).containsExactly("A", "B");
    }

    @Test
    void callReturnsTheFullContent() {
        when(chatClient.prompt("prompt").call().content()).thenReturn("Full answer");

        assertThat(client.call("prompt")).isEqualTo("Full answer");
    }
}
