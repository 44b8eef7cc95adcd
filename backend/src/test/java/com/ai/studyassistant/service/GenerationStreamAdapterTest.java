package com.ai.studyassistant.service;

import com.ai.studyassistant.client.GenerationClient;
import com.ai.studyassistant.config.RagProperties;
import com.ai.studyassistant.exception.GenerationStartFailureException;
import com.ai.studyassistant.exception.GenerationStreamFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerationStreamAdapterTest {

    private GenerationClient client;
    private RagProperties properties;
    private GenerationStreamAdapter adapter;

    @BeforeEach
    void setUp() {
        client = mock(GenerationClient.class);
        properties = new RagProperties();
        properties.getGeneration().setFirstFragmentTimeout(Duration.ofMillis(200));
        properties.getGeneration().setTimeout(Duration.ofMillis(500));
        properties.getGeneration().setSyncTimeout(Duration.ofMillis(500));
        adapter = new GenerationStreamAdapter(client, properties);
    }

    @Test
    void forwardsFragmentsInOrderAndSkipsEmptyOnes() {
        when(client.stream("p")).thenReturn(Flux.just("A heap", "", " is", " a tree"));

        assertThat(adapter.generate("p").collectList().block())
                .containsExactly("A heap", " is", " a tree");
    }

    @Test
    void failureBeforeFirstFragmentIsAStartFailure() {
        when(client.stream("p")).thenReturn(Flux.error(new IOException("connection reset")));

        assertThatThrownBy(() -> adapter.generate("p").blockLast())
                .isInstanceOf(GenerationStartFailureException.class)
                .hasMessageContaining("connection reset");
    }

    @Test
    void clientThatThrowsImmediatelyIsAStartFailure() {
        when(client.stream("p")).thenThrow(new IllegalStateException("model not loaded"));

        assertThatThrownBy(() -> adapter.generate("p").blockLast())
                .isInstanceOf(GenerationStartFailureException.class);
    }

    @Test
    void failureAfterAFragmentIsAStreamFailure() {
        when(client.stream("p")).thenReturn(Flux.concat(
                Flux.just("Partial", " answer"),
                Flux.error(new IOException("stream closed"))));
        List<String> received = new ArrayList<>();

        assertThatThrownBy(() -> adapter.generate("p").doOnNext(received::add).blockLast())
                .isInstanceOf(GenerationStreamFailureException.class)
                .hasMessageContaining("stream closed");
        assertThat(received).containsExactly("Partial", " answer");
    }

    @Test
    void silenceBeforeFirstFragmentTimesOutAsStartFailure() {
        when(client.stream("p")).thenReturn(Flux.never());

        assertThatThrownBy(() -> adapter.generate("p").blockLast(Duration.ofSeconds(5)))
                .isInstanceOf(GenerationStartFailureException.class)
                .hasCauseInstanceOf(TimeoutException.class);
    }

    @Test
    void overallDeadlineAfterFirstFragmentIsAStreamFailure() {
        when(client.stream("p")).thenReturn(Flux.concat(Flux.just("Hello"), Flux.never()));

        assertThatThrownBy(() -> adapter.generate("p").blockLast(Duration.ofSeconds(5)))
                .isInstanceOf(GenerationStreamFailureException.class)
                .hasCauseInstanceOf(TimeoutException.class);
    }

    @Test
    void emptyOutputIsAStartFailure() {
        when(client.stream("p")).thenReturn(Flux.just("", ""));

        assertThatThrownBy(() -> adapter.generate("p").blockLast())
                .isInstanceOf(GenerationStartFailureException.class);
    }

    @Test
    void streamCannotBeConsumedTwice() {
        when(client.stream("p")).thenReturn(Flux.just("once"));
        Flux<String> fragments = adapter.generate("p");

        assertThat(fragments.collectList().block()).containsExactly("once");
        assertThatThrownBy(fragments::blockLast).isInstanceOf(IllegalStateException.class);
        verify(client, times(1)).stream("p");
    }

    @Test
    void cancellingTheConsumerReleasesTheUpstreamStream() {
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        AtomicInteger produced = new AtomicInteger();
        when(client.stream("p")).thenReturn(Flux.range(1, 100)
                .map(i -> "token" + i)
                .doOnNext(t -> produced.incrementAndGet())
                .doOnCancel(() -> upstreamCancelled.set(true)));

        List<String> received = adapter.generate("p").take(2).collectList().block();

        assertThat(received).containsExactly("token1", "token2");
        assertThat(upstreamCancelled).isTrue();
        assertThat(produced.get()).isLessThan(100);
    }

    @Test
    void synchronousCallReturnsTheAnswer() {
        when(client.call("p")).thenReturn("Full answer");

        assertThat(adapter.generateSync("p").block()).isEqualTo("Full answer");
    }

    @Test
    void blankSynchronousAnswerIsAFailure() {
        when(client.call("p")).thenReturn("   ");

        assertThatThrownBy(() -> adapter.generateSync("p").block())
                .isInstanceOf(GenerationStartFailureException.class);
    }

    @Test
    void synchronousErrorsAreWrapped() {
        when(client.call("p")).thenThrow(new IllegalStateException("503 from model"));

        assertThatThrownBy(() -> adapter.generateSync("p").block())
                .isInstanceOf(GenerationStartFailureException.class)
                .hasMessageContaining("503 from model");
    }
}
