package net.storyframe.application.alignment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class ZeroMatchFallbackDispatcherTest {

    @Mock
    private SearchKeywordExtractor keywordExtractor;

    @Mock
    private AutoSyncQueue autoSyncQueue;

    private SimpleMeterRegistry meterRegistry;
    private ZeroMatchFallbackDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new ZeroMatchFallbackDispatcher(keywordExtractor, autoSyncQueue, Schedulers.immediate(), meterRegistry);
    }

    @Test
    void should_EnqueueExtractedKeywords_When_Dispatched() {
        when(keywordExtractor.extractSearchKeywords("a lonely lighthouse in fog")).thenReturn("lighthouse fog");
        when(autoSyncQueue.enqueueAutoSync("lighthouse fog")).thenReturn("autosync-lighthouse-fog-1");

        dispatcher.dispatch(2, "a lonely lighthouse in fog");

        verify(autoSyncQueue).enqueueAutoSync("lighthouse fog");
        assertThat(counter(ZeroMatchFallbackDispatcher.DISPATCHED_METRIC)).isEqualTo(1.0);
        assertThat(counter(ZeroMatchFallbackDispatcher.FAILED_METRIC)).isZero();
    }

    @Test
    void should_CountFailureWithoutThrowing_When_EnqueueFails() {
        when(keywordExtractor.extractSearchKeywords("storm")).thenReturn("storm sea");
        when(autoSyncQueue.enqueueAutoSync("storm sea")).thenThrow(new IllegalStateException("queue closed"));

        assertThatCode(() -> dispatcher.dispatch(0, "storm")).doesNotThrowAnyException();

        assertThat(counter(ZeroMatchFallbackDispatcher.FAILED_METRIC)).isEqualTo(1.0);
        assertThat(counter(ZeroMatchFallbackDispatcher.DISPATCHED_METRIC)).isZero();
    }

    @Test
    void should_SkipEnqueue_When_ExtractionYieldsNoKeywords() {
        when(keywordExtractor.extractSearchKeywords("")).thenReturn("  ");

        assertThatCode(() -> dispatcher.dispatch(4, "")).doesNotThrowAnyException();

        verify(autoSyncQueue, never()).enqueueAutoSync(anyString());
        assertThat(counter(ZeroMatchFallbackDispatcher.FAILED_METRIC)).isEqualTo(1.0);
    }

    @Test
    void should_CountFailure_When_ExtractionThrows() {
        when(keywordExtractor.extractSearchKeywords("x")).thenThrow(new RuntimeException("boom"));

        dispatcher.dispatch(1, "x");

        verify(autoSyncQueue, never()).enqueueAutoSync(anyString());
        assertThat(counter(ZeroMatchFallbackDispatcher.FAILED_METRIC)).isEqualTo(1.0);
    }

    @Test
    void should_EmitJobId_When_KeywordsAreQueued() {
        when(keywordExtractor.extractSearchKeywords("rain on a tin roof")).thenReturn("rain roof");
        when(autoSyncQueue.enqueueAutoSync("rain roof")).thenReturn("autosync-rain-roof-7");

        StepVerifier.create(dispatcher.queueSync(3, "rain on a tin roof"))
            .expectNext("autosync-rain-roof-7")
            .verifyComplete();

        assertThat(counter(ZeroMatchFallbackDispatcher.DISPATCHED_METRIC)).isEqualTo(1.0);
    }

    @Test
    void should_ErrorWithoutEnqueue_When_ExtractionYieldsNothing() {
        when(keywordExtractor.extractSearchKeywords("...")).thenReturn("");

        StepVerifier.create(dispatcher.queueSync(5, "..."))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("scene 5"))
            .verify();

        verify(autoSyncQueue, never()).enqueueAutoSync(anyString());
        assertThat(counter(ZeroMatchFallbackDispatcher.FAILED_METRIC)).isEqualTo(1.0);
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }
}
