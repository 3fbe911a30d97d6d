package com.lms.fallback.observability;

import com.lms.fallback.model.CircuitBreakerState;
import com.lms.fallback.observability.CircuitEventPublisher.CircuitTransitionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class CircuitEventPublisherTest {

    private static final Instant AT = Instant.parse("2025-01-21T00:00:00Z");

    private CircuitEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new CircuitEventPublisher("learner-primary");
    }

    @AfterEach
    void tearDown() {
        publisher.close();
    }

    @Test
    void testSubscriberReceivesTransitions() {
        List<CircuitTransitionEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = publisher.subscribe(received::add);

        publisher.onStateTransition(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN, AT);
        publisher.onStateTransition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, AT.plusSeconds(61));

        assertEquals(2, received.size());
        assertEquals(new CircuitTransitionEvent("learner-primary", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN, AT),
            received.get(0));
        assertEquals(CircuitBreakerState.HALF_OPEN, received.get(1).to());

        subscription.dispose();
    }

    @Test
    void testSubscriberCountTracksCancellation() {
        Disposable first = publisher.subscribe(event -> { });
        Disposable second = publisher.subscribe(event -> { });
        assertEquals(2, publisher.getSubscriberCount());

        first.dispose();
        assertEquals(1, publisher.getSubscriberCount());

        second.dispose();
        assertEquals(0, publisher.getSubscriberCount());
    }

    @Test
    void testEventStream() {
        StepVerifier.create(publisher.getEventStream().take(2))
            .then(() -> {
                publisher.onStateTransition(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.OPEN, AT);
                publisher.onStateTransition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN, AT);
            })
            .assertNext(event -> assertEquals(CircuitBreakerState.OPEN, event.to()))
            .assertNext(event -> assertEquals(CircuitBreakerState.HALF_OPEN, event.to()))
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void testPublishingWithoutSubscribersIsHarmless() {
        assertDoesNotThrow(() ->
            publisher.onStateTransition(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN, AT));
    }

    @Test
    void testCloseCompletesStream() {
        StepVerifier.create(publisher.getEventStream())
            .then(publisher::close)
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }
}
