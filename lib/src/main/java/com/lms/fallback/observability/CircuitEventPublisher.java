package com.lms.fallback.observability;

import com.lms.fallback.model.CircuitBreakerState;
import com.lms.fallback.model.CircuitStateListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Publishes circuit breaker state transitions as a reactive stream for
 * monitoring and alerting. Register it on a breaker with
 * {@link com.lms.fallback.resilience.CircuitBreaker#addListener}.
 */
public class CircuitEventPublisher implements CircuitStateListener {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitEventPublisher.class);
    
    private final String breakerName;
    private final Sinks.Many<CircuitTransitionEvent> eventSink;
    private final AtomicInteger subscriberCount = new AtomicInteger();
    
    public CircuitEventPublisher(String breakerName) {
        this.breakerName = breakerName;
        this.eventSink = Sinks.many().multicast().directBestEffort();
        
        logger.debug("CircuitEventPublisher initialized for {}", breakerName);
    }
    
    @Override
    public void onStateTransition(CircuitBreakerState from, CircuitBreakerState to, Instant at) {
        CircuitTransitionEvent event = new CircuitTransitionEvent(breakerName, from, to, at);
        
        // transitions may be reported from several request threads at once
        synchronized (eventSink) {
            Sinks.EmitResult result = eventSink.tryEmitNext(event);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                logger.warn("Failed to publish circuit transition {}: {}", event, result);
            } else {
                logger.debug("Published circuit transition: {}", event);
            }
        }
    }
    
    /**
     * Subscribes to circuit transitions.
     * 
     * @param listener the callback for transition events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(Consumer<CircuitTransitionEvent> listener) {
        int total = subscriberCount.incrementAndGet();
        logger.info("New circuit event subscriber for {} (total subscribers: {})", breakerName, total);
        
        return eventSink.asFlux()
            .doOnCancel(() -> {
                int remaining = subscriberCount.decrementAndGet();
                logger.info("Circuit event subscription cancelled for {} (remaining: {})", breakerName, remaining);
            })
            .subscribe(
                listener,
                error -> logger.error("Circuit event subscriber error", error)
            );
    }
    
    /**
     * Gets the transition stream for advanced reactive operations.
     * Only transitions that happen after subscription are delivered.
     */
    public Flux<CircuitTransitionEvent> getEventStream() {
        return eventSink.asFlux();
    }
    
    public int getSubscriberCount() {
        return subscriberCount.get();
    }
    
    /**
     * Completes the stream for all subscribers.
     */
    public void close() {
        synchronized (eventSink) {
            eventSink.tryEmitComplete();
        }
        logger.debug("CircuitEventPublisher closed for {}", breakerName);
    }
    
    /**
     * A single circuit state transition.
     */
    public record CircuitTransitionEvent(String breakerName, CircuitBreakerState from,
                                         CircuitBreakerState to, Instant timestamp) {
        
        @Override
        public String toString() {
            return String.format("CircuitTransitionEvent{breaker='%s', %s -> %s, at=%s}",
                breakerName, from, to, timestamp);
        }
    }
}
