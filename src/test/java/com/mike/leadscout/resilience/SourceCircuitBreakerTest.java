package com.mike.leadscout.resilience;

import com.mike.leadscout.metrics.LeadScoutMetrics;
import com.mike.leadscout.store.CaffeineKeyValueStore;
import com.mike.leadscout.support.MutableClock;
import com.mike.leadscout.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SourceCircuitBreakerTest {

    private static final String SOURCE = "source:yelp";

    private MutableClock clock;
    private LeadScoutMetrics metrics;
    private SourceCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        metrics = mock(LeadScoutMetrics.class);
        breaker = new SourceCircuitBreaker(CaffeineKeyValueStore.inMemory(), TestProperties.fastResilience(3), metrics, clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure(SOURCE);
        }
    }

    private void openAndWait() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));
        assertTrue(breaker.allowRequest(SOURCE));
    }

    @Nested
    @DisplayName("closed")
    class Closed {

        @Test
        @DisplayName("unknown source -> closed, allowed")
        void unknown_source_is_closed() {
            //Act
            boolean allowed = breaker.allowRequest("source:new");
            //Assert
            assertTrue(allowed);
            assertEquals(CircuitState.CLOSED, breaker.state("source:new"));
        }

        @Test
        @DisplayName("5 consecutive failures -> open, requests rejected")
        void opens_after_threshold() {
            //Act
            fail(5);
            //Assert
            assertEquals(CircuitState.OPEN, breaker.state(SOURCE));
            assertFalse(breaker.allowRequest(SOURCE));
            verify(metrics).circuitStateChanged(SOURCE, CircuitState.CLOSED, CircuitState.OPEN);
        }

        @Test
        @DisplayName("a success resets the consecutive count")
        void success_resets_count() {
            //Arrange
            fail(4);
            breaker.recordSuccess(SOURCE);
            //Act
            fail(4);
            //Assert
            assertEquals(CircuitState.CLOSED, breaker.state(SOURCE));
        }
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("before reset timeout -> still rejected")
        void rejected_before_timeout() {
            //Arrange
            fail(5);
            clock.advance(Duration.ofSeconds(59));
            //Act
            boolean allowed = breaker.allowRequest(SOURCE);
            //Assert
            assertFalse(allowed);
        }

        @Test
        @DisplayName("after reset timeout -> half-open, request allowed")
        void half_open_after_timeout() {
            //Arrange
            fail(5);
            clock.advance(Duration.ofSeconds(60));
            //Act
            boolean allowed = breaker.allowRequest(SOURCE);
            //Assert
            assertTrue(allowed);
            assertEquals(CircuitState.HALF_OPEN, breaker.state(SOURCE));
        }
    }

    @Nested
    @DisplayName("half-open")
    class HalfOpen {

        @Test
        @DisplayName("one success -> still half-open, two -> closed")
        void closes_after_required_successes() {
            //Arrange
            openAndWait();
            //Act
            breaker.recordSuccess(SOURCE);
            CircuitState afterOne = breaker.state(SOURCE);
            breaker.recordSuccess(SOURCE);
            //Assert
            assertEquals(CircuitState.HALF_OPEN, afterOne);
            assertEquals(CircuitState.CLOSED, breaker.state(SOURCE));
            assertEquals(0, breaker.status(SOURCE).failures());
        }

        @Test
        @DisplayName("any failure -> open again")
        void failure_reopens() {
            //Arrange
            openAndWait();
            breaker.recordSuccess(SOURCE);
            //Act
            breaker.recordFailure(SOURCE);
            //Assert
            assertEquals(CircuitState.OPEN, breaker.state(SOURCE));
            assertFalse(breaker.allowRequest(SOURCE));
            verify(metrics).circuitStateChanged(SOURCE, CircuitState.HALF_OPEN, CircuitState.OPEN);
        }
    }

    @Test
    @DisplayName("statuses lists every tracked source")
    void statuses_snapshot() {
        //Arrange
        fail(5);
        breaker.recordFailure("source:google_maps");
        //Act
        Map<String, CircuitState> statuses = breaker.statuses();
        //Assert
        assertEquals(CircuitState.OPEN, statuses.get(SOURCE));
        assertEquals(CircuitState.CLOSED, statuses.get("source:google_maps"));
    }

    @Test
    @DisplayName("reset -> closed")
    void reset_closes() {
        //Arrange
        fail(5);
        //Act
        breaker.reset(SOURCE);
        //Assert
        assertTrue(breaker.allowRequest(SOURCE));
        assertEquals(CircuitState.CLOSED, breaker.state(SOURCE));
    }
}
