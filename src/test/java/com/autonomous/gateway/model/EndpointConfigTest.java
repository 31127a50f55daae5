package com.autonomous.gateway.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EndpointConfigTest {

    private static EndpointConfig config() {
        EndpointConfig config = new EndpointConfig();
        config.setEndpointId("sonnet");
        return config;
    }

    @Test
    void shouldHaveSensibleDefaults() {
        EndpointConfig config = config();

        assertEquals(60, config.getRequestsPerPeriod());
        assertEquals(Duration.ofMinutes(1), config.period());
        assertEquals(Duration.ofMinutes(2), config.defaultTimeout());
        assertNull(config.admissionDeadline());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void shouldGrowBackoffUpToMaximum() {
        EndpointConfig config = config();
        config.setBackoffBaseMs(1000);
        config.setBackoffMultiplier(2.0);
        config.setBackoffMaxMs(5000);

        assertEquals(1000, config.backoffForAttempt(1));
        assertEquals(2000, config.backoffForAttempt(2));
        assertEquals(4000, config.backoffForAttempt(3));
        assertEquals(5000, config.backoffForAttempt(4));
    }

    @Test
    void shouldRejectInvalidSettings() {
        EndpointConfig missingId = new EndpointConfig();
        assertThrows(IllegalArgumentException.class, missingId::validate);

        EndpointConfig noRequests = config();
        noRequests.setRequestsPerPeriod(0);
        assertThrows(IllegalArgumentException.class, noRequests::validate);

        EndpointConfig shrinkingBackoff = config();
        shrinkingBackoff.setBackoffMultiplier(0.5);
        assertThrows(IllegalArgumentException.class, shrinkingBackoff::validate);

        EndpointConfig noAttempts = config();
        noAttempts.setTypedMaxAttempts(0);
        assertThrows(IllegalArgumentException.class, noAttempts::validate);
        EndpointConfig noTimeout = config();
        noTimeout.setDefaultTimeoutMs(0);
        assertThrows(IllegalArgumentException.class, noTimeout::validate);

        EndpointConfig negativeTimeout = config();
        negativeTimeout.setDefaultTimeoutMs(-1);
        assertThrows(IllegalArgumentException.class, negativeTimeout::validate);

        EndpointConfig negativeDeadline = config();
        negativeDeadline.setAdmissionDeadlineMs(-1);
        assertThrows(IllegalArgumentException.class, negativeDeadline::validate);
    }
}
