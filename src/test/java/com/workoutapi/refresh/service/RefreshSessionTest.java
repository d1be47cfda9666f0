package com.workoutapi.refresh.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RefreshSessionTest {

    @Test
    void testClose_ReleasesInReverseOrderEvenWhenOneFails() {
        List<String> released = new ArrayList<>();
        RefreshSession session = new RefreshSession(null,
                new IdempotencyStore(null, Duration.ofMinutes(1), Clock.systemUTC()),
                List.of(
                        () -> released.add("http"),
                        () -> {
                            throw new IllegalStateException("redis already closed");
                        },
                        () -> released.add("redis")));

        session.close();

        assertEquals(List.of("redis", "http"), released);
    }

    @Test
    void testClose_SecondCloseIsNoOp() {
        List<String> released = new ArrayList<>();
        RefreshSession session = new RefreshSession(null, null, List.of(() -> released.add("http")));

        session.close();
        session.close();

        assertEquals(List.of("http"), released);
    }
}
