package org.dataapi.transport;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ResourceStatusAwaiterTest {

    private final ResourceStatusAwaiter awaiter = new ResourceStatusAwaiter();

    @Test
    void completesOnceTargetStatusIsReported() {
        Iterator<String> statuses = List.of("MAINTENANCE", "MAINTENANCE", "ACTIVE").iterator();
        var polls = new AtomicInteger();

        StepVerifier.withVirtualTime(() -> awaiter.awaitStatus("db", () -> Mono.fromSupplier(() -> {
                    polls.incrementAndGet();
                    return statuses.next();
                }), "ACTIVE", Set.of("MAINTENANCE"), Duration.ofSeconds(1), Duration.ofMinutes(1)))
            .expectSubscription()
            .thenAwait(Duration.ofSeconds(2))
            .expectNext("ACTIVE")
            .verifyComplete();

        assertEquals(3, polls.get());
    }

    @Test
    void failsOnUnexpectedStatus() {
        StepVerifier.create(awaiter.awaitStatus("db", () -> Mono.just("ERROR"),
                "ACTIVE", Set.of("MAINTENANCE"), Duration.ofSeconds(1), Duration.ofMinutes(1)))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(IllegalStateException.class, e);
                assertTrue(e.getMessage().contains("ERROR"));
            })
            .verify();
    }

    @Test
    void timesOutWhenTargetIsNeverReached() {
        StepVerifier.withVirtualTime(() -> awaiter.awaitStatus("db", () -> Mono.just("TERMINATING"),
                "TERMINATED", Set.of("TERMINATING"), Duration.ofSeconds(10), Duration.ofMinutes(5)))
            .expectSubscription()
            .thenAwait(Duration.ofMinutes(5))
            .expectError(DataApiTimeoutException.class)
            .verify();
    }
}
