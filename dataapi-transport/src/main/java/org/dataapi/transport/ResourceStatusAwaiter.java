package org.dataapi.transport;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Polls a remote resource until it reports a target status. Long-running administrative operations
 * (keyspace creation, database termination) are acknowledged immediately by the service and only
 * complete once the resource settles.
 */
@Slf4j
public class ResourceStatusAwaiter {

    /**
     * @param resourceName   used in log lines and errors only
     * @param statusProbe    fetches the current status; subscribed once per poll
     * @param target         status that completes the wait
     * @param legalStates    transitional statuses that keep the wait going; anything else fails it
     * @param pollInterval   delay between polls, the first poll is immediate
     * @param timeout        overall bound on the wait
     * @return a Mono emitting the target status
     */
    public Mono<String> awaitStatus(String resourceName,
                                    Supplier<Mono<String>> statusProbe,
                                    String target,
                                    Set<String> legalStates,
                                    Duration pollInterval,
                                    Duration timeout) {
        return Mono.defer(statusProbe)
            .flatMap(status -> {
                if (target.equals(status)) {
                    log.info("{} reached status {}", resourceName, status);
                    return Mono.just(status);
                }
                if (!legalStates.contains(status)) {
                    return Mono.<String>error(new IllegalStateException(
                        resourceName + " entered unexpected status " + status + " while waiting for " + target));
                }
                log.debug("{} is {}, waiting for {}", resourceName, status, target);
                return Mono.<String>empty();
            })
            .repeatWhenEmpty(polls -> polls.delayElements(pollInterval))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class,
                e -> new DataApiTimeoutException("awaitStatus(" + resourceName + ")", timeout, e));
    }
}
