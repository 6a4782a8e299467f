package org.dataapi.collections.bulk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.dataapi.transport.CommandExecutor;
import org.dataapi.transport.CommandOptions;
import org.dataapi.transport.CommandResponse;
import org.dataapi.transport.DataApiResponseException;
import org.dataapi.transport.DataApiTimeoutException;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs a list of independent mutation commands and folds every response into one accumulator.
 *
 * Ordered runs send one command at a time in input order and stop at the first rejected command; nothing
 * after it is sent. Unordered runs keep up to {@code concurrency} commands in flight, record rejected and
 * timed out commands and keep going. Either way, any error other than a rejection (or, for unordered runs,
 * a timeout) aborts the run and surfaces unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class MutationOrchestrator {
    private final CommandExecutor executor;

    /** Builds the aggregated error of a run from its failures and everything merged so far. */
    @FunctionalInterface
    public interface FailureFactory<R> {
        DataApiResponseException create(List<CommandFailure> failures, R partialResult);
    }

    public <R extends ResultAccumulator> Mono<R> executeOrdered(
        List<ObjectNode> commands,
        R result,
        CommandOptions options,
        FailureFactory<R> failureFactory
    ) {
        return Flux.range(0, commands.size())
            .concatMap(index -> {
                var command = commands.get(index);
                return send(index, command, options)
                    .doOnNext(response -> result.merge(index, response))
                    .onErrorResume(DataApiResponseException.class, e -> {
                        var failure = CommandFailure.rejected(index, command, e);
                        mergePartialEffect(result, failure);
                        log.atDebug().setMessage("Ordered run stopped at operation {} of {}")
                            .addArgument(index)
                            .addArgument(commands.size())
                            .log();
                        return Mono.error(failureFactory.create(List.of(failure), result));
                    });
            })
            .then(Mono.fromSupplier(() -> result));
    }

    public <R extends ResultAccumulator> Mono<R> executeUnordered(
        List<ObjectNode> commands,
        R result,
        int concurrency,
        CommandOptions options,
        FailureFactory<R> failureFactory
    ) {
        if (concurrency < 1) {
            return Mono.error(new IllegalArgumentException("Concurrency must be at least 1, was " + concurrency));
        }
        var failures = new CopyOnWriteArrayList<CommandFailure>();
        return Flux.range(0, commands.size())
            .flatMap(index -> {
                var command = commands.get(index);
                return send(index, command, options)
                    .doOnNext(response -> result.merge(index, response))
                    .then()
                    .onErrorResume(DataApiResponseException.class, e -> {
                        var failure = CommandFailure.rejected(index, command, e);
                        mergePartialEffect(result, failure);
                        failures.add(failure);
                        log.warn("Operation {} was rejected: {}", index, e.getMessage());
                        return Mono.empty();
                    })
                    .onErrorResume(DataApiTimeoutException.class, e -> {
                        failures.add(CommandFailure.timedOut(index, command, e));
                        log.warn("Operation {} timed out after {}", index, e.getTimeout());
                        return Mono.empty();
                    });
            }, concurrency)
            .then(Mono.defer(() -> {
                if (failures.isEmpty()) {
                    return Mono.just(result);
                }
                var sorted = new ArrayList<>(failures);
                sorted.sort(Comparator.comparingInt(CommandFailure::index));
                return Mono.error(failureFactory.create(sorted, result));
            }));
    }

    private Mono<CommandResponse> send(int index, ObjectNode command, CommandOptions options) {
        return Mono.defer(() -> executor.execute(command, options))
            .doFirst(() -> log.atDebug().setMessage("Sending operation {}: {}")
                .addArgument(index)
                .addArgument(() -> CommandExecutor.commandName(command))
                .log())
            .doOnSuccess(unused -> log.atDebug().setMessage("Operation {} succeeded").addArgument(index).log());
    }

    private static void mergePartialEffect(ResultAccumulator result, CommandFailure failure) {
        var raw = failure.rawResponse();
        if (raw != null && raw.status() != null) {
            result.merge(failure.index(), raw);
        }
    }
}
