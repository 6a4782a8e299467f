package org.dataapi.transport;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.dataapi.transport.http.AbstractRestClient;
import org.dataapi.transport.http.ConnectionContext;
import org.dataapi.transport.http.DataApiHeaders;
import org.dataapi.transport.http.HttpResponse;
import org.dataapi.transport.http.ReactorNettyRestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Executes commands by POSTing them as JSON to {@code <base>/<namespace>[/<collection>]}.
 */
@Slf4j
public class DataApiHttpClient implements CommandExecutor {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final AbstractRestClient restClient;
    private final Duration defaultTimeout;

    public DataApiHttpClient(ConnectionContext connectionContext) {
        this(new ReactorNettyRestClient(connectionContext), DEFAULT_TIMEOUT);
    }

    public DataApiHttpClient(AbstractRestClient restClient, Duration defaultTimeout) {
        this.restClient = restClient;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public Mono<CommandResponse> execute(ObjectNode command, CommandOptions options) {
        var connectionContext = restClient.getConnectionContext();
        var namespace = options.namespace() != null ? options.namespace() : connectionContext.getDefaultNamespace();
        var path = options.collection() != null ? namespace + "/" + options.collection() : namespace;
        var timeout = options.timeout() != null ? options.timeout() : defaultTimeout;
        var commandName = CommandExecutor.commandName(command);
        var headers = DataApiHeaders.authentication(connectionContext.getToken());

        return Mono.fromCallable(() -> OBJECT_MAPPER.writeValueAsString(command))
            .onErrorMap(JsonProcessingException.class,
                e -> new IllegalArgumentException("Unable to serialize command " + commandName, e))
            .doOnNext(body -> log.atDebug().setMessage("Sending {} to /{}: {}")
                .addArgument(commandName).addArgument(path).addArgument(body).log())
            .flatMap(body -> restClient.postAsync(path, body, headers))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new DataApiTimeoutException(commandName, timeout, e))
            .onErrorMap(DataApiHttpClient::isUnclassified, e -> connectionFailure(commandName, e))
            .map(response -> interpret(command, response));
    }

    private static boolean isUnclassified(Throwable e) {
        return !(e instanceof DataApiException) && !(e instanceof IllegalArgumentException);
    }

    private static DataApiHttpException connectionFailure(String commandName, Throwable cause) {
        log.atWarn().setMessage("{} failed before a response arrived").addArgument(commandName).setCause(cause).log();
        return new DataApiHttpException(DataApiHttpException.NO_RESPONSE,
            "No response to " + commandName + ": " + cause.getMessage(), null, cause);
    }

    private CommandResponse interpret(ObjectNode command, HttpResponse response) {
        if (response.statusCode() >= 500) {
            throw new DataApiHttpException(response.statusCode(), response.statusText(), response.body());
        }
        if (response.body() == null || response.body().isBlank()) {
            throw new DataApiHttpException(response.statusCode(), "Empty response body", response.body());
        }

        CommandResponse parsed;
        try {
            parsed = OBJECT_MAPPER.readValue(response.body(), CommandResponse.class);
        } catch (JsonProcessingException e) {
            throw new DataApiHttpException(response.statusCode(), "Unparsable response body", response.body(), e);
        }

        if (parsed.hasErrors()) {
            throw DataApiResponseException.fromResponse(command, parsed);
        }
        if (!response.isSuccessful()) {
            throw new DataApiHttpException(response.statusCode(), response.statusText(), response.body());
        }
        return parsed;
    }
}
