package org.dataapi.collections.bulk;

import java.util.List;
import java.util.stream.Collectors;

import org.dataapi.transport.CommandResponse;
import org.dataapi.transport.DataApiException;
import org.dataapi.transport.DataApiResponseException;
import org.dataapi.transport.DataApiTimeoutException;
import org.dataapi.transport.DetailedErrorDescriptor;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One operation of a run that did not succeed. {@code rawResponse} is null for timeouts.
 */
public record CommandFailure(
    int index,
    ObjectNode command,
    CommandResponse rawResponse,
    DataApiException cause
) {
    public static CommandFailure rejected(int index, ObjectNode command, DataApiResponseException cause) {
        return new CommandFailure(index, command, rawResponseOf(cause), cause);
    }

    public static CommandFailure timedOut(int index, ObjectNode command, DataApiTimeoutException cause) {
        return new CommandFailure(index, command, null, cause);
    }

    public boolean isTimeout() {
        return cause instanceof DataApiTimeoutException;
    }

    static CommandResponse rawResponseOf(DataApiResponseException e) {
        var detailed = e.getDetailedErrorDescriptors();
        return detailed.isEmpty() ? null : detailed.get(0).rawResponse();
    }

    static List<DetailedErrorDescriptor> describe(List<CommandFailure> failures) {
        return failures.stream()
            .filter(f -> f.rawResponse() != null)
            .map(f -> new DetailedErrorDescriptor(f.command(), f.rawResponse(),
                f.rawResponse().errors() != null ? f.rawResponse().errors() : List.of()))
            .collect(Collectors.toList());
    }
}
