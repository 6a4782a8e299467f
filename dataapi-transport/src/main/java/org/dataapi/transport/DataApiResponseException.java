package org.dataapi.transport;

import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

/**
 * The service rejected one or more commands with a well-formed response. Unlike transport failures, the
 * responses are available and may report partial effects.
 */
@Getter
public class DataApiResponseException extends DataApiException {
    private final List<ErrorDescriptor> errorDescriptors;
    private final List<DetailedErrorDescriptor> detailedErrorDescriptors;

    public DataApiResponseException(String message, List<DetailedErrorDescriptor> detailedErrorDescriptors) {
        super(message);
        this.detailedErrorDescriptors = List.copyOf(detailedErrorDescriptors);
        this.errorDescriptors = detailedErrorDescriptors.stream()
            .flatMap(d -> d.errorDescriptors().stream())
            .collect(Collectors.toUnmodifiableList());
    }

    public static DataApiResponseException fromResponse(ObjectNode command, CommandResponse response) {
        var descriptors = response.errors() != null ? response.errors() : List.<ErrorDescriptor>of();
        var detailed = new DetailedErrorDescriptor(command, response, descriptors);
        return new DataApiResponseException(messageOf(descriptors), List.of(detailed));
    }

    protected static String messageOf(List<ErrorDescriptor> descriptors) {
        if (descriptors.isEmpty()) {
            return "Command failed with no error descriptors";
        }
        var first = descriptors.get(0).getMessage() != null
            ? descriptors.get(0).getMessage()
            : descriptors.get(0).getErrorCode();
        return descriptors.size() == 1
            ? first
            : first + " (+ " + (descriptors.size() - 1) + " more errors)";
    }
}
