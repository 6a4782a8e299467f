package org.dataapi.transport;

import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The errors reported for one command, together with the command and the full response so the caller can
 * inspect any partial effect it reports.
 */
public record DetailedErrorDescriptor(
    ObjectNode command,
    CommandResponse rawResponse,
    List<ErrorDescriptor> errorDescriptors
) {}
