package org.dataapi.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One entry of the {@code errors} array of a response.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor // For Jackson
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorDescriptor {
    @JsonProperty("errorCode")
    private String errorCode;
    @JsonProperty("message")
    private String message;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @JsonAnySetter
    void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }
}
