package io.gamestate.core.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Structured detail for a {@link StoreError}: what was attempted, why it failed,
 * optionally the relevant state and a hint for the caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorContext(String action, String reason, Map<String, Object> state, String suggestion) {
}
