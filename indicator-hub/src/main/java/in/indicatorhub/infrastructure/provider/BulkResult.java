package in.indicatorhub.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One item of a bulk response. {@code result} is null when the provider
 * reported errors for the item instead.
 */
public record BulkResult(String id, JsonNode result, List<String> errors) {

    public BulkResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
