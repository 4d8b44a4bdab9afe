package app.corvana.importer.client.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a batch insert. {@code ref} echoes the row reference sent with each item.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoreBatchResponse(
        List<Inserted> inserted,
        List<Failure> failures
) {
    public CoreBatchResponse {
        inserted = inserted == null ? List.of() : List.copyOf(inserted);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Inserted(int ref, UUID id, int subEntitiesCreated) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Failure(int ref, String message) {
    }
}
