package app.corvana.importer.client.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoreLeadResponse(
        UUID id,
        String name,
        String website
) {
}
