package app.corvana.importer.client.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CorePageResponse<T>(
        List<T> items,
        int page,
        int limit,
        long total,
        boolean hasMore
) {
}
