package app.corvana.importer.client.core;

import java.time.LocalDate;
import java.util.UUID;

public record CoreTaskRequest(
        int ref,
        UUID leadId,
        String title,
        String description,
        LocalDate dueDate
) {
}
