package app.corvana.importer.client.core;

import java.util.UUID;

public record CoreContactRequest(
        int ref,
        UUID leadId,
        String firstName,
        String lastName,
        String email,
        String phone,
        String title,
        String notes
) {
}
