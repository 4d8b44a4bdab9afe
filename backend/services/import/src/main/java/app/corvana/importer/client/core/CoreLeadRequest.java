package app.corvana.importer.client.core;

import java.util.List;

public record CoreLeadRequest(
        int ref,
        String name,
        String website,
        String industry,
        String status,
        String notes,
        String address,
        String city,
        String state,
        String country,
        String postalCode,
        String source,
        List<CoreLeadContactRequest> contacts
) {
}
