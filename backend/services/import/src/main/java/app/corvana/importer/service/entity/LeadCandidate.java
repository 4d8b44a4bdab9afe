package app.corvana.importer.service.entity;

import java.util.List;

public record LeadCandidate(
        int rowIndex,
        String name,
        String website,
        String industry,
        LeadStatus status,
        String notes,
        String address,
        String city,
        String state,
        String country,
        String postalCode,
        String source,
        List<LeadContactCandidate> contacts,
        boolean valid,
        List<String> validationErrors
) implements CandidateEntity {
    public LeadCandidate {
        contacts = List.copyOf(contacts);
        validationErrors = List.copyOf(validationErrors);
    }

    @Override
    public String displayKey() {
        return name;
    }
}
