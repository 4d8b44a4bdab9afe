package app.corvana.importer.service.entity;

import java.util.List;

public record ContactCandidate(
        int rowIndex,
        String leadName,
        String firstName,
        String lastName,
        String email,
        String phone,
        String title,
        String notes,
        boolean valid,
        List<String> validationErrors
) implements LeadReference {
    public ContactCandidate {
        validationErrors = List.copyOf(validationErrors);
    }

    @Override
    public String displayKey() {
        return lastName == null ? firstName : firstName + " " + lastName;
    }
}
