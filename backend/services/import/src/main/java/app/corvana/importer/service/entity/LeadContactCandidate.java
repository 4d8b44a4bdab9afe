package app.corvana.importer.service.entity;

public record LeadContactCandidate(
        String firstName,
        String lastName,
        String email,
        String phone,
        String title
) {
}
