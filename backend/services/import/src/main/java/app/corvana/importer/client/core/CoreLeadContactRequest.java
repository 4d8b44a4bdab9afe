package app.corvana.importer.client.core;

public record CoreLeadContactRequest(
        String firstName,
        String lastName,
        String email,
        String phone,
        String title
) {
}
