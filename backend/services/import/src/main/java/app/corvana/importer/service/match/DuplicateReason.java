package app.corvana.importer.service.match;

public enum DuplicateReason {
    exact_name_and_domain,
    exact_name,
    same_domain,
    same_transaction,
    repeated_in_file
}
