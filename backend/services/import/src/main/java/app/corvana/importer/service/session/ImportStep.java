package app.corvana.importer.service.session;

public enum ImportStep {
    select_entity_type,
    upload,
    map_columns,
    preview,
    importing,
    complete
}
