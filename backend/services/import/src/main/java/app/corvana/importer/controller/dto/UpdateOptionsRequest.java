package app.corvana.importer.controller.dto;

import app.corvana.importer.service.session.ImportOptions;

public record UpdateOptionsRequest(
        boolean includeDuplicates
) {
    public ImportOptions toOptions() {
        return new ImportOptions(includeDuplicates, false);
    }
}
