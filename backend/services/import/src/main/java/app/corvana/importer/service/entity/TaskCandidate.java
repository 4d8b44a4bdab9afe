package app.corvana.importer.service.entity;

import java.time.LocalDate;
import java.util.List;

public record TaskCandidate(
        int rowIndex,
        String leadName,
        String title,
        String description,
        LocalDate dueDate,
        boolean valid,
        List<String> validationErrors
) implements LeadReference {
    public TaskCandidate {
        validationErrors = List.copyOf(validationErrors);
    }

    @Override
    public String displayKey() {
        return title;
    }
}
