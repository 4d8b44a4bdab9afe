package app.corvana.importer.service.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record TransactionCandidate(
        int rowIndex,
        LocalDate date,
        BigDecimal amount,
        String description,
        String notes,
        boolean valid,
        List<String> validationErrors
) implements CandidateEntity {
    public TransactionCandidate {
        validationErrors = List.copyOf(validationErrors);
    }

    @Override
    public String displayKey() {
        return description;
    }
}
