package app.corvana.importer.service.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record OpportunityCandidate(
        int rowIndex,
        String leadName,
        String name,
        BigDecimal value,
        ValueType valueType,
        Integer probability,
        LocalDate expectedCloseDate,
        OpportunityStatus status,
        String notes,
        boolean valid,
        List<String> validationErrors
) implements LeadReference {
    public OpportunityCandidate {
        validationErrors = List.copyOf(validationErrors);
    }

    @Override
    public String displayKey() {
        return name;
    }
}
