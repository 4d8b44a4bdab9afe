package app.corvana.importer.client.core;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record CoreOpportunityRequest(
        int ref,
        UUID leadId,
        String name,
        BigDecimal value,
        String valueType,
        Integer probability,
        LocalDate expectedCloseDate,
        String status,
        String notes
) {
}
