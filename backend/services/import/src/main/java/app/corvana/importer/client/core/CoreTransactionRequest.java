package app.corvana.importer.client.core;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record CoreTransactionRequest(
        int ref,
        UUID accountId,
        LocalDate date,
        BigDecimal amount,
        String description,
        String notes
) {
}
