package app.corvana.importer.client.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoreTransactionResponse(
        UUID id,
        UUID accountId,
        LocalDate date,
        BigDecimal amount,
        String description
) {
}
