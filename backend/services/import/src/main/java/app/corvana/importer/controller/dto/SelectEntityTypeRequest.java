package app.corvana.importer.controller.dto;

import app.corvana.importer.service.entity.EntityType;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record SelectEntityTypeRequest(
        @NotNull EntityType entityType,
        UUID accountId
) {
}
