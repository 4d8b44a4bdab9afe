package app.corvana.importer.controller.dto;

import app.corvana.importer.service.mapping.ContactSlotMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

public record UpdateMappingRequest(
        @NotNull Map<String, Integer> columns,
        List<Map<String, Integer>> contactSlots
) {
    public FieldMapping toMapping() {
        List<ContactSlotMapping> slots = contactSlots == null
                ? List.of()
                : contactSlots.stream().map(ContactSlotMapping::new).toList();
        return new FieldMapping(columns, slots);
    }
}
