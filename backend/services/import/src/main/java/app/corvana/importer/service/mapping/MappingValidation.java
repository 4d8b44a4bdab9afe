package app.corvana.importer.service.mapping;

import java.util.ArrayList;
import java.util.List;

public record MappingValidation(
        List<String> errors
) {
    public MappingValidation {
        errors = List.copyOf(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /**
     * Checks shared by every entity type: required fields mapped, every index inside the header row.
     */
    public static List<String> baseErrors(List<CanonicalField> fields, FieldMapping mapping, int headerCount) {
        List<String> errors = new ArrayList<>();
        for (CanonicalField field : fields) {
            Integer column = mapping.column(field.key());
            if (column == null) {
                if (field.required()) {
                    errors.add(field.label() + " column is required");
                }
            } else if (column < 0 || column >= headerCount) {
                errors.add(field.label() + " is mapped to a missing column (" + column + ")");
            }
        }
        return errors;
    }
}
