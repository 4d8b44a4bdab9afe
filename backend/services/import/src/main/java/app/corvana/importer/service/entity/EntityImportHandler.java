package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.DetectedMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.mapping.MappingValidation;
import app.corvana.importer.service.parser.ParsedTable;

import java.util.List;

/**
 * Everything that differs between entity types on the way from a parsed file to candidates.
 */
public interface EntityImportHandler<C extends CandidateEntity> {

    EntityType type();

    List<CanonicalField> fields();

    /**
     * Fields of the repeatable contact groups on a row; empty for types without them.
     */
    default List<CanonicalField> contactSlotFields() {
        return List.of();
    }

    DetectedMapping detect(List<String> headers);

    MappingValidation validateMapping(FieldMapping mapping, int headerCount);

    /**
     * One candidate per data row, in row order. Pure: the same table and mapping always give equal candidates.
     */
    List<C> transform(ParsedTable table, FieldMapping mapping);
}
