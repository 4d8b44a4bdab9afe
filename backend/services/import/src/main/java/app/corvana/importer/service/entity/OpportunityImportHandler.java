package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.ColumnMappingDetector;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.support.ImportValues;
import app.corvana.importer.service.support.Vocabulary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class OpportunityImportHandler extends AbstractEntityImportHandler<OpportunityCandidate> {

    private static final List<CanonicalField> FIELDS = List.of(
            CanonicalField.required("lead_name", "Lead name",
                    "lead name", "lead", "company", "company name", "organization", "account",
                    "account name", "client", "customer"),
            CanonicalField.required("name", "Name",
                    "opportunity name", "opportunity", "deal name", "deal", "name", "title"),
            CanonicalField.optional("value", "Value",
                    "value", "amount", "deal value", "deal size", "revenue", "price"),
            CanonicalField.optional("value_type", "Value type",
                    "value type", "billing type", "recurrence", "type"),
            CanonicalField.optional("probability", "Probability",
                    "probability", "win probability", "likelihood", "chance"),
            CanonicalField.optional("expected_close_date", "Expected close date",
                    "expected close date", "close date", "expected close", "closing date"),
            CanonicalField.optional("status", "Status",
                    "status", "stage", "deal status"),
            CanonicalField.optional("notes", "Notes",
                    "notes", "note", "comments", "comment", "description")
    );

    public OpportunityImportHandler(ColumnMappingDetector detector) {
        super(detector);
    }

    @Override
    public EntityType type() {
        return EntityType.opportunity;
    }

    @Override
    public List<CanonicalField> fields() {
        return FIELDS;
    }

    @Override
    protected OpportunityCandidate transformRow(RowReader row, int rowIndex, FieldMapping mapping) {
        List<String> errors = new ArrayList<>();
        String leadName = row.required("lead_name", "Lead name", errors);
        String name = row.required("name", "Name", errors);
        return new OpportunityCandidate(
                rowIndex,
                leadName,
                name,
                ImportValues.parseAmount(row.raw("value")),
                Vocabulary.parse(row.raw("value_type"), ValueType.class, ValueType.ONE_TIME),
                ImportValues.parseProbability(row.raw("probability")),
                ImportValues.parseDate(row.raw("expected_close_date")),
                Vocabulary.parse(row.raw("status"), OpportunityStatus.class, OpportunityStatus.ACTIVE),
                row.text("notes"),
                errors.isEmpty(),
                errors
        );
    }
}
