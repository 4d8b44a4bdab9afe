package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.ColumnMappingDetector;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.support.ImportValues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TaskImportHandler extends AbstractEntityImportHandler<TaskCandidate> {

    private static final List<CanonicalField> FIELDS = List.of(
            CanonicalField.required("lead_name", "Lead name",
                    "lead name", "lead", "company", "company name", "organization", "account",
                    "account name", "client", "customer"),
            CanonicalField.required("title", "Title",
                    "title", "task", "task name", "subject", "summary", "name"),
            CanonicalField.optional("description", "Description",
                    "description", "details", "notes", "note", "body"),
            CanonicalField.optional("due_date", "Due date",
                    "due date", "due", "deadline", "due on", "date")
    );

    public TaskImportHandler(ColumnMappingDetector detector) {
        super(detector);
    }

    @Override
    public EntityType type() {
        return EntityType.task;
    }

    @Override
    public List<CanonicalField> fields() {
        return FIELDS;
    }

    @Override
    protected TaskCandidate transformRow(RowReader row, int rowIndex, FieldMapping mapping) {
        List<String> errors = new ArrayList<>();
        String leadName = row.required("lead_name", "Lead name", errors);
        String title = row.required("title", "Title", errors);
        return new TaskCandidate(
                rowIndex,
                leadName,
                title,
                row.text("description"),
                ImportValues.parseDate(row.raw("due_date")),
                errors.isEmpty(),
                errors
        );
    }
}
