package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.ColumnMappingDetector;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.support.ImportValues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ContactImportHandler extends AbstractEntityImportHandler<ContactCandidate> {

    private static final List<CanonicalField> FIELDS = List.of(
            CanonicalField.required("lead_name", "Lead name",
                    "lead name", "lead", "company", "company name", "organization", "organisation",
                    "account", "account name"),
            CanonicalField.required("first_name", "First name",
                    "first name", "firstname", "given name", "contact first name", "name"),
            CanonicalField.optional("last_name", "Last name",
                    "last name", "lastname", "surname", "family name", "contact last name"),
            CanonicalField.optional("email", "Email",
                    "email", "e mail", "email address", "contact email"),
            CanonicalField.optional("phone", "Phone",
                    "phone", "phone number", "telephone", "tel", "mobile"),
            CanonicalField.optional("title", "Title",
                    "title", "job title", "position", "role"),
            CanonicalField.optional("notes", "Notes",
                    "notes", "note", "comments", "comment")
    );

    public ContactImportHandler(ColumnMappingDetector detector) {
        super(detector);
    }

    @Override
    public EntityType type() {
        return EntityType.contact;
    }

    @Override
    public List<CanonicalField> fields() {
        return FIELDS;
    }

    @Override
    protected ContactCandidate transformRow(RowReader row, int rowIndex, FieldMapping mapping) {
        List<String> errors = new ArrayList<>();
        String leadName = row.required("lead_name", "Lead name", errors);
        String firstName = row.required("first_name", "First name", errors);
        String email = row.text("email");
        if (email != null && !ImportValues.isEmail(email)) {
            errors.add("Invalid email: '" + email + "'");
        }
        return new ContactCandidate(
                rowIndex,
                leadName,
                firstName,
                row.text("last_name"),
                email,
                row.text("phone"),
                row.text("title"),
                row.text("notes"),
                errors.isEmpty(),
                errors
        );
    }
}
