package app.corvana.importer.service.entity;

import app.corvana.importer.config.ImportProps;
import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.ColumnMappingDetector;
import app.corvana.importer.service.mapping.ContactSlotMapping;
import app.corvana.importer.service.mapping.DetectedMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.support.ImportValues;
import app.corvana.importer.service.support.Vocabulary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class LeadImportHandler extends AbstractEntityImportHandler<LeadCandidate> {

    private static final List<CanonicalField> FIELDS = List.of(
            CanonicalField.required("name", "Name",
                    "name", "company", "company name", "lead name", "lead", "organization", "organisation",
                    "business", "account name"),
            CanonicalField.optional("website", "Website",
                    "website", "web site", "url", "domain", "homepage", "site"),
            CanonicalField.optional("industry", "Industry",
                    "industry", "sector", "vertical"),
            CanonicalField.optional("status", "Status",
                    "status", "lead status", "stage"),
            CanonicalField.optional("notes", "Notes",
                    "notes", "note", "comments", "comment", "description"),
            CanonicalField.optional("address", "Address",
                    "address", "street", "street address", "address line 1", "address 1"),
            CanonicalField.optional("city", "City",
                    "city", "town"),
            CanonicalField.optional("state", "State",
                    "state", "province", "region", "county"),
            CanonicalField.optional("country", "Country",
                    "country", "nation"),
            CanonicalField.optional("postal_code", "Postal code",
                    "postal code", "zip", "zip code", "postcode", "post code"),
            CanonicalField.optional("source", "Source",
                    "source", "lead source", "channel", "origin")
    );

    // first_name stays first: a bare "Contact N" header maps to it
    static final List<CanonicalField> CONTACT_FIELDS = List.of(
            CanonicalField.required("first_name", "First name",
                    "first name", "firstname", "given name", "contact first name", "contact name", "contact"),
            CanonicalField.optional("last_name", "Last name",
                    "last name", "lastname", "surname", "family name", "contact last name"),
            CanonicalField.optional("email", "Email",
                    "email", "e mail", "email address", "contact email"),
            CanonicalField.optional("phone", "Phone",
                    "phone", "phone number", "telephone", "tel", "mobile", "contact phone"),
            CanonicalField.optional("title", "Title",
                    "title", "job title", "position", "role", "contact title")
    );

    private final ImportProps props;

    public LeadImportHandler(ColumnMappingDetector detector, ImportProps props) {
        super(detector);
        this.props = props;
    }

    @Override
    public EntityType type() {
        return EntityType.lead;
    }

    @Override
    public List<CanonicalField> fields() {
        return FIELDS;
    }

    @Override
    public List<CanonicalField> contactSlotFields() {
        return CONTACT_FIELDS;
    }

    @Override
    public DetectedMapping detect(List<String> headers) {
        return detector.detect(headers, FIELDS, CONTACT_FIELDS, props.maxContactSlots());
    }

    @Override
    protected void addMappingErrors(FieldMapping mapping, int headerCount, List<String> errors) {
        List<ContactSlotMapping> slots = mapping.contactSlots();
        if (slots.size() > props.maxContactSlots()) {
            errors.add("At most " + props.maxContactSlots() + " contacts per lead are supported");
        }
        for (int i = 0; i < slots.size(); i++) {
            ContactSlotMapping slot = slots.get(i);
            if (slot.isEmpty()) {
                continue;
            }
            String prefix = "Contact " + (i + 1) + ": ";
            for (CanonicalField field : CONTACT_FIELDS) {
                Integer column = slot.column(field.key());
                if (column != null && (column < 0 || column >= headerCount)) {
                    errors.add(prefix + field.label() + " is mapped to a missing column (" + column + ")");
                }
            }
        }
    }

    @Override
    protected LeadCandidate transformRow(RowReader row, int rowIndex, FieldMapping mapping) {
        List<String> errors = new ArrayList<>();
        String name = row.required("name", "Name", errors);
        LeadStatus status = Vocabulary.parse(row.raw("status"), LeadStatus.class, LeadStatus.NEW);

        List<LeadContactCandidate> contacts = new ArrayList<>();
        for (ContactSlotMapping slot : mapping.contactSlots()) {
            String firstName = ImportValues.clean(row.cell(slot.column("first_name")));
            if (firstName == null) {
                continue;
            }
            contacts.add(new LeadContactCandidate(
                    firstName,
                    ImportValues.clean(row.cell(slot.column("last_name"))),
                    ImportValues.clean(row.cell(slot.column("email"))),
                    ImportValues.clean(row.cell(slot.column("phone"))),
                    ImportValues.clean(row.cell(slot.column("title")))
            ));
        }

        return new LeadCandidate(
                rowIndex,
                name,
                row.text("website"),
                row.text("industry"),
                status,
                row.text("notes"),
                row.text("address"),
                row.text("city"),
                row.text("state"),
                row.text("country"),
                row.text("postal_code"),
                row.text("source"),
                contacts,
                errors.isEmpty(),
                errors
        );
    }
}
