package app.corvana.importer.service.entity;

import app.corvana.importer.service.mapping.ColumnMappingDetector;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.parser.ParsedTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContactImportHandlerTest {

    private final ContactImportHandler handler = new ContactImportHandler(new ColumnMappingDetector());

    @Test
    void validatesRequiredFieldsAndEmail() {
        ParsedTable table = new ParsedTable(
                List.of("Lead", "First Name", "Last Name", "Email"),
                List.of(
                        List.of("Acme", "Ann", "Lee", "ann@acme.com"),
                        List.of("Acme", "Bob", "", "not-an-email"),
                        List.of("", "Cy", "", "")
                )
        );
        FieldMapping mapping = handler.detect(table.headers()).mapping();

        assertEquals(0, mapping.column("lead_name"));
        assertEquals(1, mapping.column("first_name"));
        assertEquals(2, mapping.column("last_name"));
        assertEquals(3, mapping.column("email"));

        List<ContactCandidate> contacts = handler.transform(table, mapping);

        assertTrue(contacts.get(0).valid());
        assertEquals("Acme", contacts.get(0).leadName());
        assertEquals("Ann Lee", contacts.get(0).displayKey());

        assertFalse(contacts.get(1).valid());
        assertEquals(List.of("Invalid email: 'not-an-email'"), contacts.get(1).validationErrors());

        assertEquals(List.of("Lead name is required"), contacts.get(2).validationErrors());
    }
}
