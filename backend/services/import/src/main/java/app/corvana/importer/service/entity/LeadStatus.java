package app.corvana.importer.service.entity;

import app.corvana.importer.service.support.Vocabulary;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LeadStatus implements Vocabulary {
    NEW("new", "New"),
    CONTACTED("contacted", "Contacted"),
    QUALIFIED("qualified", "Qualified"),
    UNQUALIFIED("unqualified", "Unqualified"),
    CONVERTED("converted", "Converted");

    private final String value;
    private final String label;

    LeadStatus(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String label() {
        return label;
    }
}
