package app.corvana.importer.service.entity;

import app.corvana.importer.service.support.Vocabulary;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OpportunityStatus implements Vocabulary {
    ACTIVE("active", "Active"),
    WON("won", "Won"),
    LOST("lost", "Lost");

    private final String value;
    private final String label;

    OpportunityStatus(String value, String label) {
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
