package app.corvana.importer.service.entity;

import app.corvana.importer.service.support.Vocabulary;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ValueType implements Vocabulary {
    ONE_TIME("one_time", "One-time"),
    RECURRING("recurring", "Monthly");

    private final String value;
    private final String label;

    ValueType(String value, String label) {
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
