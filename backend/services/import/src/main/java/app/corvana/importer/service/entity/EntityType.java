package app.corvana.importer.service.entity;

public enum EntityType {
    transaction(true, false),
    lead(true, false),
    contact(false, true),
    opportunity(false, true),
    task(false, true);

    private final boolean duplicateDetectable;
    private final boolean leadReferencing;

    EntityType(boolean duplicateDetectable, boolean leadReferencing) {
        this.duplicateDetectable = duplicateDetectable;
        this.leadReferencing = leadReferencing;
    }

    public boolean duplicateDetectable() {
        return duplicateDetectable;
    }

    public boolean leadReferencing() {
        return leadReferencing;
    }
}
