package lattice.core.model;

/**
 * The two entity types held by an authorization store.
 */
public enum EntityType {
    ROLE("role"),
    PERMISSION("permission");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
