package io.benchmesh.model;

public enum Intent {
    DESIGN_INITIATION("design_initiation"),
    DIMENSION_SPECIFICATION("dimension_specification"),
    MATERIAL_SELECTION("material_selection"),
    JOINERY_METHOD("joinery_method"),
    STYLE_AESTHETIC("style_aesthetic"),
    MODIFICATION_REQUEST("modification_request"),
    CONSTRAINT_SPECIFICATION("constraint_specification"),
    VALIDATION_CHECK("validation_check"),
    ASSEMBLY_QUERY("assembly_query"),
    EXPORT_REQUEST("export_request"),
    CLARIFICATION_NEEDED("clarification_needed");

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Intent fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CLARIFICATION_NEEDED;
        }
        for (Intent value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown intent: " + raw);
    }
}
