package io.benchmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.util.DocumentPaths;
import io.benchmesh.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Partial furniture design. Instances are immutable: every accessor returns copies and
 * {@link #with(String, JsonNode)} produces a new document.
 */
public final class DesignDocument {
    public static final String TYPE = "type";
    public static final String WIDTH = "dimensions.width";
    public static final String HEIGHT = "dimensions.height";
    public static final String DEPTH = "dimensions.depth";
    public static final String MATERIALS = "materials";
    public static final String BOARD_THICKNESS = "boardThickness";
    public static final String JOINERY = "joinery";
    public static final String FEATURES = "features";
    public static final String STYLE = "style";

    private final ObjectNode root;

    private DesignDocument(ObjectNode root) {
        this.root = root;
    }

    public static DesignDocument empty() {
        return new DesignDocument(Jsons.object());
    }

    @JsonCreator
    public static DesignDocument of(JsonNode node) {
        if (node == null || node.isNull()) {
            return empty();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("design document must be a JSON object");
        }
        return new DesignDocument(((ObjectNode) node).deepCopy());
    }

    @JsonValue
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    public String type() {
        return text(TYPE);
    }

    public Double width() {
        return number(WIDTH);
    }

    public Double height() {
        return number(HEIGHT);
    }

    public Double depth() {
        return number(DEPTH);
    }

    public Double boardThickness() {
        return number(BOARD_THICKNESS);
    }

    public List<String> materials() {
        return strings(MATERIALS);
    }

    public Optional<String> primaryMaterial() {
        List<String> materials = materials();
        return materials.isEmpty() ? Optional.empty() : Optional.of(materials.get(0));
    }

    public List<String> joinery() {
        return strings(JOINERY);
    }

    public List<String> features() {
        return strings(FEATURES);
    }

    public String style() {
        return text(STYLE);
    }

    public boolean has(String path) {
        JsonNode node = DocumentPaths.get(root, path);
        return node != null && !node.isNull() && !(node.isContainerNode() && node.size() == 0);
    }

    public JsonNode get(String path) {
        JsonNode node = DocumentPaths.get(root, path);
        return node == null ? null : node.deepCopy();
    }

    public DesignDocument with(String path, JsonNode value) {
        ObjectNode copy = root.deepCopy();
        DocumentPaths.set(copy, path, value == null ? null : value.deepCopy());
        return new DesignDocument(copy);
    }

    public DesignDocument with(String path, Object value) {
        return with(path, Jsons.tree(value));
    }

    public DesignDocument withAppended(String path, String value) {
        List<String> values = new ArrayList<>(strings(path));
        if (values.contains(value)) {
            return this;
        }
        values.add(value);
        return with(path, values);
    }

    public boolean isEmpty() {
        return root.size() == 0;
    }

    private String text(String path) {
        JsonNode node = DocumentPaths.get(root, path);
        return node == null || node.isNull() ? null : node.asText();
    }

    private Double number(String path) {
        JsonNode node = DocumentPaths.get(root, path);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private List<String> strings(String path) {
        JsonNode node = DocumentPaths.get(root, path);
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            for (JsonNode item : (ArrayNode) node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    out.add(item.asText());
                } else if (item.isObject() && item.hasNonNull("type")) {
                    out.add(item.get("type").asText());
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            out.add(node.asText());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DesignDocument other)) {
            return false;
        }
        return root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return Jsons.canonical(root);
    }
}
