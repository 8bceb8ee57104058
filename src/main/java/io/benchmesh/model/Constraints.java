package io.benchmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.util.DocumentPaths;
import io.benchmesh.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured limits on acceptable proposals, grouped into dimensional, material, structural,
 * aesthetic and budget sections.
 */
public final class Constraints {
    public static final String DIMENSIONAL = "dimensional";
    public static final String MATERIAL = "material";
    public static final String STRUCTURAL = "structural";
    public static final String AESTHETIC = "aesthetic";
    public static final String BUDGET = "budget";

    private final ObjectNode root;

    private Constraints(ObjectNode root) {
        this.root = root;
    }

    public static Constraints defaults() {
        ObjectNode root = Jsons.object();
        root.putObject(DIMENSIONAL);
        root.putObject(MATERIAL);
        ObjectNode structural = root.putObject(STRUCTURAL);
        structural.put("min_load_capacity", 50);
        structural.put("min_safety_factor", 2);
        structural.put("stability_requirement", "standard");
        root.putObject(AESTHETIC);
        root.putObject(BUDGET);
        return new Constraints(root);
    }

    @JsonCreator
    public static Constraints of(JsonNode node) {
        if (node == null || node.isNull()) {
            return new Constraints(Jsons.object());
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("constraints must be a JSON object");
        }
        return new Constraints(((ObjectNode) node).deepCopy());
    }

    @JsonValue
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    public JsonNode get(String path) {
        JsonNode node = DocumentPaths.get(root, path);
        return node == null ? null : node.deepCopy();
    }

    public Double number(String path) {
        JsonNode node = DocumentPaths.get(root, path);
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    public double minSafetyFactor() {
        Double value = number(STRUCTURAL + ".min_safety_factor");
        return value == null ? 2.0 : value;
    }

    public Double maxDimension(String axis) {
        return number(DIMENSIONAL + ".max" + capitalize(axis));
    }

    public Double minDimension(String axis) {
        return number(DIMENSIONAL + ".min" + capitalize(axis));
    }

    public List<String> excludedMaterials() {
        List<String> out = new ArrayList<>();
        JsonNode node = DocumentPaths.get(root, MATERIAL + ".excluded");
        if (node != null && node.isArray()) {
            node.forEach(item -> out.add(item.asText()));
        }
        return out;
    }

    private static String capitalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(raw.charAt(0)) + raw.substring(1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Constraints other)) {
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
