package io.benchmesh.rules;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Woodworking reference tables: shelf spans, joint strengths, load estimates, material and
 * joinery compatibility, material alternatives and furniture templates.
 */
public final class FurnitureKnowledge {
    public static final String RESOURCE = "/io/benchmesh/rules/furniture-knowledge.json";

    private final KnowledgeFile data;
    private final NavigableMap<Double, Map<String, Double>> spanRows = new TreeMap<>();

    private FurnitureKnowledge(KnowledgeFile data) {
        if (data == null || data.spanTable() == null || data.spanTable().isEmpty()) {
            throw new IllegalArgumentException("knowledge file requires a span table");
        }
        this.data = data;
        for (Map.Entry<String, Map<String, Double>> row : data.spanTable().entrySet()) {
            try {
                spanRows.put(Double.parseDouble(row.getKey()), row.getValue());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid span table thickness: " + row.getKey(), e);
            }
        }
    }

    public static FurnitureKnowledge bundled() {
        try (InputStream in = FurnitureKnowledge.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled knowledge resource: " + RESOURCE);
            }
            return new FurnitureKnowledge(Jsons.mapper().readValue(in, KnowledgeFile.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load bundled knowledge tables", e);
        }
    }

    public static FurnitureKnowledge load(Path file) {
        if (file == null || !Files.exists(file)) {
            return bundled();
        }
        try {
            return new FurnitureKnowledge(Jsons.mapper().readValue(file.toFile(), KnowledgeFile.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load knowledge tables: " + file, e);
        }
    }

    /**
     * Maximum unsupported shelf span in inches. Thicknesses between table rows are interpolated
     * linearly; below the thinnest row the span scales down with thickness, above the thickest row
     * it is capped. Materials missing from the table get the conservative default.
     */
    public double maxSpan(String material, double thickness) {
        double fallback = data.defaultMaxSpan() == null ? 24.0 : data.defaultMaxSpan();
        Map.Entry<Double, Map<String, Double>> lower = spanRows.floorEntry(thickness);
        Map.Entry<Double, Map<String, Double>> upper = spanRows.ceilingEntry(thickness);
        if (lower == null) {
            Double first = upper.getValue().get(material);
            return first == null ? fallback : first * (thickness / upper.getKey());
        }
        Double lowerSpan = lower.getValue().get(material);
        if (lowerSpan == null) {
            return fallback;
        }
        if (upper == null || upper.getKey().equals(lower.getKey())) {
            return lowerSpan;
        }
        Double upperSpan = upper.getValue().get(material);
        if (upperSpan == null) {
            return lowerSpan;
        }
        double ratio = (thickness - lower.getKey()) / (upper.getKey() - lower.getKey());
        return lowerSpan + (upperSpan - lowerSpan) * ratio;
    }

    /**
     * Thinnest table thickness whose span covers {@code span}, if any.
     */
    public Optional<Double> minThicknessFor(String material, double span) {
        for (Map.Entry<Double, Map<String, Double>> row : spanRows.entrySet()) {
            Double max = row.getValue().get(material);
            if (max != null && max >= span) {
                return Optional.of(row.getKey());
            }
        }
        return Optional.empty();
    }

    public double jointStrength(String joint, String material) {
        double fallback = data.defaultJointStrength() == null ? 300.0 : data.defaultJointStrength();
        Map<String, Double> byMaterial = data.jointStrength() == null ? null : data.jointStrength().get(joint);
        if (byMaterial == null) {
            return fallback;
        }
        Double value = byMaterial.get(material);
        return value == null ? fallback : value;
    }

    public double estimatedLoad(String type) {
        double fallback = data.defaultLoad() == null ? 100.0 : data.defaultLoad();
        if (type == null || data.typeLoads() == null) {
            return fallback;
        }
        Double value = data.typeLoads().get(type);
        return value == null ? fallback : value;
    }

    public String strongerJoint(String joint) {
        List<String> hierarchy = jointHierarchy();
        int index = hierarchy.indexOf(joint == null ? hierarchy.get(0) : joint);
        return hierarchy.get(Math.min(Math.max(index, 0) + 1, hierarchy.size() - 1));
    }

    public List<String> jointHierarchy() {
        List<String> hierarchy = data.jointHierarchy();
        return hierarchy == null || hierarchy.isEmpty() ? List.of("screw") : hierarchy;
    }

    public boolean knowsMaterial(String material) {
        return data.compatibility() != null && data.compatibility().containsKey(material);
    }

    public List<String> compatibleJoints(String material) {
        if (data.compatibility() == null) {
            return List.of();
        }
        List<String> joints = data.compatibility().get(material);
        return joints == null ? List.of() : List.copyOf(joints);
    }

    public boolean isCompatible(String material, String joint) {
        return compatibleJoints(material).contains(joint);
    }

    public String bestJoint(String material) {
        List<String> joints = compatibleJoints(material);
        return joints.isEmpty() ? "screw" : joints.get(joints.size() - 1);
    }

    public List<String> alternatives(String material) {
        if (data.alternatives() == null || material == null) {
            return List.of();
        }
        List<String> values = data.alternatives().get(material);
        return values == null ? List.of() : List.copyOf(values);
    }

    public boolean isShelving(String type) {
        return type != null && data.shelvingTypes() != null && data.shelvingTypes().contains(type);
    }

    public Template template(String type) {
        Map<String, Template> templates = data.templates();
        if (templates == null) {
            return new Template(Jsons.object(), List.of());
        }
        Template template = type == null ? null : templates.get(type);
        if (template == null) {
            template = templates.get("default");
        }
        return template == null ? new Template(Jsons.object(), List.of()) : template;
    }

    public List<Double> thicknesses() {
        return new ArrayList<>(spanRows.keySet());
    }

    public record Template(ObjectNode dimensions, List<String> features) {
        public Template {
            dimensions = dimensions == null ? Jsons.object() : dimensions.deepCopy();
            features = features == null ? List.of() : List.copyOf(features);
        }

        @Override
        public ObjectNode dimensions() {
            return dimensions.deepCopy();
        }
    }

    record KnowledgeFile(
            Double defaultMaxSpan,
            Map<String, Map<String, Double>> spanTable,
            Double defaultJointStrength,
            Map<String, Map<String, Double>> jointStrength,
            Double defaultLoad,
            Map<String, Double> typeLoads,
            List<String> jointHierarchy,
            Map<String, List<String>> compatibility,
            Map<String, List<String>> alternatives,
            List<String> shelvingTypes,
            Map<String, Template> templates
    ) {
    }
}
