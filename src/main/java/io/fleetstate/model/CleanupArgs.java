package io.fleetstate.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.fleetstate.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, persisted arguments of a cleanup task. Arguments are versioned by count: a task
 * written before an argument existed simply has fewer of them, and decoders fill the gap
 * with the kind's legacy default.
 */
public record CleanupArgs(List<JsonNode> values) {
    private static final CleanupArgs NONE = new CleanupArgs(List.of());

    public CleanupArgs {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static CleanupArgs none() {
        return NONE;
    }

    public static CleanupArgs of(Object... raw) {
        if (raw == null || raw.length == 0) {
            return NONE;
        }
        List<JsonNode> nodes = new ArrayList<>(raw.length);
        for (Object value : raw) {
            nodes.add(Jsons.mapper().valueToTree(value));
        }
        return new CleanupArgs(nodes);
    }

    public static CleanupArgs fromJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        JsonNode node;
        try {
            node = Jsons.readTree(raw);
        } catch (RuntimeException e) {
            throw new CleanupArgsException("malformed cleanup args", e);
        }
        if (!node.isArray()) {
            throw new CleanupArgsException("cleanup args must be a JSON array, got " + node.getNodeType());
        }
        List<JsonNode> nodes = new ArrayList<>(node.size());
        node.forEach(nodes::add);
        return new CleanupArgs(nodes);
    }

    /**
     * @return the JSON array text, or {@code null} when there are no arguments
     */
    public String toJson() {
        if (values.isEmpty()) {
            return null;
        }
        ArrayNode array = Jsons.mapper().createArrayNode();
        values.forEach(array::add);
        return Jsons.toCompactJson(array);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public CleanupArgs requireAtMost(int max) {
        if (values.size() > max) {
            throw new CleanupArgsException("expected 0-" + max + " arguments, got " + values.size());
        }
        return this;
    }

    public boolean bool(int index, String name) {
        JsonNode node = values.get(index);
        if (node == null || !node.isBoolean()) {
            throw new CleanupArgsException("unmarshalling cleanup arg '" + name + "'");
        }
        return node.booleanValue();
    }

    public <T> T decode(int index, Class<T> type, String name) {
        try {
            return Jsons.mapper().treeToValue(values.get(index), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CleanupArgsException("unmarshalling cleanup arg '" + name + "'", e);
        }
    }
}
