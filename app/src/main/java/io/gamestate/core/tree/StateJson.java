package io.gamestate.core.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON snapshots of state trees. Objects become {@link StateMap}s, arrays
 * {@link StateList}s; JSON null is rejected.
 */
public final class StateJson {

    private static final ObjectMapper JSON = new ObjectMapper();

    private StateJson() {}

    public static Object fromJson(String json) {
        try {
            return convert(JSON.readTree(json), "root");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid state JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Object read(java.nio.file.Path file) throws IOException {
        return fromJson(Files.readString(file));
    }

    public static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + Values.typeName(value), e);
        }
    }

    private static Object convert(JsonNode node, String path) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new IllegalArgumentException("JSON null is not a valid state value at \"" + path + "\"");
        }
        if (node.isObject()) {
            LinkedHashMap<String, Object> out = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.put(field.getKey(), convert(field.getValue(), Path.join("root".equals(path) ? "" : path, field.getKey())));
            }
            return out.isEmpty() ? StateMap.empty() : new StateMap(out);
        }
        if (node.isArray()) {
            Object[] items = new Object[node.size()];
            for (int i = 0; i < items.length; i++) {
                items[i] = convert(node.get(i), Path.join("root".equals(path) ? "" : path, Integer.toString(i)));
            }
            return items.length == 0 ? StateList.empty() : new StateList(items);
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw new IllegalArgumentException("Unsupported JSON node " + node.getNodeType() + " at \"" + path + "\"");
    }
}
