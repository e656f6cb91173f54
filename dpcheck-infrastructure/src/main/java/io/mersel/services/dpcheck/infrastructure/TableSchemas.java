package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Table Schema okuma yardımcıları. Anahtar kuralları tarafından paylaşılır.
 */
final class TableSchemas {

    private TableSchemas() {}

    /** Tek ad ({@code "id"}) veya ad dizisi ({@code ["a","b"]}) biçimindeki alan listesini okur. */
    static List<String> fieldList(JsonNode node) {
        List<String> names = new ArrayList<>();
        if (node == null) {
            return names;
        }
        if (node.isTextual()) {
            names.add(node.asText());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    names.add(item.asText());
                }
            }
        }
        return names;
    }

    /** {@code schema.fields[*].name} değerleri. */
    static Set<String> declaredFieldNames(JsonNode schema) {
        Set<String> names = new LinkedHashSet<>();
        JsonNode fields = schema.path("fields");
        if (fields.isArray()) {
            for (JsonNode field : fields) {
                JsonNode name = field.path("name");
                if (name.isTextual()) {
                    names.add(name.asText());
                }
            }
        }
        return names;
    }

    /** Adı verilen kaynağın indisi, yoksa -1. */
    static int resourceIndex(JsonNode resources, String name) {
        for (int i = 0; i < resources.size(); i++) {
            JsonNode resourceName = resources.get(i).path("name");
            if (resourceName.isTextual() && resourceName.asText().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
