package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.interfaces.IRuleEvaluator;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.Issue;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Yabancı anahtarların başvurduğu alanların ve kaynakların var olduğunu doğrular.
 * <p>
 * Kontroller:
 * <ul>
 *   <li>{@code fields} yerel şemada tanımlı mı</li>
 *   <li>{@code reference.resource} pakette var mı (boş ad kaynağın kendisidir)</li>
 *   <li>{@code reference.fields} başvurulan kaynağın şemasında tanımlı mı</li>
 *   <li>{@code fields} ile {@code reference.fields} aynı sayıda mı</li>
 * </ul>
 * Her kaynak için tüm eksikleri adlandıran tek bir bulgu üretilir
 * ({@code $.resources[i].schema.foreignKeys}).
 */
@Component
@Order(30)
public class ForeignKeyRuleEvaluator implements IRuleEvaluator {

    @Override
    public String name() {
        return CheckKind.FOREIGN_KEY;
    }

    @Override
    public List<Issue> evaluate(JsonNode descriptor, CheckConfig config) {
        JsonNode resources = descriptor.path("resources");
        if (!resources.isArray()) {
            return List.of();
        }
        List<Issue> issues = new ArrayList<>();
        for (int i = 0; i < resources.size(); i++) {
            JsonNode schema = resources.get(i).path("schema");
            JsonNode foreignKeys = schema.path("foreignKeys");
            if (!schema.isObject() || !foreignKeys.isArray()) {
                continue;
            }
            Set<String> declared = TableSchemas.declaredFieldNames(schema);
            Set<String> missing = new TreeSet<>();
            for (int k = 0; k < foreignKeys.size(); k++) {
                collectMissing(foreignKeys.get(k), k, i, declared, resources, missing);
            }
            if (!missing.isEmpty()) {
                issues.add(new Issue(
                        DescriptorPath.of("resources", i, "schema", "foreignKeys"),
                        "foreign keys refer to missing fields or resources: " + String.join(", ", missing),
                        CheckKind.foreignKeyViolation(),
                        Map.of("missing", List.copyOf(missing))));
            }
        }
        return issues;
    }

    private static void collectMissing(JsonNode foreignKey, int keyIndex, int resourceIndex, Set<String> declared,
                                       JsonNode resources, Set<String> missing) {
        List<String> fields = TableSchemas.fieldList(foreignKey.get("fields"));
        for (String field : fields) {
            if (!declared.contains(field)) {
                missing.add("'" + field + "'");
            }
        }

        JsonNode reference = foreignKey.path("reference");
        if (!reference.isObject()) {
            return;
        }
        List<String> referenced = TableSchemas.fieldList(reference.get("fields"));
        if (!referenced.isEmpty() && referenced.size() != fields.size()) {
            missing.add("field count mismatch in foreignKeys[" + keyIndex + "]");
        }

        String resourceName = reference.path("resource").asText("");
        int target = resourceName.isEmpty() ? resourceIndex : TableSchemas.resourceIndex(resources, resourceName);
        if (target < 0) {
            missing.add("resource '" + resourceName + "'");
            return;
        }
        JsonNode targetSchema = resources.get(target).path("schema");
        if (!targetSchema.isObject()) {
            return;
        }
        Set<String> targetFields = TableSchemas.declaredFieldNames(targetSchema);
        String owner = resourceName.isEmpty() ? resources.get(resourceIndex).path("name").asText("") : resourceName;
        for (String field : referenced) {
            if (!targetFields.contains(field)) {
                missing.add("'" + owner + "'.'" + field + "'");
            }
        }
    }
}
