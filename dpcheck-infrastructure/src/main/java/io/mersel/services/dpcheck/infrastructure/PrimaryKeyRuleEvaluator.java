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
 * Birincil anahtarın yalnızca tanımlı alanlara başvurduğunu doğrular.
 * <p>
 * Her kaynak için eksik alanların tümünü adlandıran tek bir bulgu üretir
 * ({@code $.resources[i].schema.primaryKey}). Metin olarak verilen şema (yol veya URL)
 * atlanır, çözümlenmez.
 */
@Component
@Order(20)
public class PrimaryKeyRuleEvaluator implements IRuleEvaluator {

    @Override
    public String name() {
        return CheckKind.PRIMARY_KEY;
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
            if (!schema.isObject() || !schema.hasNonNull("primaryKey")) {
                continue;
            }
            Set<String> declared = TableSchemas.declaredFieldNames(schema);
            Set<String> missing = new TreeSet<>();
            for (String key : TableSchemas.fieldList(schema.get("primaryKey"))) {
                if (!declared.contains(key)) {
                    missing.add(key);
                }
            }
            if (!missing.isEmpty()) {
                issues.add(new Issue(
                        DescriptorPath.of("resources", i, "schema", "primaryKey"),
                        "primary key refers to fields not declared in 'schema.fields': " + quote(missing),
                        CheckKind.primaryKeyViolation(),
                        Map.of("missing", List.copyOf(missing))));
            }
        }
        return issues;
    }

    static String quote(Set<String> names) {
        return String.join(", ", names.stream().map(name -> "'" + name + "'").toList());
    }
}
