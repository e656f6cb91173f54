package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.interfaces.IRuleEvaluator;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.Issue;
import io.mersel.services.dpcheck.application.models.PathPattern;
import io.mersel.services.dpcheck.application.models.RequiredCheck;
import io.mersel.services.dpcheck.application.models.RequiredCheck.Alternative;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Yapılandırmadaki zorunlu alan kurallarını uygular.
 * <p>
 * Alternatiflerin üst desenlerinin seçtiği her somut konum ayrı değerlendirilir. O konuma
 * uyan alternatiflerden en az biri tamamen sağlanıyorsa bulgu yoktur; hiçbiri sağlanmıyorsa
 * tek bir {@code RequiredViolation} üretilir ve en yakın alternatif adlandırılır:
 * en az eksik alan, sonra eksik adların alfabetik sırası, sonra bildirim sırası.
 * Tek alan eksikse bulgu o alanın konumundadır, birden fazla eksikse üst konumdadır.
 * Değeri JSON {@code null} olan alan eksik sayılır.
 */
@Component
@Order(10)
public class RequiredRuleEvaluator implements IRuleEvaluator {

    @Override
    public String name() {
        return CheckKind.REQUIRED;
    }

    @Override
    public List<Issue> evaluate(JsonNode descriptor, CheckConfig config) {
        List<Issue> issues = new ArrayList<>();
        for (RequiredCheck check : config.requiredChecks()) {
            issues.addAll(evaluate(descriptor, check));
        }
        return issues;
    }

    List<Issue> evaluate(JsonNode descriptor, RequiredCheck check) {
        List<Alternative> alternatives = check.alternatives();
        if (alternatives.isEmpty()) {
            return List.of();
        }

        // Tüm alternatiflerin seçtiği somut konumlar, yol sırasıyla
        Map<DescriptorPath, JsonNode> locations = new TreeMap<>();
        for (Alternative alternative : alternatives) {
            for (PathPattern.Match match : alternative.parent().select(descriptor)) {
                locations.putIfAbsent(match.path(), match.node());
            }
        }

        List<Issue> issues = new ArrayList<>();
        for (var location : locations.entrySet()) {
            List<Candidate> failed = new ArrayList<>();
            boolean satisfied = false;
            for (int i = 0; i < alternatives.size() && !satisfied; i++) {
                Alternative alternative = alternatives.get(i);
                if (!alternative.parent().matches(location.getKey())) {
                    continue;
                }
                List<String> missing = missingFields(location.getValue(), alternative.fields());
                if (missing.isEmpty()) {
                    satisfied = true;
                } else {
                    failed.add(new Candidate(i, alternative, missing));
                }
            }
            if (!satisfied && !failed.isEmpty()) {
                issues.add(toIssue(location.getKey(), check, failed));
            }
        }
        return issues;
    }

    private record Candidate(int order, Alternative alternative, List<String> missing) {

        String missingKey() {
            return missing.stream().sorted().reduce((a, b) -> a + "," + b).orElse("");
        }
    }

    private static final Comparator<Candidate> CLOSEST = Comparator
            .comparingInt((Candidate c) -> c.missing().size())
            .thenComparing(Candidate::missingKey)
            .thenComparingInt(Candidate::order);

    private static List<String> missingFields(JsonNode node, List<String> fields) {
        List<String> missing = new ArrayList<>();
        for (String field : fields) {
            if (!node.isObject() || !node.hasNonNull(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    private static Issue toIssue(DescriptorPath location, RequiredCheck check, List<Candidate> failed) {
        Candidate closest = failed.stream().min(CLOSEST).orElseThrow();
        List<String> missing = closest.missing().stream().sorted().toList();
        DescriptorPath path = missing.size() == 1 ? location.child(missing.get(0)) : location;

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("missing", missing);
        context.put("alternatives", failed.stream().map(c -> c.alternative().describe()).toList());
        context.put("expression", check.jsonpath());

        return new Issue(path, check.message() != null ? check.message() : defaultMessage(missing, failed.size()),
                CheckKind.requiredViolation(), context);
    }

    private static String defaultMessage(List<String> missing, int alternativeCount) {
        String quoted = String.join(", ", missing.stream().map(name -> "'" + name + "'").toList());
        if (alternativeCount > 1) {
            return "none of the alternative required property sets is present; the closest is missing " + quoted;
        }
        return missing.size() == 1
                ? quoted + " is a required property"
                : "required properties are missing: " + quoted;
    }
}
