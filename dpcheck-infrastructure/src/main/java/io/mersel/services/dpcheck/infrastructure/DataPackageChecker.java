package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.interfaces.DescriptorCheckException;
import io.mersel.services.dpcheck.application.interfaces.IDescriptorChecker;
import io.mersel.services.dpcheck.application.interfaces.IRuleEvaluator;
import io.mersel.services.dpcheck.application.interfaces.ISchemaValidator;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.Exclusion;
import io.mersel.services.dpcheck.application.models.ExplainedIssue;
import io.mersel.services.dpcheck.application.models.Issue;
import io.mersel.services.dpcheck.infrastructure.config.DataPackageCheckProperties;
import io.mersel.services.dpcheck.infrastructure.diagnostics.CheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Data Package descriptor kontrol motoru.
 * <p>
 * Sıra:
 * <ol>
 *   <li>Standart şema doğrulaması (katı modda öneri şeması da)</li>
 *   <li>Yerleşik kurallar ve özel kontroller</li>
 *   <li>Gruplama, tekilleştirme, sıralama</li>
 *   <li>Hariç tutma kuralları</li>
 * </ol>
 * Tüm iş çağıran iş parçacığında eşzamanlı yapılır; paylaşılan tek durum, salt okunur
 * derlenmiş şema önbelleğidir.
 */
@Service
public class DataPackageChecker implements IDescriptorChecker {

    private static final Logger log = LoggerFactory.getLogger(DataPackageChecker.class);

    private final ISchemaValidator schemaValidator;
    private final List<IRuleEvaluator> ruleEvaluators;
    private final ExtensionRegistry extensionRegistry;
    private final DataPackageCheckProperties properties;
    private final CheckMetrics metrics;

    /**
     * @param ruleEvaluators Yerleşik kurallar; Spring {@code @Order} sırasıyla enjekte eder
     */
    public DataPackageChecker(ISchemaValidator schemaValidator,
                              List<IRuleEvaluator> ruleEvaluators,
                              ExtensionRegistry extensionRegistry,
                              DataPackageCheckProperties properties,
                              CheckMetrics metrics) {
        this.schemaValidator = schemaValidator;
        this.ruleEvaluators = List.copyOf(ruleEvaluators);
        this.extensionRegistry = extensionRegistry;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public List<Issue> check(JsonNode descriptor) {
        return check(descriptor, properties.toDefaultConfig(), false);
    }

    @Override
    public List<Issue> check(JsonNode descriptor, CheckConfig config) {
        return check(descriptor, config, false);
    }

    @Override
    public List<Issue> check(JsonNode descriptor, CheckConfig config, boolean error) {
        if (descriptor == null) {
            throw new IllegalArgumentException("Descriptor boş olamaz");
        }
        if (config == null) {
            throw new IllegalArgumentException("Kontrol yapılandırması boş olamaz");
        }

        long startTime = System.currentTimeMillis();
        String version = config.version().id();
        List<Issue> issues;
        try {
            issues = runChecks(descriptor, config);
        } catch (RuntimeException e) {
            metrics.recordCheck(version, "error", System.currentTimeMillis() - startTime);
            throw e;
        }

        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordCheck(version, issues.isEmpty() ? "valid" : "invalid", elapsed);
        metrics.recordIssues(issues);
        log.debug("Descriptor kontrolü tamamlandı: {} bulgu, {} ms (sürüm: {}, katı: {})",
                issues.size(), elapsed, version, config.strict());

        if (error && !issues.isEmpty()) {
            throw new DescriptorCheckException(issues, IssueExplainer.summarize(issues));
        }
        return issues;
    }

    @Override
    public ExplainedIssue explain(Issue issue) {
        if (issue == null) {
            throw new IllegalArgumentException("Açıklanacak bulgu boş olamaz");
        }
        return IssueExplainer.explain(issue);
    }

    private List<Issue> runChecks(JsonNode descriptor, CheckConfig config) {
        // Nesne olmayan descriptor için kural çalıştırmanın anlamı yok
        if (!descriptor.isObject()) {
            Issue notObject = new Issue(DescriptorPath.root(), "descriptor must be a JSON object, found "
                    + descriptor.getNodeType().name().toLowerCase(Locale.ROOT), CheckKind.standardViolation("type"));
            return applyExclusions(List.of(notObject), config.excludes());
        }

        List<Issue> collected = new ArrayList<>(
                IssueGrouper.collapse(schemaValidator.validate(descriptor, config.version()), descriptor, false));
        if (config.strict()) {
            collected.addAll(IssueGrouper.collapse(
                    schemaValidator.validateRecommendations(descriptor, config.version()), descriptor, true));
        }

        for (IRuleEvaluator evaluator : ruleEvaluators) {
            List<Issue> produced = evaluator.evaluate(descriptor, config);
            log.debug("  Kural {}: {} bulgu", evaluator.name(), produced.size());
            collected.addAll(produced);
        }
        collected.addAll(extensionRegistry.run(descriptor, config));

        return applyExclusions(IssueGrouper.dedupAndSort(collected), config.excludes());
    }

    private static List<Issue> applyExclusions(List<Issue> issues, List<Exclusion> exclusions) {
        if (exclusions.isEmpty()) {
            return issues;
        }
        return issues.stream()
                .filter(issue -> exclusions.stream().noneMatch(exclusion -> exclusion.excludes(issue)))
                .toList();
    }
}
