package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.enums.FailurePolicy;
import io.mersel.services.dpcheck.application.interfaces.CheckExecutionException;
import io.mersel.services.dpcheck.application.interfaces.CustomCheck;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.Issue;
import io.mersel.services.dpcheck.infrastructure.diagnostics.CheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Yapılandırmadaki özel kontrolleri çalıştırır.
 * <p>
 * Ad doğrulaması yapılandırma kurulurken yapılır
 * ({@link CustomCheck#validateNames(List)}); burada her kontrol descriptor'ın tamamıyla
 * sırayla çağrılır. Hata veren kontrol, {@code ISOLATE} politikasında kökte tek bir
 * {@code CheckExecutionFailure} bulgusuna dönüşür ve diğer kontroller çalışmaya devam eder;
 * {@code ABORT} politikasında {@link CheckExecutionException} fırlatılır.
 */
@Component
public class ExtensionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtensionRegistry.class);

    private final CheckMetrics metrics;

    public ExtensionRegistry(CheckMetrics metrics) {
        this.metrics = metrics;
    }

    public List<Issue> run(JsonNode descriptor, CheckConfig config) {
        List<Issue> issues = new ArrayList<>();
        for (CustomCheck check : config.customChecks()) {
            try {
                List<Issue> produced = check.apply(descriptor);
                if (produced != null) {
                    produced.stream().filter(issue -> issue != null).forEach(issues::add);
                }
            } catch (Exception e) {
                // bildirilmemiş checked exception'lar dahil
                if (config.failurePolicy() == FailurePolicy.ABORT) {
                    throw new CheckExecutionException(check.name(), e);
                }
                log.warn("Özel kontrol hata verdi, atlanıyor: {} - {}", check.name(), e.getMessage());
                metrics.recordCustomCheckFailure(check.name());
                issues.add(failureIssue(check.name(), e));
            }
        }
        return issues;
    }

    private static Issue failureIssue(String name, Exception e) {
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new Issue(
                DescriptorPath.root(),
                "custom check '" + name + "' could not run: " + reason,
                CheckKind.checkExecutionFailure(name),
                Map.of("exception", e.getClass().getName()));
    }
}
