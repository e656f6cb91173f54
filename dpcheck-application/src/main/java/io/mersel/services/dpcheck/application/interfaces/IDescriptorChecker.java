package io.mersel.services.dpcheck.application.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import io.mersel.services.dpcheck.application.models.ExplainedIssue;
import io.mersel.services.dpcheck.application.models.Issue;

import java.util.List;

/**
 * Data Package descriptor kontrol servisi arayüzü.
 */
public interface IDescriptorChecker {

    /**
     * Descriptor'ı servis varsayılan yapılandırmasıyla kontrol eder.
     */
    List<Issue> check(JsonNode descriptor);

    /**
     * Descriptor'ı verilen yapılandırmayla kontrol eder.
     *
     * @return Tekilleştirilmiş ve sıralı bulgular (boş liste = geçerli)
     */
    List<Issue> check(JsonNode descriptor, CheckConfig config);

    /**
     * Descriptor'ı kontrol eder; {@code error} true ise ve bulgu varsa toplu hata fırlatır.
     *
     * @throws DescriptorCheckException {@code error} true ve en az bir bulgu varsa
     * @throws CheckExecutionException  ABORT politikasında bir özel kontrol hata verirse
     */
    List<Issue> check(JsonNode descriptor, CheckConfig config, boolean error);

    /**
     * Bulguyu yalnızca kendi içeriğine bakarak açıklar; doğrulama yeniden çalıştırılmaz.
     */
    ExplainedIssue explain(Issue issue);
}
