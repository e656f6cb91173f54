package io.mersel.services.dpcheck.application.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import io.mersel.services.dpcheck.application.models.Issue;

import java.util.List;

/**
 * Yerleşik yapısal kural.
 * <p>
 * Kurallar birbirinden bağımsızdır: descriptor'ı değiştirmez, birbirinin çıktısını görmez.
 * Kontrol motoru kuralları sıralı bir liste üzerinden çağırır.
 */
public interface IRuleEvaluator {

    /** Loglarda ve metriklerde kullanılan kural adı. */
    String name();

    List<Issue> evaluate(JsonNode descriptor, CheckConfig config);
}
