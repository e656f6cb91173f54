package io.mersel.services.dpcheck.application.models;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.interfaces.ConfigException;
import io.mersel.services.dpcheck.application.interfaces.CustomCheck;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Hedef desenin seçtiği her değere bir koşul uygulayan özel kontrol.
 * <p>
 * Koşulu sağlamayan her değer, o değerin konumunda bir {@code CustomViolation} bulgusu üretir.
 * Mesajdaki {@code {value}} yer tutucusu değerin metniyle değiştirilir.
 *
 * @param name      Kontrol adı (bulgu türü olarak da görünür)
 * @param target    Kontrol edilecek değerleri seçen desen
 * @param message   Bulgu mesajı
 * @param predicate Geçerli değerler için {@code true} dönen koşul
 */
public record ValueCheck(
        String name,
        PathPattern target,
        String message,
        Predicate<JsonNode> predicate
) implements CustomCheck {

    public ValueCheck {
        if (target == null || predicate == null) {
            throw new ConfigException("Değer kontrolü için hedef ve koşul zorunludur: " + name);
        }
        if (message == null || message.isBlank()) {
            throw new ConfigException("Değer kontrolü için mesaj zorunludur: " + name);
        }
    }

    public static ValueCheck of(String name, String jsonpath, String message, Predicate<JsonNode> predicate) {
        return new ValueCheck(name, PathPattern.compile(jsonpath), message, predicate);
    }

    @Override
    public List<Issue> apply(JsonNode descriptor) {
        List<Issue> issues = new ArrayList<>();
        for (PathPattern.Match match : target.select(descriptor)) {
            if (!predicate.test(match.node())) {
                String text = match.node().isValueNode() ? match.node().asText() : match.node().toString();
                issues.add(new Issue(
                        match.path(),
                        message.replace("{value}", text),
                        CheckKind.customViolation(name),
                        Map.of("value", text)));
            }
        }
        return issues;
    }
}
