package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.ValidationMessage;
import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.application.interfaces.ISchemaValidator;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.SchemaViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * networknt json-schema-validator tabanlı standart şema doğrulayıcı.
 * <p>
 * Her {@link ValidationMessage} bir {@link SchemaViolation}'a çevrilir: konum ve şema
 * yolları segment listelerine, {@code enum}/{@code const} için izin verilen değerler de
 * şema kaynağındaki ilgili düğümden okunur.
 */
@Service
public class NetworkntSchemaValidator implements ISchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(NetworkntSchemaValidator.class);

    private static final Comparator<SchemaViolation> ORDER = Comparator
            .comparing(SchemaViolation::instancePath)
            .thenComparing(SchemaViolation::evaluationPath)
            .thenComparing(SchemaViolation::message);

    private final StandardSchemaRegistry schemaRegistry;

    public NetworkntSchemaValidator(StandardSchemaRegistry schemaRegistry) {
        this.schemaRegistry = schemaRegistry;
    }

    @Override
    public List<SchemaViolation> validate(JsonNode descriptor, StandardVersion version) {
        return run(descriptor, schemaRegistry.standard(version));
    }

    @Override
    public List<SchemaViolation> validateRecommendations(JsonNode descriptor, StandardVersion version) {
        return run(descriptor, schemaRegistry.recommendations(version));
    }

    private List<SchemaViolation> run(JsonNode descriptor, StandardSchemaRegistry.CompiledStandard compiled) {
        Set<ValidationMessage> messages = compiled.schema().validate(descriptor);
        List<SchemaViolation> violations = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(toViolation(message, compiled.source()));
        }
        // Set sırası kararsız; gruplama öncesi sabitlenir
        violations.sort(ORDER);
        log.debug("Şema doğrulaması: {} {} ihlal ({})",
                compiled.version().id(), violations.size(), compiled.recommendations() ? "öneri" : "standart");
        return violations;
    }

    static SchemaViolation toViolation(ValidationMessage message, JsonNode schemaSource) {
        DescriptorPath instancePath = toPath(message.getInstanceLocation());
        String keyword = message.getType();
        return new SchemaViolation(
                keyword,
                instancePath,
                toPath(message.getEvaluationPath()),
                stripLocation(message.getMessage(), instancePath),
                property(message),
                allowedValues(keyword, message, schemaSource));
    }

    static DescriptorPath toPath(JsonNodePath path) {
        if (path == null) {
            return DescriptorPath.root();
        }
        List<Object> segments = new ArrayList<>(path.getNameCount());
        for (int i = 0; i < path.getNameCount(); i++) {
            Object element = path.getElement(i);
            if (element instanceof Integer index) {
                segments.add(index);
            } else if (element instanceof Number number) {
                segments.add(number.intValue());
            } else if (element != null) {
                segments.add(element.toString());
            }
        }
        return new DescriptorPath(segments);
    }

    private static String stripLocation(String message, DescriptorPath instancePath) {
        if (message == null) {
            return "";
        }
        String prefix = instancePath + ": ";
        return message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }

    private static String property(ValidationMessage message) {
        if (message.getProperty() != null) {
            return message.getProperty();
        }
        Object[] arguments = message.getArguments();
        if ("required".equals(message.getType()) && arguments != null && arguments.length > 0 && arguments[0] != null) {
            return arguments[0].toString();
        }
        return null;
    }

    /**
     * {@code enum}/{@code const} için izin verilen değerler. Önce şema konumundaki düğüm
     * okunur; bulunamazsa doğrulayıcının mesaj argümanına düşülür.
     */
    static List<String> allowedValues(String keyword, ValidationMessage message, JsonNode schemaSource) {
        if (!"enum".equals(keyword) && !"const".equals(keyword)) {
            return List.of();
        }
        JsonNode node = schemaNode(message.getSchemaLocation(), schemaSource);
        if (node != null && node.isObject() && node.has(keyword)) {
            node = node.get(keyword);
        }
        List<String> values = new ArrayList<>();
        if (node != null && !node.isMissingNode()) {
            if ("enum".equals(keyword) && node.isArray()) {
                node.forEach(value -> values.add(text(value)));
                return values;
            }
            if ("const".equals(keyword) && !node.isObject() && !node.isArray()) {
                return List.of(text(node));
            }
        }
        Object[] arguments = message.getArguments();
        if (arguments != null && arguments.length > 0 && arguments[0] != null) {
            String raw = arguments[0].toString().trim();
            if (raw.startsWith("[") && raw.endsWith("]")) {
                raw = raw.substring(1, raw.length() - 1);
            }
            for (String part : raw.split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
        }
        return values;
    }

    private static JsonNode schemaNode(SchemaLocation location, JsonNode schemaSource) {
        if (location == null || location.getFragment() == null || schemaSource == null) {
            return null;
        }
        JsonNodePath fragment = location.getFragment();
        JsonNode node = schemaSource;
        for (int i = 0; i < fragment.getNameCount(); i++) {
            Object element = fragment.getElement(i);
            if (element instanceof Number index) {
                node = node.path(index.intValue());
            } else if (element != null) {
                String name = element.toString();
                node = node.isArray() && name.chars().allMatch(Character::isDigit) && !name.isEmpty()
                        ? node.path(Integer.parseInt(name))
                        : node.path(name);
            }
        }
        return node;
    }

    private static String text(JsonNode value) {
        return value.isTextual() ? value.asText() : value.toString();
    }
}
