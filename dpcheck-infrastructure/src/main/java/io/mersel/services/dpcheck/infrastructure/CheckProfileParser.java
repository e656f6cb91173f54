package io.mersel.services.dpcheck.infrastructure;

import io.mersel.services.dpcheck.application.enums.ExclusionScope;
import io.mersel.services.dpcheck.application.enums.FailurePolicy;
import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.application.interfaces.ConfigException;
import io.mersel.services.dpcheck.application.interfaces.CustomCheck;
import io.mersel.services.dpcheck.application.interfaces.ICheckProfileService;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import io.mersel.services.dpcheck.application.models.Exclusion;
import io.mersel.services.dpcheck.application.models.PathPattern;
import io.mersel.services.dpcheck.application.models.RequiredCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML kontrol profili çözümleyici.
 * <p>
 * Örnek:
 * <pre>
 * profiles:
 *   base:
 *     version: v2
 *     exclusions:
 *       - target: "$.resources[*].title"
 *         scope: required-only
 *       - type: pattern
 *     required:
 *       - jsonpath: "$.description"
 *         message: "A description helps users find the package"
 *   release:
 *     extends: base
 *     strict: true
 * </pre>
 * Kalıtımda liste alanları (exclusions, required) üst profilin ardına eklenir; skaler
 * alanlar (version, strict, failure-policy) alt profilde verilmişse üst profili ezer.
 * Dosya okumaz; metin veya stream alır.
 */
@Service
public class CheckProfileParser implements ICheckProfileService {

    private static final Logger log = LoggerFactory.getLogger(CheckProfileParser.class);

    @Override
    public Map<String, CheckConfig> parseProfiles(String yaml, List<CustomCheck> customChecks) {
        return resolveAll(parseRaw(loadYaml(yaml)), customChecks);
    }

    @Override
    public Map<String, CheckConfig> parseProfiles(InputStream yaml, List<CustomCheck> customChecks) {
        return resolveAll(parseRaw(loadYaml(yaml)), customChecks);
    }

    @Override
    public CheckConfig parseProfile(String yaml, String profileName, List<CustomCheck> customChecks) {
        Map<String, RawProfile> rawProfiles = parseRaw(loadYaml(yaml));
        RawProfile raw = rawProfiles.get(profileName);
        if (raw == null) {
            throw new ConfigException("Kontrol profili bulunamadı: " + profileName
                    + " (mevcut: " + rawProfiles.keySet() + ")");
        }
        return toConfig(resolve(profileName, raw, rawProfiles, new HashSet<>()), customChecks);
    }

    // ── YAML okuma ──────────────────────────────────────────────────

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static Object loadYaml(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            return null;
        }
        try {
            return newYaml().load(yaml);
        } catch (YAMLException e) {
            throw new ConfigException("Kontrol profili YAML'ı okunamadı: " + e.getMessage(), e);
        }
    }

    private static Object loadYaml(InputStream yaml) {
        if (yaml == null) {
            return null;
        }
        try {
            return newYaml().load(yaml);
        } catch (YAMLException e) {
            throw new ConfigException("Kontrol profili YAML'ı okunamadı: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, RawProfile> parseRaw(Object root) {
        Map<String, RawProfile> result = new LinkedHashMap<>();
        if (root == null) {
            return result;
        }
        if (!(root instanceof Map<?, ?> rootMap)) {
            throw new ConfigException("Kontrol profili kökü bir eşleme olmalı");
        }
        Object profilesObj = rootMap.get("profiles");
        if (profilesObj == null) {
            return result;
        }
        if (!(profilesObj instanceof Map<?, ?> profiles)) {
            throw new ConfigException("'profiles' bir eşleme olmalı");
        }
        for (var entry : profiles.entrySet()) {
            String name = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                value = Map.of();
            }
            if (!(value instanceof Map<?, ?>)) {
                throw new ConfigException("Profil '" + name + "' bir eşleme olmalı");
            }
            result.put(name, parseRawProfile(name, (Map<String, Object>) value));
        }
        return result;
    }

    private static RawProfile parseRawProfile(String name, Map<String, Object> map) {
        String description = stringValue(map.get("description"));
        String extendsProfile = stringValue(map.get("extends"));
        String version = stringValue(map.get("version"));
        String failurePolicy = stringValue(map.get("failure-policy"));
        Boolean strict = null;
        Object strictObj = map.get("strict");
        if (strictObj instanceof Boolean b) {
            strict = b;
        } else if (strictObj != null) {
            throw new ConfigException("Profil '" + name + "': 'strict' true/false olmalı");
        }

        List<Exclusion> exclusions = new ArrayList<>();
        for (Map<?, ?> item : mapList(name, map.get("exclusions"), "exclusions")) {
            String target = stringValue(item.get("target"));
            String type = stringValue(item.get("type"));
            String scope = stringValue(item.get("scope"));
            if (target == null && type == null) {
                throw new ConfigException("Profil '" + name + "': hariç tutma kuralı 'target' veya 'type' içermeli");
            }
            exclusions.add(new Exclusion(
                    target != null ? PathPattern.compile(target) : null,
                    type,
                    scope != null ? ExclusionScope.fromId(scope) : ExclusionScope.WHOLE));
        }

        List<RequiredCheck> required = new ArrayList<>();
        for (Map<?, ?> item : mapList(name, map.get("required"), "required")) {
            String jsonpath = stringValue(item.get("jsonpath"));
            if (jsonpath == null) {
                throw new ConfigException("Profil '" + name + "': zorunlu alan kuralı 'jsonpath' içermeli");
            }
            required.add(new RequiredCheck(jsonpath, stringValue(item.get("message"))));
        }

        return new RawProfile(name, description, extendsProfile, strict, version, failurePolicy,
                List.copyOf(exclusions), List.copyOf(required));
    }

    private static List<Map<?, ?>> mapList(String profile, Object value, String field) {
        List<Map<?, ?>> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigException("Profil '" + profile + "': '" + field + "' bir liste olmalı");
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> itemMap)) {
                throw new ConfigException("Profil '" + profile + "': '" + field + "' elemanları eşleme olmalı");
            }
            items.add(itemMap);
        }
        return items;
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    // ── Kalıtım çözümleme ───────────────────────────────────────────

    private Map<String, CheckConfig> resolveAll(Map<String, RawProfile> rawProfiles, List<CustomCheck> customChecks) {
        Map<String, CheckConfig> resolved = new LinkedHashMap<>();
        for (var entry : rawProfiles.entrySet()) {
            RawProfile profile = resolve(entry.getKey(), entry.getValue(), rawProfiles, new HashSet<>());
            resolved.put(entry.getKey(), toConfig(profile, customChecks));
            log.debug("  Kontrol profili çözümlendi: {} ({} hariç tutma, {} zorunlu alan kuralı)",
                    entry.getKey(), profile.exclusions().size(), profile.required().size());
        }
        return Map.copyOf(resolved);
    }

    private static RawProfile resolve(String name, RawProfile raw, Map<String, RawProfile> allRaw, Set<String> visited) {
        if (!visited.add(name)) {
            throw new ConfigException("Döngüsel profil kalıtımı tespit edildi: " + name);
        }
        if (raw.extendsProfile() == null) {
            return raw;
        }
        RawProfile parentRaw = allRaw.get(raw.extendsProfile());
        if (parentRaw == null) {
            throw new ConfigException(
                    "Profil '" + name + "' miras aldığı profil bulunamadı: " + raw.extendsProfile());
        }
        RawProfile parent = resolve(raw.extendsProfile(), parentRaw, allRaw, visited);

        List<Exclusion> exclusions = new ArrayList<>(parent.exclusions());
        exclusions.addAll(raw.exclusions());
        List<RequiredCheck> required = new ArrayList<>(parent.required());
        required.addAll(raw.required());

        return new RawProfile(
                name,
                raw.description() != null ? raw.description() : parent.description(),
                null,
                raw.strict() != null ? raw.strict() : parent.strict(),
                raw.version() != null ? raw.version() : parent.version(),
                raw.failurePolicy() != null ? raw.failurePolicy() : parent.failurePolicy(),
                List.copyOf(exclusions),
                List.copyOf(required));
    }

    private static CheckConfig toConfig(RawProfile profile, List<CustomCheck> customChecks) {
        return CheckConfig.builder()
                .excludes(profile.exclusions())
                .requiredChecks(profile.required())
                .customChecks(customChecks != null ? customChecks : List.of())
                .strict(Boolean.TRUE.equals(profile.strict()))
                .version(profile.version() != null ? StandardVersion.fromId(profile.version()) : StandardVersion.V2)
                .failurePolicy(profile.failurePolicy() != null
                        ? FailurePolicy.fromId(profile.failurePolicy()) : FailurePolicy.ISOLATE)
                .build();
    }

    /** YAML'dan okunan, kalıtımı henüz çözülmemiş profil. */
    private record RawProfile(
            String name,
            String description,
            String extendsProfile,
            Boolean strict,
            String version,
            String failurePolicy,
            List<Exclusion> exclusions,
            List<RequiredCheck> required
    ) {}
}
