package io.mersel.services.dpcheck.application.models;

import io.mersel.services.dpcheck.application.enums.FailurePolicy;
import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.application.interfaces.ConfigException;
import io.mersel.services.dpcheck.application.interfaces.CustomCheck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tek bir kontrol çalıştırmasının yapılandırması.
 * <p>
 * Değişmezdir; bir kez kurulur ve birçok kontrolde yeniden kullanılır. Özel kontrol
 * adları kurulum anında doğrulanır, yani geçersiz bir yapılandırma hiçbir kontrol
 * çalışmadan {@link ConfigException} fırlatır.
 *
 * @param excludes       Hariç tutma kuralları
 * @param customChecks   Kullanıcı kontrolleri (adları benzersiz)
 * @param requiredChecks Ek zorunlu alan kuralları
 * @param strict         Önerilen ama isteğe bağlı özellikleri de raporla
 * @param version        Standart sürümü (varsayılan v2)
 * @param failurePolicy  Özel kontrol hatası politikası (varsayılan ISOLATE)
 */
public record CheckConfig(
        List<Exclusion> excludes,
        List<CustomCheck> customChecks,
        List<RequiredCheck> requiredChecks,
        boolean strict,
        StandardVersion version,
        FailurePolicy failurePolicy
) {

    public CheckConfig {
        excludes = immutable(excludes, "excludes");
        customChecks = immutable(customChecks, "customChecks");
        requiredChecks = immutable(requiredChecks, "requiredChecks");
        version = version == null ? StandardVersion.V2 : version;
        failurePolicy = failurePolicy == null ? FailurePolicy.ISOLATE : failurePolicy;
        CustomCheck.validateNames(customChecks);
    }

    private static <T> List<T> immutable(List<T> items, String field) {
        if (items == null) {
            return List.of();
        }
        for (T item : items) {
            if (item == null) {
                throw new ConfigException("Yapılandırma listesi null eleman içeremez: " + field);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static CheckConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .excludes(excludes)
                .customChecks(customChecks)
                .requiredChecks(requiredChecks)
                .strict(strict)
                .version(version)
                .failurePolicy(failurePolicy);
    }

    public static final class Builder {
        private final List<Exclusion> excludes = new ArrayList<>();
        private final List<CustomCheck> customChecks = new ArrayList<>();
        private final List<RequiredCheck> requiredChecks = new ArrayList<>();
        private boolean strict;
        private StandardVersion version = StandardVersion.V2;
        private FailurePolicy failurePolicy = FailurePolicy.ISOLATE;

        private Builder() {}

        public Builder exclude(Exclusion exclusion) {
            excludes.add(exclusion);
            return this;
        }

        public Builder excludes(List<Exclusion> exclusions) {
            excludes.addAll(exclusions);
            return this;
        }

        public Builder customCheck(CustomCheck check) {
            customChecks.add(check);
            return this;
        }

        public Builder customChecks(List<? extends CustomCheck> checks) {
            customChecks.addAll(checks);
            return this;
        }

        public Builder requiredCheck(RequiredCheck check) {
            requiredChecks.add(check);
            return this;
        }

        public Builder requiredChecks(List<RequiredCheck> checks) {
            requiredChecks.addAll(checks);
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder version(StandardVersion version) {
            this.version = version;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        /**
         * @throws ConfigException yapılandırma geçersizse
         */
        public CheckConfig build() {
            return new CheckConfig(excludes, customChecks, requiredChecks, strict, version, failurePolicy);
        }
    }
}
