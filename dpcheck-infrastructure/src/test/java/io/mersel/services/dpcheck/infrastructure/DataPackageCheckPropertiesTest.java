package io.mersel.services.dpcheck.infrastructure;

import io.mersel.services.dpcheck.application.enums.FailurePolicy;
import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.infrastructure.config.DataPackageCheckProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DataPackageCheckProperties birim testleri.
 * <p>
 * @PostConstruct validate() metodunun geçersiz değerleri varsayılana geri döndürdüğünü test eder.
 */
@DisplayName("DataPackageCheckProperties")
class DataPackageCheckPropertiesTest {

    @Test
    @DisplayName("validate_gecerli_degerler: valid values unchanged")
    void validate_gecerli_degerler() throws Exception {
        var props = new DataPackageCheckProperties();
        props.setDefaultVersion("v1");
        props.setFailurePolicy("abort");
        props.setSchemaCacheSize(16);

        invokeValidate(props);

        assertThat(props.getDefaultVersion()).isEqualTo("v1");
        assertThat(props.getFailurePolicy()).isEqualTo("abort");
        assertThat(props.getSchemaCacheSize()).isEqualTo(16);
    }

    @Test
    @DisplayName("validate_gecersiz_surum: unknown version resets to v2")
    void validate_gecersiz_surum() throws Exception {
        var props = new DataPackageCheckProperties();
        props.setDefaultVersion("v9");

        invokeValidate(props);

        assertThat(props.getDefaultVersion()).isEqualTo("v2");
    }

    @Test
    @DisplayName("validate_gecersiz_politika: unknown policy resets to isolate")
    void validate_gecersiz_politika() throws Exception {
        var props = new DataPackageCheckProperties();
        props.setFailurePolicy("ignore");

        invokeValidate(props);

        assertThat(props.getFailurePolicy()).isEqualTo("isolate");
    }

    @Test
    @DisplayName("validate_kucuk_onbellek: cache below 4 resets to default 8")
    void validate_kucuk_onbellek() throws Exception {
        var props = new DataPackageCheckProperties();
        props.setSchemaCacheSize(2);

        invokeValidate(props);

        assertThat(props.getSchemaCacheSize()).isEqualTo(8);
    }

    @Test
    @DisplayName("toDefaultConfig: properties flow into the default configuration")
    void to_default_config() {
        var props = new DataPackageCheckProperties();
        props.setDefaultVersion("v1");
        props.setStrict(true);
        props.setFailurePolicy("abort");

        var config = props.toDefaultConfig();

        assertThat(config.version()).isEqualTo(StandardVersion.V1);
        assertThat(config.strict()).isTrue();
        assertThat(config.failurePolicy()).isEqualTo(FailurePolicy.ABORT);
        assertThat(config.excludes()).isEmpty();
    }

    private static void invokeValidate(DataPackageCheckProperties props) throws Exception {
        Method validate = DataPackageCheckProperties.class.getDeclaredMethod("validate");
        validate.setAccessible(true);
        validate.invoke(props);
    }
}
