package io.mersel.services.dpcheck.application.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.dpcheck.application.interfaces.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PathPattern")
class PathPatternTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("Derleme")
    class Compile {

        @ParameterizedTest
        @ValueSource(strings = {"$.a & $.b", "$.resources[*].name&$.name"})
        @DisplayName("Kesişim operatörü reddedilir")
        void kesisim_reddedilir(String expression) {
            assertThatThrownBy(() -> PathPattern.compile(expression))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("&");
        }

        @ParameterizedTest
        @ValueSource(strings = {"$.", "$[", "$.a[abc]", "$.a |", "| $.a", "$.a..", "$.a....b", "$.a $"})
        @DisplayName("Sözdizimi hataları ConfigException verir")
        void sozdizimi_hatasi(String expression) {
            assertThatThrownBy(() -> PathPattern.compile(expression))
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Çoklu ad seçicisi alternatiflere açılır")
        void coklu_ad_acilir() {
            var pattern = PathPattern.compile("$['licenses','sources'][0]");

            assertThat(pattern.alternatives()).hasSize(2);
            assertThat(pattern.matches(DescriptorPath.of("licenses", 0))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("sources", 0))).isTrue();
        }

        @Test
        @DisplayName("Aynı alternatiflere sahip desenler eşittir")
        void esitlik_alternatiflere_gore() {
            assertThat(PathPattern.compile("$.resources[*]"))
                    .isEqualTo(PathPattern.compile("$.resources.*"));
        }
    }

    @Nested
    @DisplayName("Yapısal eşleşme")
    class Matches {

        @Test
        @DisplayName("Birebir eşleşme, önek eşleşmesi değil")
        void birebir_eslesme() {
            var pattern = PathPattern.compile("$.resources[0]");

            assertThat(pattern.matches(DescriptorPath.of("resources", 0))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("resources", 0, "name"))).isFalse();
            assertThat(pattern.matches(DescriptorPath.of("resources"))).isFalse();
        }

        @Test
        @DisplayName("Joker tek segment karşılar")
        void joker_tek_segment() {
            var pattern = PathPattern.compile("$.resources[*].title");

            assertThat(pattern.matches(DescriptorPath.of("resources", 3, "title"))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("resources", "x", "title"))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("resources", 3, "schema", "title"))).isFalse();
        }

        @Test
        @DisplayName("Özyinelemeli joker sıfır veya daha fazla segment karşılar")
        void ozyinelemeli_joker() {
            var pattern = PathPattern.compile("$..title");

            assertThat(pattern.matches(DescriptorPath.of("title"))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("resources", 0, "schema", "fields", 1, "title"))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("resources", 0))).isFalse();
        }

        @Test
        @DisplayName("Birleşim herhangi bir alternatifle eşleşir")
        void birlesim() {
            var pattern = PathPattern.compile("$.name | $.id");

            assertThat(pattern.matches(DescriptorPath.of("name"))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("id"))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("title"))).isFalse();
        }

        @Test
        @DisplayName("Tırnak içindeki | birleşim değil, adın parçasıdır")
        void tirnak_icinde_birlesim_yok() {
            var pattern = PathPattern.compile("$['a|b']");

            assertThat(pattern.alternatives()).hasSize(1);
            assertThat(pattern.matches(DescriptorPath.of("a|b"))).isTrue();
            assertThat(pattern.matches(DescriptorPath.of("a"))).isFalse();
        }

        @Test
        @DisplayName("$ olmadan yazılan ifade köke göre yorumlanır")
        void goreli_ifade() {
            assertThat(PathPattern.compile("resources[0].path").matches(DescriptorPath.of("resources", 0, "path")))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("Descriptor üzerinde seçim")
    class Select {

        @Test
        @DisplayName("Joker ile tüm kaynaklar yol sırasıyla seçilir")
        void joker_secim() throws Exception {
            JsonNode descriptor = json("""
                    {"resources": [{"name": "a"}, {"name": "b"}, {"title": "c"}]}
                    """);

            var matches = PathPattern.compile("$.resources[*].name").select(descriptor);

            assertThat(matches).extracting(PathPattern.Match::path).containsExactly(
                    DescriptorPath.of("resources", 0, "name"),
                    DescriptorPath.of("resources", 1, "name"));
            assertThat(matches.get(1).node().asText()).isEqualTo("b");
        }

        @Test
        @DisplayName("Özyinelemeli seçim iç içe tüm konumları bulur")
        void ozyinelemeli_secim() throws Exception {
            JsonNode descriptor = json("""
                    {"title": "p", "resources": [{"title": "r", "schema": {"fields": [{"title": "f"}]}}]}
                    """);

            var matches = PathPattern.compile("$..title").select(descriptor);

            assertThat(matches).extracting(m -> m.path().toString()).containsExactly(
                    "$.resources[0].schema.fields[0].title",
                    "$.resources[0].title",
                    "$.title");
        }

        @Test
        @DisplayName("Var olmayan yol boş sonuç verir")
        void olmayan_yol_bos() throws Exception {
            assertThat(PathPattern.compile("$.resources[5].name").select(json("{\"resources\": []}"))).isEmpty();
            assertThat(PathPattern.compile("$.name").select(null)).isEmpty();
        }

        @Test
        @DisplayName("Birleşimde aynı konum bir kez seçilir")
        void birlesim_tekil() throws Exception {
            var matches = PathPattern.compile("$.name | $['name']").select(json("{\"name\": \"x\"}"));

            assertThat(matches).hasSize(1);
        }
    }
}
