package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.Issue;
import io.mersel.services.dpcheck.application.models.SchemaViolation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * IssueGrouper birim testleri.
 * <p>
 * Doğrulayıcı çıktısına benzeyen elle kurulmuş ihlallerle gruplama tablosunun her satırını
 * ve tekilleştirmeyi test eder. Sınıf package-private olduğundan testler aynı pakette.
 */
@DisplayName("IssueGrouper")
class IssueGrouperTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final DescriptorPath RESOURCE_ITEMS = DescriptorPath.of("properties", "resources", "items", "$ref");

    private static DescriptorPath eval(Object... tail) {
        List<Object> segments = new ArrayList<>(RESOURCE_ITEMS.segments());
        segments.addAll(List.of(tail));
        return new DescriptorPath(segments);
    }

    private static SchemaViolation required(DescriptorPath instance, DescriptorPath evaluation, String property) {
        return new SchemaViolation("required", instance, evaluation,
                "required property '" + property + "' not found", property, List.of());
    }

    private static SchemaViolation enumViolation(DescriptorPath instance, DescriptorPath evaluation, String... allowed) {
        return new SchemaViolation("enum", instance, evaluation,
                "does not have a value in the enumeration " + List.of(allowed), null, List.of(allowed));
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("Bileşik dışı ihlaller")
    class Leaves {

        @Test
        @DisplayName("1. required ihlali eksik alanın konumunda raporlanır")
        void required_eksik_alan_konumunda() throws Exception {
            var violation = required(DescriptorPath.root(), DescriptorPath.of("required"), "resources");

            List<Issue> issues = IssueGrouper.collapse(List.of(violation), json("{}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(DescriptorPath.of("resources"));
                assertThat(issue.message()).isEqualTo("'resources' is a required property");
                assertThat(issue.source()).isEqualTo(CheckKind.requiredViolation());
            });
        }

        @Test
        @DisplayName("2. Öneri şemasından gelen ihlal StandardRecommendation olur")
        void oneri_ihlali() throws Exception {
            var violation = required(DescriptorPath.root(), DescriptorPath.of("required"), "id");

            List<Issue> issues = IssueGrouper.collapse(List.of(violation), json("{}"), true);

            assertThat(issues.get(0).source()).isEqualTo(CheckKind.standardRecommendation("required"));
            assertThat(issues.get(0).path()).isEqualTo(DescriptorPath.of("id"));
        }

        @Test
        @DisplayName("3. Diğer anahtar kelimeler mesajıyla aynen raporlanır")
        void diger_anahtar_kelimeler() throws Exception {
            var violation = new SchemaViolation("type", DescriptorPath.of("name"),
                    DescriptorPath.of("properties", "name", "type"), "integer found, string expected", null, null);

            List<Issue> issues = IssueGrouper.collapse(List.of(violation), json("{\"name\": 1}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(DescriptorPath.of("name"));
                assertThat(issue.message()).isEqualTo("integer found, string expected");
                assertThat(issue.source()).isEqualTo(CheckKind.standardViolation("type"));
            });
        }

        @Test
        @DisplayName("4. properties altındaki 'oneOf' adlı özellik işaret sayılmaz")
        void ozellik_adi_isaret_degil() {
            assertThat(IssueGrouper.markerIndex(DescriptorPath.of("properties", "oneOf", "type"), 0)).isEqualTo(-1);
            assertThat(IssueGrouper.markerIndex(eval("oneOf", 0, "required"), 0)).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Gruplama tablosu")
    class Table {

        @Test
        @DisplayName("5. path/data alternatifleri tek RequiredViolation olur")
        void path_data_alternatifleri() throws Exception {
            var resource = DescriptorPath.of("resources", 0);
            var violations = List.of(
                    new SchemaViolation("oneOf", resource, eval("oneOf"),
                            "must be valid to one and only one schema, but 0 are valid", null, null),
                    required(resource, eval("oneOf", 0, "required"), "path"),
                    required(resource, eval("oneOf", 1, "required"), "data"));

            List<Issue> issues = IssueGrouper.collapse(violations,
                    json("{\"resources\": [{\"name\": \"r\"}]}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(resource);
                assertThat(issue.message()).isEqualTo("at least one of 'data' or 'path' is required");
                assertThat(issue.source()).isEqualTo(CheckKind.requiredViolation());
                assertThat(issue.context()).containsEntry("alternatives", List.of("'data'", "'path'"));
            });
        }

        @Test
        @DisplayName("6. Lisans biçimli konum LicenseViolation olur")
        void lisans_ihlali() throws Exception {
            var license = DescriptorPath.of("licenses", 0);
            var licenseItems = DescriptorPath.of("properties", "licenses", "items", "$ref");
            List<Object> branch0 = new ArrayList<>(licenseItems.segments());
            branch0.addAll(List.of("anyOf", 0, "required"));
            List<Object> branch1 = new ArrayList<>(licenseItems.segments());
            branch1.addAll(List.of("anyOf", 1, "required"));
            var violations = List.of(
                    required(license, new DescriptorPath(branch0), "name"),
                    required(license, new DescriptorPath(branch1), "path"));

            List<Issue> issues = IssueGrouper.collapse(violations, json("{\"licenses\": [{}]}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(license);
                assertThat(issue.message()).isEqualTo("license must have at least a 'name' or a 'path'");
                assertThat(issue.source()).isEqualTo(CheckKind.licenseViolation());
            });
        }

        @Test
        @DisplayName("7. Birden fazla dal geçerliyse tek oneOf bulgusu")
        void birden_fazla_dal_gecerli() throws Exception {
            var resource = DescriptorPath.of("resources", 0);
            var violation = new SchemaViolation("oneOf", resource, eval("oneOf"),
                    "must be valid to one and only one schema, but 2 are valid", null, null);

            List<Issue> issues = IssueGrouper.collapse(List.of(violation), json("{}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(resource);
                assertThat(issue.message()).contains("exactly one");
                assertThat(issue.source()).isEqualTo(CheckKind.standardViolation("oneOf"));
            });
        }

        @Test
        @DisplayName("8. Tanınmayan alan tipi tek EnumViolation olur")
        void taninmayan_alan_tipi() throws Exception {
            JsonNode descriptor = json("""
                    {"resources": [{"name": "r", "path": "d.csv",
                      "schema": {"fields": [{"name": "eye-colour", "type": "strin"}]}}]}
                    """);
            var schemaPath = DescriptorPath.of("resources", 0, "schema");
            var typePath = DescriptorPath.of("resources", 0, "schema", "fields", 0, "type");
            List<SchemaViolation> violations = new ArrayList<>();
            // schema: oneOf [string, tableSchema]; metin dalı tipte, nesne dalı alan tipinde düşer
            violations.add(new SchemaViolation("type", schemaPath, eval("properties", "schema", "oneOf", 0, "type"),
                    "object found, string expected", null, null));
            String[][] branches = {{"string"}, {"number"}, {"integer"}, {"boolean"}, {"date"}};
            for (int k = 0; k < branches.length; k++) {
                violations.add(enumViolation(typePath,
                        eval("properties", "schema", "oneOf", 1, "$ref", "properties", "fields", "items", "$ref",
                                "anyOf", k, "properties", "type", "enum"),
                        branches[k]));
            }

            List<Issue> issues = IssueGrouper.collapse(violations, descriptor, false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(typePath);
                assertThat(issue.source()).isEqualTo(CheckKind.enumViolation());
                assertThat(issue.message()).isEqualTo(
                        "'strin' is not one of the allowed values: 'boolean', 'date', 'integer', 'number', 'string'");
                assertThat(issue.context()).containsEntry("allowedValues",
                        List.of("boolean", "date", "integer", "number", "string"));
            });
        }

        @Test
        @DisplayName("9. Biçimi uyan dalın iç hataları raporlanır")
        void bicimi_uyan_dal_ic_hatalari() throws Exception {
            var schemaPath = DescriptorPath.of("resources", 0, "schema");
            var violations = List.of(
                    new SchemaViolation("type", schemaPath, eval("properties", "schema", "oneOf", 0, "type"),
                            "object found, string expected", null, null),
                    required(schemaPath, eval("properties", "schema", "oneOf", 1, "$ref", "required"), "fields"));

            List<Issue> issues = IssueGrouper.collapse(violations,
                    json("{\"resources\": [{\"schema\": {}}]}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(schemaPath.child("fields"));
                assertThat(issue.message()).isEqualTo("'fields' is a required property");
            });
        }

        @Test
        @DisplayName("10. Hiçbir dal biçime uymuyorsa özet mesaj")
        void hicbir_dal_uymuyor() throws Exception {
            var pathPath = DescriptorPath.of("resources", 0, "path");
            var violations = List.of(
                    new SchemaViolation("type", pathPath, eval("properties", "path", "oneOf", 0, "type"),
                            "integer found, string expected", null, null),
                    new SchemaViolation("type", pathPath, eval("properties", "path", "oneOf", 1, "type"),
                            "integer found, array expected", null, null));

            List<Issue> issues = IssueGrouper.collapse(violations,
                    json("{\"resources\": [{\"path\": 5}]}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(pathPath);
                assertThat(issue.message()).startsWith("does not match any of the allowed shapes: ")
                        .contains("array expected").contains("string expected");
                assertThat(issue.source()).isEqualTo(CheckKind.standardViolation("oneOf"));
            });
        }

        @Test
        @DisplayName("11. Farklı kaynaklardaki aynı yapı ayrı gruplanır")
        void farkli_kaynaklar_ayri() throws Exception {
            var first = DescriptorPath.of("resources", 0);
            var second = DescriptorPath.of("resources", 1);
            var violations = List.of(
                    required(first, eval("oneOf", 0, "required"), "path"),
                    required(first, eval("oneOf", 1, "required"), "data"),
                    required(second, eval("oneOf", 0, "required"), "path"),
                    required(second, eval("oneOf", 1, "required"), "data"));

            List<Issue> issues = IssueGrouper.collapse(violations, json("{}"), false);

            assertThat(issues).extracting(Issue::path).containsExactlyInAnyOrder(first, second);
        }
    }

    @Nested
    @DisplayName("Ayırıcı alan")
    class Discriminator {

        private static final DescriptorPath SCHEMA = DescriptorPath.of("resources", 0, "schema");
        private static final DescriptorPath FIELD = SCHEMA.child("fields").index(0);

        private static SchemaViolation pathBranchMismatch() {
            return new SchemaViolation("type", SCHEMA, eval("properties", "schema", "oneOf", 0, "$ref", "type"),
                    "object found, string expected", null, null);
        }

        private static DescriptorPath fieldBranch(int branch, String property) {
            return eval("properties", "schema", "oneOf", 1, "$ref", "properties", "fields", "items", "$ref",
                    "anyOf", branch, "properties", property, "enum");
        }

        @Test
        @DisplayName("13. Tek dalda düşen fieldsMatch dalı elemez, değer konumunda EnumViolation olur")
        void fields_match_dali_elemez() throws Exception {
            JsonNode descriptor = json("""
                    {"resources": [{"name": "r", "path": "d.csv",
                      "schema": {"fields": [{"name": "a"}], "fieldsMatch": "bogus"}}]}
                    """);
            var fieldsMatch = SCHEMA.child("fieldsMatch");
            var violations = List.of(
                    pathBranchMismatch(),
                    enumViolation(fieldsMatch,
                            eval("properties", "schema", "oneOf", 1, "$ref", "properties", "fieldsMatch", "enum"),
                            "exact", "equal", "subset", "superset", "partial"));

            List<Issue> issues = IssueGrouper.collapse(violations, descriptor, false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(fieldsMatch);
                assertThat(issue.source()).isEqualTo(CheckKind.enumViolation());
                assertThat(issue.message()).isEqualTo(
                        "'bogus' is not one of the allowed values: 'equal', 'exact', 'partial', 'subset', 'superset'");
            });
        }

        @Test
        @DisplayName("14. type ayırıcıdır; string dalındaki format hatası EnumViolation olarak raporlanır")
        void format_string_dalinda_raporlanir() throws Exception {
            JsonNode descriptor = json("""
                    {"resources": [{"name": "r", "path": "d.csv",
                      "schema": {"fields": [{"name": "a", "type": "string", "format": "weird"}]}}]}
                    """);
            var typePath = FIELD.child("type");
            var formatPath = FIELD.child("format");
            List<SchemaViolation> violations = new ArrayList<>();
            violations.add(pathBranchMismatch());
            violations.add(enumViolation(formatPath, fieldBranch(0, "format"), "default", "email", "uri", "binary", "uuid"));
            // number/integer/boolean format'ı da kısıtlar; date/time/any kısıtlamaz
            String[] restricted = {"number", "integer", "boolean"};
            String[] free = {"date", "time", "any"};
            int branch = 1;
            for (String type : restricted) {
                violations.add(enumViolation(typePath, fieldBranch(branch, "type"), type));
                violations.add(enumViolation(formatPath, fieldBranch(branch++, "format"), "default"));
            }
            for (String type : free) {
                violations.add(enumViolation(typePath, fieldBranch(branch++, "type"), type));
            }

            List<Issue> issues = IssueGrouper.collapse(violations, descriptor, false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(formatPath);
                assertThat(issue.source()).isEqualTo(CheckKind.enumViolation());
                assertThat(issue.context()).containsEntry("allowedValues",
                        List.of("binary", "default", "email", "uri", "uuid"));
            });
        }

        @Test
        @DisplayName("15. Ayırıcı alan en az iki dalda düşen alanlardan en çok dalda düşenidir")
        void ayirici_alan_secimi() {
            var typePath = FIELD.child("type");
            var formatPath = FIELD.child("format");
            List<List<SchemaViolation>> branches = List.of(
                    List.of(enumViolation(formatPath, fieldBranch(0, "format"), "default", "email")),
                    List.of(enumViolation(typePath, fieldBranch(1, "type"), "number"),
                            enumViolation(formatPath, fieldBranch(1, "format"), "default")),
                    List.of(enumViolation(typePath, fieldBranch(2, "type"), "date")),
                    List.of(enumViolation(typePath, fieldBranch(3, "type"), "any")));
            int marker = IssueGrouper.markerIndex(fieldBranch(0, "format"), 8);

            assertThat(IssueGrouper.discriminator(branches, FIELD, marker)).isEqualTo("type");
            assertThat(IssueGrouper.discriminator(branches.subList(0, 1), FIELD, marker)).isNull();
        }
    }

    @Nested
    @DisplayName("Ortak zorunlu alanlar")
    class CommonRequired {

        @Test
        @DisplayName("16. Her dalda eksik olan ad kendi konumunda, path/data alternatif olarak raporlanır")
        void ortak_alan_ayri_raporlanir() throws Exception {
            var resource = DescriptorPath.of("resources", 0);
            var violations = List.of(
                    required(resource, eval("oneOf", 0, "required"), "name"),
                    required(resource, eval("oneOf", 0, "required"), "data"),
                    required(resource, eval("oneOf", 1, "required"), "name"),
                    required(resource, eval("oneOf", 1, "required"), "path"));

            List<Issue> issues = IssueGrouper.collapse(violations, json("{\"resources\": [{}]}"), false);

            assertThat(issues).extracting(Issue::path, Issue::message).containsExactlyInAnyOrder(
                    tuple(resource.child("name"), "'name' is a required property"),
                    tuple(resource, "at least one of 'data' or 'path' is required"));
        }

        @Test
        @DisplayName("17. path varken eksik ad tek bulgu verir")
        void yalniz_ad_eksik() throws Exception {
            var resource = DescriptorPath.of("resources", 0);
            var violations = List.of(
                    required(resource, eval("oneOf", 0, "required"), "name"),
                    required(resource, eval("oneOf", 0, "required"), "data"),
                    required(resource, eval("oneOf", 1, "required"), "name"));

            List<Issue> issues = IssueGrouper.collapse(violations,
                    json("{\"resources\": [{\"path\": \"d.csv\"}]}"), false);

            assertThat(issues).singleElement().satisfies(issue -> {
                assertThat(issue.path()).isEqualTo(resource.child("name"));
                assertThat(issue.source()).isEqualTo(CheckKind.requiredViolation());
            });
        }
    }

    @Nested
    @DisplayName("Tekilleştirme ve sıralama")
    class Dedup {

        @Test
        @DisplayName("18. Aynı (yol, mesaj) bir kez kalır, sonuç giriş sırasından bağımsız")
        void ayni_anahtar_bir_kez() {
            var path = DescriptorPath.of("name");
            var fromSchema = new Issue(path, "'name' is a required property", CheckKind.requiredViolation());
            var fromRule = new Issue(path, "'name' is a required property", CheckKind.customViolation("has-name"));
            var other = new Issue(DescriptorPath.of("id"), "bad id", CheckKind.standardViolation("pattern"));

            List<Issue> forward = IssueGrouper.dedupAndSort(List.of(fromSchema, fromRule, other));
            List<Issue> reversed = new ArrayList<>(List.of(fromSchema, fromRule, other));
            Collections.reverse(reversed);

            assertThat(forward).containsExactly(other, fromSchema);
            assertThat(IssueGrouper.dedupAndSort(reversed)).isEqualTo(forward);
        }
    }
}
