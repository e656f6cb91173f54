package io.mersel.services.dpcheck.infrastructure;

import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.ExplainedIssue;
import io.mersel.services.dpcheck.application.models.Issue;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Bulguları uzun biçimli, kullanıcı dostu açıklamalara dönüştürür.
 * <p>
 * Yalnızca bulgunun kendisine (tür, konum, mesaj, bağlam) bakar; descriptor'a veya
 * doğrulayıcıya erişmez. Bu yüzden saf ve idempotenttir; başka bir descriptor'dan gelen
 * bulgu da aynı şekilde açıklanır.
 * <p>
 * Açıklama metinleri bulgu mesajlarıyla aynı dilde (İngilizce) üretilir.
 */
final class IssueExplainer {

    private IssueExplainer() {}

    private static final String STANDARD_URL = "https://datapackage.org/standard/";

    static ExplainedIssue explain(Issue issue) {
        return new ExplainedIssue(
                issue,
                title(issue),
                pointer(issue.path()),
                explanation(issue),
                suggestion(issue));
    }

    /**
     * Toplu hata mesajı: her bulgunun başlığı, konumu ve mesajı.
     */
    static String summarize(List<Issue> issues) {
        StringBuilder sb = new StringBuilder()
                .append("Descriptor check found ")
                .append(issues.size())
                .append(issues.size() == 1 ? " issue" : " issues")
                .append(":\n");
        for (Issue issue : issues) {
            ExplainedIssue explained = explain(issue);
            sb.append("\n")
                    .append(explained.title()).append(" at ").append(issue.location()).append("\n")
                    .append(indent(explained.pointer())).append("\n")
                    .append("    ").append(issue.message()).append("\n");
        }
        return sb.toString();
    }

    // ── Başlık ──────────────────────────────────────────────────────

    private static String title(Issue issue) {
        CheckKind source = issue.source();
        return switch (source.category()) {
            case STANDARD_VIOLATION -> "Standard violation (" + source.name() + ")";
            case STANDARD_RECOMMENDATION -> "Recommendation not followed (" + source.name() + ")";
            case REQUIRED_VIOLATION -> "Required property missing";
            case PRIMARY_KEY_VIOLATION -> "Primary key refers to undeclared fields";
            case FOREIGN_KEY_VIOLATION -> "Foreign key refers to missing fields or resources";
            case ENUM_VIOLATION -> "Value not allowed";
            case LICENSE_VIOLATION -> "Invalid license";
            case CUSTOM_VIOLATION -> "Custom check '" + source.name() + "' failed";
            case CHECK_EXECUTION_FAILURE -> "Custom check '" + source.name() + "' could not run";
        };
    }

    // ── Konum işaretçisi ────────────────────────────────────────────

    /**
     * Yolu ve altında son segmenti işaret eden satırı üretir:
     * <pre>
     * $.resources[0].schema.primaryKey
     *                       ^^^^^^^^^^
     * </pre>
     */
    static String pointer(DescriptorPath path) {
        String full = path.toString();
        if (path.isRoot()) {
            return full + "\n^";
        }
        String parent = path.parent().toString();
        String segment = DescriptorPath.renderSegment(path.last());
        int offset = parent.length();
        int width = segment.length();
        // ".name" için nokta işaretlenmez
        if (segment.startsWith(".")) {
            offset++;
            width--;
        }
        return full + "\n" + " ".repeat(offset) + "^".repeat(Math.max(1, width));
    }

    // ── Açıklama ────────────────────────────────────────────────────

    private static String explanation(Issue issue) {
        StringBuilder sb = new StringBuilder(issue.message()).append("\n");
        switch (issue.source().category()) {
            case REQUIRED_VIOLATION -> sb.append(clause("The property is required at this location", section(issue.path())));
            case STANDARD_VIOLATION -> sb.append(clause("The descriptor does not conform to the Data Package standard",
                    section(issue.path())));
            case STANDARD_RECOMMENDATION -> sb.append(
                    "Strict mode reports properties and formats the standard recommends but does not require.\n");
            case PRIMARY_KEY_VIOLATION -> sb.append(clause(
                    "Every field named in 'primaryKey' must be declared in 'schema.fields'", "table-schema"));
            case FOREIGN_KEY_VIOLATION -> sb.append(clause(
                    "Foreign key fields must exist locally and in the referenced resource", "table-schema"));
            case ENUM_VIOLATION -> sb.append(clause("Only a fixed set of values is accepted here", section(issue.path())));
            case LICENSE_VIOLATION -> sb.append(clause(
                    "A license must be identified by a 'name' (an Open Definition license ID) or a 'path'",
                    "data-package"));
            case CUSTOM_VIOLATION -> sb.append("Reported by the custom check '")
                    .append(issue.type()).append("' configured for this run.\n");
            case CHECK_EXECUTION_FAILURE -> sb.append("The custom check '").append(issue.type())
                    .append("' threw an error and was skipped; other checks ran normally.\n");
        }
        appendList(sb, "Accepted values", issue.context().get("allowedValues"));
        appendList(sb, "Alternatives", issue.context().get("alternatives"));
        appendList(sb, "Missing", issue.context().get("missing"));
        return sb.toString();
    }

    private static String clause(String text, String section) {
        return text + " (see " + STANDARD_URL + section + ").\n";
    }

    /** Konumun ait olduğu standart bölümü. */
    static String section(DescriptorPath path) {
        if (path.segments().contains("schema")) {
            return "table-schema";
        }
        if (path.size() >= 1 && "resources".equals(path.segment(0))) {
            return "data-resource";
        }
        return "data-package";
    }

    private static void appendList(StringBuilder sb, String label, Object value) {
        if (value instanceof List<?> list && !list.isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ");
            list.forEach(item -> joiner.add("'" + item + "'"));
            sb.append(label).append(": ").append(joiner).append("\n");
        }
    }

    // ── Öneri ───────────────────────────────────────────────────────

    private static String suggestion(Issue issue) {
        Map<String, Object> context = issue.context();
        return switch (issue.source().category()) {
            case REQUIRED_VIOLATION -> "Add the missing property at " + issue.location() + ".";
            case ENUM_VIOLATION -> "Replace the value with one of the accepted values.";
            case LICENSE_VIOLATION -> "Give the license a 'name' such as 'CC-BY-4.0' or a 'path' to its text.";
            case PRIMARY_KEY_VIOLATION -> "Declare the missing fields in 'schema.fields' or remove them from 'primaryKey'.";
            case FOREIGN_KEY_VIOLATION -> "Check the field names and the referenced resource name.";
            case CHECK_EXECUTION_FAILURE -> "Fix the custom check" + (context.containsKey("exception")
                    ? " (it threw " + context.get("exception") + ")." : ".");
            case STANDARD_RECOMMENDATION -> "Follow the recommendation, or disable strict mode to skip it.";
            case STANDARD_VIOLATION, CUSTOM_VIOLATION -> "Correct the value at " + issue.location() + ".";
        };
    }

    private static String indent(String text) {
        return "    " + text.replace("\n", "\n    ");
    }
}
