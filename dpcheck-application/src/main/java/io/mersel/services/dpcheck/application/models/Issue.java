package io.mersel.services.dpcheck.application.models;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tek bir doğrulama bulgusu.
 * <p>
 * İki bulgu, {@code (path, message)} çifti aynıysa kopyadır; {@code source} ve
 * {@code context} tekilleştirmeye katılmaz. Doğal sıralama önce yola, sonra mesaja göredir,
 * bu yüzden {@code equals} ile tutarlı değildir.
 *
 * @param path    Descriptor içindeki konum
 * @param message Kullanıcıya gösterilecek mesaj
 * @param source  Bulguyu üreten kontrol türü
 * @param context Yardımcı veriler (izin verilen değerler, eksik alanlar vb.)
 */
public record Issue(
        DescriptorPath path,
        String message,
        CheckKind source,
        Map<String, Object> context
) implements Comparable<Issue> {

    private static final Comparator<Issue> ORDER = Comparator
            .comparing(Issue::path)
            .thenComparing(Issue::message);

    public Issue {
        if (path == null || message == null || source == null) {
            throw new IllegalArgumentException("Bulgu için path, message ve source zorunludur");
        }
        context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Issue(DescriptorPath path, String message, CheckKind source) {
        this(path, message, source, Map.of());
    }

    /** Tekilleştirme anahtarı. */
    public record Key(DescriptorPath path, String message) {}

    public Key key() {
        return new Key(path, message);
    }

    /** Anahtar kelime veya özel kontrol adı ({@code required}, {@code enum}, {@code my-check} ...). */
    public String type() {
        return source.name();
    }

    /** Yolun metin gösterimi, örn. {@code $.resources[0].path}. */
    public String location() {
        return path.toString();
    }

    /** Zorunlu alan ihlali mi (yerleşik kural veya standardın {@code required} anahtar kelimesi). */
    public boolean isRequiredViolation() {
        return source.category() == CheckKind.Category.REQUIRED_VIOLATION
                || CheckKind.REQUIRED.equals(source.name());
    }

    @Override
    public int compareTo(Issue other) {
        return ORDER.compare(this, other);
    }
}
