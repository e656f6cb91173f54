package io.mersel.services.dpcheck.application.interfaces;

import io.mersel.services.dpcheck.application.models.Issue;

import java.util.List;

/**
 * Hata modunda ({@code error = true}) bulgu listesi boş değilse fırlatılan toplu hata.
 * <p>
 * Taşıdığı liste {@code check} çıktısının kendisidir: tekilleştirilmiş ve sıralıdır,
 * burada yeniden sıralanmaz. Mesaj, her bulgunun açıklamasından oluşan okunabilir özettir.
 */
public class DescriptorCheckException extends RuntimeException {

    private final List<Issue> issues;

    public DescriptorCheckException(List<Issue> issues, String summary) {
        super(summary);
        this.issues = List.copyOf(issues);
    }

    public List<Issue> getIssues() {
        return issues;
    }
}
