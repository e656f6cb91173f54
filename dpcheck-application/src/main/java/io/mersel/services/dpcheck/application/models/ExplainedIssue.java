package io.mersel.services.dpcheck.application.models;

/**
 * Bir bulgunun uzun biçimli açıklaması.
 *
 * @param issue       Açıklanan bulgu
 * @param title       Kısa başlık
 * @param pointer     Yolu ve altında sorunlu segmenti gösteren iki satır
 * @param explanation Standart maddesi, kabul edilen değerler vb.
 * @param suggestion  Çözüm önerisi
 */
public record ExplainedIssue(
        Issue issue,
        String title,
        String pointer,
        String explanation,
        String suggestion
) {

    /** Tüm parçaları okunabilir tek bir metinde birleştirir. */
    public String render() {
        return title + "\n\n"
                + pointer + "\n\n"
                + explanation + "\n"
                + suggestion;
    }
}
