package io.mersel.services.dpcheck.application.interfaces;

/**
 * {@code FailurePolicy.ABORT} altında bir özel kontrolün çalışma hatası.
 */
public class CheckExecutionException extends RuntimeException {

    private final String checkName;

    public CheckExecutionException(String checkName, Throwable cause) {
        super("Özel kontrol çalıştırılamadı: " + checkName, cause);
        this.checkName = checkName;
    }

    public String getCheckName() {
        return checkName;
    }
}
