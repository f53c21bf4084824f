package xyz.firestige.netdeploy.domain.validation;

/**
 * 一项校验在一台设备上的结果
 */
public record ValidationResult(String checkName,
                               String device,
                               ValidationStatus status,
                               String detail,
                               ValidationPhase phase,
                               CheckCategory category) {

    public static ValidationResult pass(String checkName, String device, CheckCategory category,
                                        ValidationPhase phase, String detail) {
        return new ValidationResult(checkName, device, ValidationStatus.PASS, detail, phase, category);
    }

    public static ValidationResult fail(String checkName, String device, CheckCategory category,
                                        ValidationPhase phase, String detail) {
        return new ValidationResult(checkName, device, ValidationStatus.FAIL, detail, phase, category);
    }

    public static ValidationResult skip(String checkName, String device, CheckCategory category,
                                        ValidationPhase phase, String detail) {
        return new ValidationResult(checkName, device, ValidationStatus.SKIP, detail, phase, category);
    }

    public boolean isFailure() {
        return status == ValidationStatus.FAIL;
    }
}
