package xyz.firestige.netdeploy.infrastructure.gate;

/**
 * 确认门：在 PRE_VALIDATE→PREVIEW 与 PREVIEW→DEPLOY 两处决定流水线是否继续
 */
@FunctionalInterface
public interface ConfirmationGate {

    boolean confirm(String prompt);

    static ConfirmationGate autoApprove() {
        return prompt -> true;
    }

    static ConfirmationGate deny() {
        return prompt -> false;
    }
}
