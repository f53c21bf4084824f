package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 设备拒绝了下发的配置
 */
public class ApplyRejectedException extends NetDeployException {

    public ApplyRejectedException(String message) {
        super(ErrorType.APPLY_REJECTED, message);
    }

    public ApplyRejectedException(String message, Throwable cause) {
        super(ErrorType.APPLY_REJECTED, message, cause);
    }
}
