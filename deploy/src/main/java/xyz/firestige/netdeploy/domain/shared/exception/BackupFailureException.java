package xyz.firestige.netdeploy.domain.shared.exception;

/**
 * 备份写入失败；没有持久化的备份就不允许下发
 */
public class BackupFailureException extends NetDeployException {

    public BackupFailureException(String device, String message) {
        super(ErrorType.BACKUP_FAILURE, message);
        addContext("device", device);
    }

    public BackupFailureException(String device, String message, Throwable cause) {
        super(ErrorType.BACKUP_FAILURE, message, cause);
        addContext("device", device);
    }
}
