package xyz.firestige.netdeploy.application.backup;

import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;

public record BackupOutcome(String device, BackupHandle handle, FailureInfo failureInfo) {

    public boolean isFailed() {
        return failureInfo != null;
    }
}
