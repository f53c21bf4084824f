package xyz.firestige.netdeploy.application.validation.checks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.session.DeviceSession;
import xyz.firestige.netdeploy.infrastructure.session.SessionProvider;

/**
 * 可达性：能否建立会话
 */
public class ReachabilityCheck implements DeviceCheck {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityCheck.class);

    private final SessionProvider sessionProvider;
    private final DeviceOperationGuard guard;

    public ReachabilityCheck(SessionProvider sessionProvider, DeviceOperationGuard guard) {
        this.sessionProvider = sessionProvider;
        this.guard = guard;
    }

    @Override
    public String getName() {
        return "reachability";
    }

    @Override
    public CheckCategory getCategory() {
        return CheckCategory.REACHABILITY;
    }

    @Override
    public ValidationResult run(DeviceIntent device, ValidationPhase phase) {
        DeviceSession session;
        try {
            session = guard.call(device.getName(), "connect", () -> sessionProvider.connect(device));
        } catch (RuntimeException e) {
            return ValidationResult.fail(getName(), device.getName(), getCategory(), phase, "unreachable: " + e.getMessage());
        }
        try {
            guard.run(device.getName(), "disconnect", session::disconnect);
        } catch (RuntimeException e) {
            log.warn("Disconnect after reachability probe of {} failed: {}", device.getName(), e.getMessage());
        }
        return ValidationResult.pass(getName(), device.getName(), getCategory(), phase, "session established");
    }
}
