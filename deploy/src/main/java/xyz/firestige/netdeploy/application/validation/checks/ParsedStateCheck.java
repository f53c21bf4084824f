package xyz.firestige.netdeploy.application.validation.checks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.ParseUnavailableException;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.parser.OutputParser;
import xyz.firestige.netdeploy.infrastructure.parser.ProtocolState;

import java.util.Optional;

/**
 * 基于输出解析器的检查模板
 * <p>
 * - 解析器返回 empty 或 ParseUnavailableException：SKIP
 * - 会话错误 / 超时：FAIL（仅该设备）
 * - 拿到状态：交给子类判断
 */
public abstract class ParsedStateCheck implements DeviceCheck {

    private static final Logger log = LoggerFactory.getLogger(ParsedStateCheck.class);

    private final OutputParser parser;
    private final DeviceOperationGuard guard;

    protected ParsedStateCheck(OutputParser parser, DeviceOperationGuard guard) {
        this.parser = parser;
        this.guard = guard;
    }

    @Override
    public ValidationResult run(DeviceIntent device, ValidationPhase phase) {
        if (!appliesTo(device)) {
            return skip(device, phase, notApplicableDetail());
        }
        Optional<ProtocolState> state;
        try {
            state = guard.call(device.getName(), "parse " + getCategory(), () -> parser.parse(device, getCategory()));
        } catch (ParseUnavailableException e) {
            return skip(device, phase, "parser unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Check {} could not query {}: {}", getName(), device.getName(), e.getMessage());
            return fail(device, phase, "query failed: " + e.getMessage());
        }
        if (state.isEmpty()) {
            return skip(device, phase, getCategory().getDescription() + " not configured");
        }
        return evaluate(device, state.get(), phase);
    }

    /**
     * 意图中根本没有声明该特性时直接 SKIP，无需查询设备
     */
    protected boolean appliesTo(DeviceIntent device) {
        return true;
    }

    protected String notApplicableDetail() {
        return getCategory().getDescription() + " not declared in intent";
    }

    protected abstract ValidationResult evaluate(DeviceIntent device, ProtocolState state, ValidationPhase phase);

    protected ValidationResult pass(DeviceIntent device, ValidationPhase phase, String detail) {
        return ValidationResult.pass(getName(), device.getName(), getCategory(), phase, detail);
    }

    protected ValidationResult fail(DeviceIntent device, ValidationPhase phase, String detail) {
        return ValidationResult.fail(getName(), device.getName(), getCategory(), phase, detail);
    }

    protected ValidationResult skip(DeviceIntent device, ValidationPhase phase, String detail) {
        return ValidationResult.skip(getName(), device.getName(), getCategory(), phase, detail);
    }
}
