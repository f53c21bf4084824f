package xyz.firestige.netdeploy.domain.state;

import xyz.firestige.netdeploy.domain.pipeline.PipelineContext;
import xyz.firestige.netdeploy.domain.pipeline.PipelinePhase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 流水线状态机
 * <p>
 * GENERATE → PRE_VALIDATE → PREVIEW → DEPLOY → POST_VALIDATE → REPORT，任一非终态都可以进入 ABORTED。
 * Guard 拒绝时状态保持不变，由调用方决定是否转入 ABORTED。
 */
public class PipelineStateMachine {

    private PipelinePhase current;

    private final Map<PipelinePhase, Set<PipelinePhase>> rules = new EnumMap<>(PipelinePhase.class);
    private final Map<String, List<TransitionGuard<PipelineContext>>> guards = new HashMap<>();
    private final Map<String, List<TransitionAction<PipelineContext>>> actions = new HashMap<>();

    public PipelineStateMachine() {
        this(PipelinePhase.GENERATE);
    }

    public PipelineStateMachine(PipelinePhase initial) {
        this.current = initial;
        initRules();
    }

    private void initRules() {
        rules.put(PipelinePhase.GENERATE, EnumSet.of(PipelinePhase.PRE_VALIDATE, PipelinePhase.ABORTED));
        rules.put(PipelinePhase.PRE_VALIDATE, EnumSet.of(PipelinePhase.PREVIEW, PipelinePhase.ABORTED));
        rules.put(PipelinePhase.PREVIEW, EnumSet.of(PipelinePhase.DEPLOY, PipelinePhase.ABORTED));
        rules.put(PipelinePhase.DEPLOY, EnumSet.of(PipelinePhase.POST_VALIDATE, PipelinePhase.ABORTED));
        rules.put(PipelinePhase.POST_VALIDATE, EnumSet.of(PipelinePhase.REPORT, PipelinePhase.ABORTED));
        rules.put(PipelinePhase.REPORT, EnumSet.noneOf(PipelinePhase.class));
        rules.put(PipelinePhase.ABORTED, EnumSet.noneOf(PipelinePhase.class));
    }

    private String key(PipelinePhase from, PipelinePhase to) {
        return from.name() + "->" + to.name();
    }

    public void registerGuard(PipelinePhase from, PipelinePhase to, TransitionGuard<PipelineContext> guard) {
        guards.computeIfAbsent(key(from, to), k -> new ArrayList<>()).add(guard);
    }

    public void registerAction(PipelinePhase from, PipelinePhase to, TransitionAction<PipelineContext> action) {
        actions.computeIfAbsent(key(from, to), k -> new ArrayList<>()).add(action);
    }

    /**
     * 为所有合法迁移注册同一个动作（例如发布阶段变更事件）
     */
    public void registerActionForAll(TransitionAction<PipelineContext> action) {
        rules.forEach((from, targets) -> targets.forEach(to -> registerAction(from, to, action)));
    }

    public synchronized boolean canTransition(PipelinePhase to, PipelineContext ctx) {
        Set<PipelinePhase> allowed = rules.getOrDefault(current, Collections.emptySet());
        if (!allowed.contains(to)) return false;
        List<TransitionGuard<PipelineContext>> gs = guards.get(key(current, to));
        if (gs != null) {
            for (TransitionGuard<PipelineContext> g : gs) {
                if (!g.canTransition(ctx)) return false;
            }
        }
        return true;
    }

    public synchronized PipelinePhase transitionTo(PipelinePhase to, PipelineContext ctx) {
        if (!canTransition(to, ctx)) {
            return current;
        }
        PipelinePhase old = current;
        current = to;
        ctx.recordPhase(old, to);
        List<TransitionAction<PipelineContext>> as = actions.get(key(old, to));
        if (as != null) {
            for (TransitionAction<PipelineContext> a : as) a.onTransition(ctx);
        }
        return current;
    }

    public PipelinePhase getCurrent() {
        return current;
    }
}
