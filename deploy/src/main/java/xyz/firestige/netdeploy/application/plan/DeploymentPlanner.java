package xyz.firestige.netdeploy.application.plan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.deployment.DeploymentPlan;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.CyclicDependencyException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;

/**
 * 部署计划器
 * <p>
 * 排序规则：
 * 1. 层级升序（核心/转发层先于汇聚层先于边缘/PE 层）
 * 2. 同一层内按 dependsOn 拓扑排序，入度相同时按输入顺序（稳定）
 * <p>
 * 依赖于更低层级的设备天然满足；依赖于更高层级的设备与层级划分矛盾，和同层环一样抛出 CyclicDependencyException。
 * 不在本次计划内的依赖被忽略（部分设备集合是正常模式）。
 */
public class DeploymentPlanner {

    private static final Logger log = LoggerFactory.getLogger(DeploymentPlanner.class);

    public DeploymentPlan plan(Collection<DeviceIntent> devices) {
        Map<String, DeviceIntent> byName = new LinkedHashMap<>();
        Map<String, Integer> inputOrder = new HashMap<>();
        for (DeviceIntent d : devices) {
            if (byName.putIfAbsent(d.getName(), d) == null) {
                inputOrder.put(d.getName(), inputOrder.size());
            }
        }

        TreeMap<Integer, List<DeviceIntent>> tiers = new TreeMap<>();
        for (DeviceIntent d : byName.values()) {
            tiers.computeIfAbsent(d.getTier(), t -> new ArrayList<>()).add(d);
        }

        List<DeviceIntent> ordered = new ArrayList<>(byName.size());
        for (Map.Entry<Integer, List<DeviceIntent>> tier : tiers.entrySet()) {
            ordered.addAll(orderTier(tier.getKey(), tier.getValue(), byName, inputOrder));
        }
        DeploymentPlan plan = new DeploymentPlan(ordered);
        log.info("Deployment plan: {} devices in {} tiers -> {}", plan.size(), tiers.size(), plan.deviceNames());
        return plan;
    }

    private List<DeviceIntent> orderTier(int tier,
                                         List<DeviceIntent> members,
                                         Map<String, DeviceIntent> byName,
                                         Map<String, Integer> inputOrder) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (DeviceIntent d : members) {
            inDegree.put(d.getName(), 0);
        }
        for (DeviceIntent d : members) {
            for (String dep : d.getDependsOn()) {
                DeviceIntent target = byName.get(dep);
                if (target == null) {
                    log.debug("Ignoring dependency {} -> {}: not part of this plan", d.getName(), dep);
                    continue;
                }
                if (target.getTier() > tier) {
                    throw new CyclicDependencyException("Device " + d.getName() + " (tier " + tier + ") depends on "
                            + dep + " in higher tier " + target.getTier(), List.of(d.getName(), dep));
                }
                if (target.getTier() < tier) {
                    continue;
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(d.getName());
                inDegree.merge(d.getName(), 1, Integer::sum);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparing(inputOrder::get));
        inDegree.forEach((name, degree) -> {
            if (degree == 0) ready.add(name);
        });
        List<DeviceIntent> result = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            String next = ready.poll();
            result.add(byName.get(next));
            for (String dependent : dependents.getOrDefault(next, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (result.size() != members.size()) {
            List<String> stuck = members.stream()
                    .map(DeviceIntent::getName)
                    .filter(n -> inDegree.get(n) > 0)
                    .toList();
            throw new CyclicDependencyException("Cyclic dependency in tier " + tier + ": " + stuck, stuck);
        }
        return result;
    }
}
