package xyz.firestige.netdeploy.domain.deployment;

import xyz.firestige.netdeploy.domain.intent.DeviceIntent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 部署计划：设备的全序排列。
 * <p>
 * 层级升序（核心先于汇聚先于边缘），层内按依赖拓扑序。回滚顺序是部署顺序的逆序。
 */
public final class DeploymentPlan {

    private final List<DeviceIntent> ordered;

    public DeploymentPlan(List<DeviceIntent> ordered) {
        this.ordered = List.copyOf(ordered);
    }

    public List<DeviceIntent> devices() {
        return ordered;
    }

    public List<String> deviceNames() {
        return ordered.stream().map(DeviceIntent::getName).toList();
    }

    /**
     * 按层级分组，组内保持计划顺序
     */
    public SortedMap<Integer, List<DeviceIntent>> tiers() {
        Map<Integer, List<DeviceIntent>> groups = new LinkedHashMap<>();
        for (DeviceIntent d : ordered) {
            groups.computeIfAbsent(d.getTier(), t -> new ArrayList<>()).add(d);
        }
        SortedMap<Integer, List<DeviceIntent>> result = new TreeMap<>();
        groups.forEach((tier, list) -> result.put(tier, List.copyOf(list)));
        return Collections.unmodifiableSortedMap(result);
    }

    public DeploymentPlan reverse() {
        List<DeviceIntent> reversed = new ArrayList<>(ordered);
        Collections.reverse(reversed);
        return new DeploymentPlan(reversed);
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    @Override
    public String toString() {
        return "DeploymentPlan" + deviceNames();
    }
}
