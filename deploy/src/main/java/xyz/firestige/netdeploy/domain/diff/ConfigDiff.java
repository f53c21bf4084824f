package xyz.firestige.netdeploy.domain.diff;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 两份配置快照之间的行级差异。
 * <p>
 * 纯值对象，只在两份输入被抓取的那一刻有效；需要时重新计算，不跨时间缓存。
 */
public final class ConfigDiff {

    private static final ConfigDiff EMPTY = new ConfigDiff(new TreeSet<>(), new TreeSet<>());

    private final SortedSet<String> linesToAdd;
    private final SortedSet<String> linesToRemove;

    public ConfigDiff(SortedSet<String> linesToAdd, SortedSet<String> linesToRemove) {
        this.linesToAdd = Collections.unmodifiableSortedSet(new TreeSet<>(linesToAdd));
        this.linesToRemove = Collections.unmodifiableSortedSet(new TreeSet<>(linesToRemove));
    }

    public static ConfigDiff empty() {
        return EMPTY;
    }

    public SortedSet<String> getLinesToAdd() {
        return linesToAdd;
    }

    public SortedSet<String> getLinesToRemove() {
        return linesToRemove;
    }

    public boolean isEmpty() {
        return linesToAdd.isEmpty() && linesToRemove.isEmpty();
    }

    /**
     * 报告用的摘要，例如 "+3/-1"
     */
    public String summary() {
        return "+" + linesToAdd.size() + "/-" + linesToRemove.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigDiff that)) return false;
        return linesToAdd.equals(that.linesToAdd) && linesToRemove.equals(that.linesToRemove);
    }

    @Override
    public int hashCode() {
        return 31 * linesToAdd.hashCode() + linesToRemove.hashCode();
    }

    @Override
    public String toString() {
        return "ConfigDiff{add=" + linesToAdd + ", remove=" + linesToRemove + '}';
    }
}
