package xyz.vvrf.o2a.core;

import java.util.Objects;

/**
 * 触发规则解析阶段为单个节点计算出的入边分类（不可变）。
 *
 * @author ruifeng.wen
 */
public final class NodeReachability {

    private static final NodeReachability UNREACHED = new NodeReachability(false, false);

    private final boolean reachableOnSuccess;
    private final boolean reachableOnError;

    private NodeReachability(boolean reachableOnSuccess, boolean reachableOnError) {
        this.reachableOnSuccess = reachableOnSuccess;
        this.reachableOnError = reachableOnError;
    }

    public static NodeReachability of(boolean reachableOnSuccess, boolean reachableOnError) {
        if (!reachableOnSuccess && !reachableOnError) {
            return UNREACHED;
        }
        return new NodeReachability(reachableOnSuccess, reachableOnError);
    }

    public static NodeReachability unreached() {
        return UNREACHED;
    }

    public boolean isReachableOnSuccess() {
        return reachableOnSuccess;
    }

    public boolean isReachableOnError() {
        return reachableOnError;
    }

    public TriggerRule toTriggerRule() {
        return TriggerRule.of(reachableOnSuccess, reachableOnError);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeReachability that = (NodeReachability) o;
        return reachableOnSuccess == that.reachableOnSuccess && reachableOnError == that.reachableOnError;
    }

    @Override
    public int hashCode() {
        return Objects.hash(reachableOnSuccess, reachableOnError);
    }

    @Override
    public String toString() {
        return String.format("Reachability[success=%s, error=%s]", reachableOnSuccess, reachableOnError);
    }
}
