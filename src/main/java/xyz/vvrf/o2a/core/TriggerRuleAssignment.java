package xyz.vvrf.o2a.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 触发规则解析的结果（不可变）：节点名称 -> 入边分类。
 * 在生成代码时与节点合并，节点本身不会被修改。
 *
 * @author ruifeng.wen
 */
public final class TriggerRuleAssignment {

    private final Map<String, NodeReachability> reachability;

    public TriggerRuleAssignment(Map<String, NodeReachability> reachability) {
        Objects.requireNonNull(reachability, "入边分类映射不能为空");
        this.reachability = Collections.unmodifiableMap(new LinkedHashMap<>(reachability));
    }

    /**
     * @param nodeName 节点名称
     * @return 节点的入边分类；不在结果中的节点视为没有入边
     */
    public NodeReachability getReachability(String nodeName) {
        return reachability.getOrDefault(nodeName, NodeReachability.unreached());
    }

    /**
     * @param nodeName 节点名称
     * @return 节点的激活条件
     */
    public TriggerRule getTriggerRule(String nodeName) {
        return getReachability(nodeName).toTriggerRule();
    }

    public Map<String, NodeReachability> asMap() {
        return reachability;
    }

    @Override
    public String toString() {
        return "TriggerRuleAssignment" + reachability;
    }
}
