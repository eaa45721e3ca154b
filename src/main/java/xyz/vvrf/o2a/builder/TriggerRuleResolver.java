package xyz.vvrf.o2a.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.core.NodeReachability;
import xyz.vvrf.o2a.core.ParsedNode;
import xyz.vvrf.o2a.core.TriggerRuleAssignment;
import xyz.vvrf.o2a.core.WorkflowGraph;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 触发规则解析：在整个图构建完成后，按入边类型给每个节点分类。
 * 被成功边指向的节点标记为 success 可达，被 error 边指向的节点标记为 error 可达；
 * 结果只取决于图中边的集合，与节点在文档中的顺序无关。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class TriggerRuleResolver {

    private TriggerRuleResolver() {}

    /**
     * @param graph 工作流图 (不能为空)
     * @return 每个节点的入边分类；图本身不会被修改
     */
    public static TriggerRuleAssignment resolve(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "工作流图不能为空");
        Set<String> successTargets = new HashSet<>();
        Set<String> errorTargets = new HashSet<>();
        for (ParsedNode node : graph.getNodes().values()) {
            for (String downstream : node.getDownstreamNames()) {
                successTargets.add(graph.resolveReference(node, downstream).getName());
            }
            node.getErrorName().ifPresent(errorName ->
                    errorTargets.add(graph.resolveReference(node, errorName).getName()));
        }

        Map<String, NodeReachability> result = new LinkedHashMap<>();
        for (String name : graph.getNodes().keySet()) {
            NodeReachability reachability = NodeReachability.of(successTargets.contains(name), errorTargets.contains(name));
            result.put(name, reachability);
            log.debug("DAG '{}': 节点 '{}' {} -> {}", graph.getDagName(), name, reachability, reachability.toTriggerRule());
        }
        return new TriggerRuleAssignment(result);
    }
}
