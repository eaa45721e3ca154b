package xyz.vvrf.o2a.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.core.NodeKind;
import xyz.vvrf.o2a.core.ParsedNode;
import xyz.vvrf.o2a.core.WorkflowGraph;
import xyz.vvrf.o2a.core.WorkflowStructureException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * 工作流图的校验与调试输出工具。
 * 图允许有环，因此这里不做环检测和拓扑排序。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 校验所有 downstream 和 error 引用都能解析到图中的节点，
     * 且 error 目标不是该节点自己的成功目标之一。
     *
     * @param graph 工作流图
     * @throws WorkflowStructureException 如果存在悬空引用或冲突的边
     */
    public static void validateReferences(WorkflowGraph graph) {
        log.debug("DAG '{}': 开始校验节点引用...", graph.getDagName());
        for (ParsedNode node : graph.getNodes().values()) {
            for (String downstream : node.getDownstreamNames()) {
                graph.resolveReference(node, downstream);
            }
            node.getErrorName().ifPresent(errorName -> {
                if (node.getDownstreamNames().contains(errorName)) {
                    throw new WorkflowStructureException(node.getName(), node.getKind().getTag(),
                            String.format("error 目标 '%s' 同时也是成功目标", errorName));
                }
                graph.resolveReference(node, errorName);
            });
        }
        log.debug("DAG '{}': 节点引用校验通过", graph.getDagName());
    }

    /**
     * 从开始节点出发沿所有边遍历，如果到达不了任何终止节点 (end / kill) 就记录警告。
     * 只做诊断，不抛出异常。
     *
     * @param graph 工作流图
     * @return 是否能到达至少一个终止节点；图中没有开始节点时返回 false
     */
    public static boolean checkTerminalReachability(WorkflowGraph graph) {
        Deque<ParsedNode> queue = new ArrayDeque<>();
        graph.getNodes().values().stream()
                .filter(node -> node.getKind() == NodeKind.START)
                .forEach(queue::add);
        if (queue.isEmpty()) {
            log.warn("DAG '{}': 没有开始节点", graph.getDagName());
            return false;
        }
        Set<String> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            ParsedNode node = queue.poll();
            if (!visited.add(node.getName())) {
                continue;
            }
            if (node.getKind() == NodeKind.END || node.getKind() == NodeKind.KILL) {
                return true;
            }
            for (String downstream : node.getDownstreamNames()) {
                queue.add(graph.resolveReference(node, downstream));
            }
            node.getErrorName().ifPresent(errorName -> queue.add(graph.resolveReference(node, errorName)));
        }
        log.warn("DAG '{}': 从开始节点无法到达任何 end 或 kill 节点", graph.getDagName());
        return false;
    }

    /**
     * 生成图的 DOT 描述：成功边为实线，error 边为红色虚线。
     *
     * @param graph 工作流图
     * @return DOT 文本
     */
    public static String toDot(WorkflowGraph graph) {
        StringBuilder dot = new StringBuilder();
        String safeDagName = escapeDotString(graph.getDagName());

        dot.append(String.format("digraph \"%s\" {\n", safeDagName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";\n", safeDagName));
        dot.append("  node [shape=box, style=rounded];\n");

        for (ParsedNode node : graph.getNodes().values()) {
            String name = escapeDotString(node.getName());
            dot.append(String.format("  \"%s\" [label=\"%s\\n(%s)\"];\n", name, name, node.getKind().getTag()));
        }
        for (ParsedNode node : graph.getNodes().values()) {
            String from = escapeDotString(node.getName());
            for (String downstream : node.getDownstreamNames()) {
                String to = escapeDotString(graph.resolveReference(node, downstream).getName());
                dot.append(String.format("  \"%s\" -> \"%s\";\n", from, to));
            }
            node.getErrorName().ifPresent(errorName -> {
                String to = escapeDotString(graph.resolveReference(node, errorName).getName());
                dot.append(String.format("  \"%s\" -> \"%s\" [label=\"error\", style=dashed, color=red];\n", from, to));
            });
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
