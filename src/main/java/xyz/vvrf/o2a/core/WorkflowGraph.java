package xyz.vvrf.o2a.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 解析完成的工作流图（不可变快照）。
 * 包含按解析顺序排列的节点、依赖声明集合，以及 prepare 展开产生的入口别名。
 * 由解析器构建后只读地交给关系构建和触发规则解析阶段。
 *
 * @author ruifeng.wen
 */
public final class WorkflowGraph {

    private final String dagName;
    private final Map<String, ParsedNode> nodes;
    private final SortedSet<String> dependencies;
    // 动作节点名称 -> 其 prepare 节点名称
    private final Map<String, String> prepareAliases;

    /**
     * @param dagName        DAG 名称 (可为 null)
     * @param nodes          节点映射，迭代顺序即输出顺序 (不能为空，将被复制)
     * @param dependencies   依赖声明 (不能为空，将被复制)
     * @param prepareAliases 动作节点名称 -> prepare 节点名称 (可为 null)
     */
    public WorkflowGraph(String dagName,
                         Map<String, ParsedNode> nodes,
                         SortedSet<String> dependencies,
                         Map<String, String> prepareAliases) {
        Objects.requireNonNull(nodes, "节点映射不能为空");
        Objects.requireNonNull(dependencies, "依赖集合不能为空");
        this.dagName = dagName;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.dependencies = Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
        this.prepareAliases = (prepareAliases == null)
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(prepareAliases));
    }

    public String getDagName() {
        return dagName;
    }

    /**
     * @return 节点名称 -> 节点的不可变映射 (保持解析顺序)
     */
    public Map<String, ParsedNode> getNodes() {
        return nodes;
    }

    public Optional<ParsedNode> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public SortedSet<String> getDependencies() {
        return dependencies;
    }

    public Map<String, String> getPrepareAliases() {
        return prepareAliases;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * 解析从 {@code source} 出发、指向名称 {@code targetName} 的引用。
     * 如果目标是带 prepare 步骤的动作节点，引用实际落在其 prepare 节点上；
     * 只有 prepare 节点自己指向原节点的边直接落在原节点上。
     *
     * @param source     边的起点节点
     * @param targetName 引用的节点名称
     * @return 引用实际落到的节点
     * @throws WorkflowStructureException 如果名称没有对应的节点
     */
    public ParsedNode resolveReference(ParsedNode source, String targetName) {
        String prepareName = prepareAliases.get(targetName);
        String effectiveName = (prepareName != null && !prepareName.equals(source.getName()))
                ? prepareName
                : targetName;
        ParsedNode target = nodes.get(effectiveName);
        if (target == null) {
            throw new WorkflowStructureException(source.getName(), source.getKind().getTag(),
                    String.format("引用了不存在的节点 '%s'", targetName));
        }
        return target;
    }
}
