package xyz.vvrf.o2a.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.core.ParsedNode;
import xyz.vvrf.o2a.core.Relation;
import xyz.vvrf.o2a.core.WorkflowGraph;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 把节点级别的边展开成最小执行单元之间的关系。
 * 每条边从源节点的最后一个单元指向目标节点的第一个单元；目标若带 prepare 步骤，则指向其 prepare 节点。
 * <p>
 * 每次调用都基于图重新计算，结果与调用次数无关。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class RelationBuilder {

    private RelationBuilder() {}

    /**
     * @param graph 工作流图 (不能为空)
     * @return 按 (from, to) 排序的不可变关系集合
     * @throws xyz.vvrf.o2a.core.WorkflowStructureException 如果存在悬空引用
     */
    public static SortedSet<Relation> build(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "工作流图不能为空");
        SortedSet<Relation> relations = new TreeSet<>();
        for (ParsedNode node : graph.getNodes().values()) {
            String from = node.getLastTaskId();
            for (String downstream : node.getDownstreamNames()) {
                relations.add(new Relation(from, graph.resolveReference(node, downstream).getFirstTaskId()));
            }
            node.getErrorName().ifPresent(errorName ->
                    relations.add(new Relation(from, graph.resolveReference(node, errorName).getFirstTaskId())));
        }
        log.debug("DAG '{}': 共生成 {} 条关系", graph.getDagName(), relations.size());
        return Collections.unmodifiableSortedSet(relations);
    }
}
