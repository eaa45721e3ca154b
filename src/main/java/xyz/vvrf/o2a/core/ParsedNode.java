package xyz.vvrf.o2a.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 工作流中的一个控制流节点（不可变数据类）。
 * 与源语言和目标语言都无关；目标语言相关的知识全部在绑定的 {@link ActionMapper} 中。
 * <p>
 * 节点只在解析阶段创建一次，之后不再修改。触发规则解析的结果不写回节点，
 * 而是单独保存在 {@link TriggerRuleAssignment} 中。
 *
 * @author ruifeng.wen
 */
public final class ParsedNode {

    private final String name;
    private final NodeKind kind;
    private final ActionMapper mapper;
    private final List<String> downstreamNames;
    private final String errorName;

    /**
     * @param name            规范化后的节点名称 (不能为空)
     * @param kind            节点种类 (不能为空)
     * @param mapper          绑定的映射器 (不能为空)
     * @param downstreamNames 成功时可转移到的节点名称，按声明顺序 (可为 null，视为空)
     * @param errorName       失败时转移到的节点名称 (仅动作节点，可为 null)
     */
    public ParsedNode(String name, NodeKind kind, ActionMapper mapper, List<String> downstreamNames, String errorName) {
        this.name = Objects.requireNonNull(name, "节点名称不能为空");
        this.kind = Objects.requireNonNull(kind, "节点种类不能为空");
        this.mapper = Objects.requireNonNull(mapper, "节点 " + name + " 的映射器不能为空");
        this.downstreamNames = (downstreamNames == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(downstreamNames));
        this.errorName = errorName;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public ActionMapper getMapper() {
        return mapper;
    }

    public List<String> getDownstreamNames() {
        return downstreamNames;
    }

    public Optional<String> getErrorName() {
        return Optional.ofNullable(errorName);
    }

    public String getFirstTaskId() {
        return mapper.getFirstTaskId();
    }

    public String getLastTaskId() {
        return mapper.getLastTaskId();
    }

    @Override
    public String toString() {
        return String.format("ParsedNode[%s (%s), downstream=%s, error=%s, mapper=%s]",
                name, kind, downstreamNames, errorName, mapper.getClass().getSimpleName());
    }
}
