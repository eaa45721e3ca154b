package xyz.vvrf.o2a.core;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 节点的翻译策略接口。
 * 每个解析出的节点绑定一个 ActionMapper 实例，它掌握目标语言 (Airflow Python) 的全部生成知识；
 * 解析、关系构建和触发规则解析阶段只通过此接口与它交互。
 * <p>
 * 可选能力 ({@link FileCapable}、{@link ArchiveCapable}、{@link PrepareCapable})
 * 通过 {@link #as(Class)} 显式查询，不要直接做类型判断。
 *
 * @author ruifeng.wen
 */
public interface ActionMapper {

    /**
     * 获取节点名称（已规范化），同时也是单单元节点的任务 ID。
     *
     * @return 节点名称
     */
    String getName();

    /**
     * 生成可直接嵌入 DAG 文件的代码片段。
     *
     * @param triggerRule 触发规则解析阶段为该节点确定的激活条件
     * @return 代码片段 (未缩进)
     */
    String convertToText(TriggerRule triggerRule);

    /**
     * 生成代码所需的 import 声明。
     *
     * @return import 语句集合 (不能为 null)
     */
    Set<String> requiredImports();

    /**
     * 获取此节点展开后的全部最小执行单元 ID，按执行顺序排列。
     * 默认只有一个单元，ID 即节点名称。
     *
     * @return 非空的任务 ID 列表
     */
    default List<String> getTaskIds() {
        return List.of(getName());
    }

    /**
     * @return 第一个执行单元的 ID，作为入边的终点
     */
    default String getFirstTaskId() {
        List<String> taskIds = getTaskIds();
        return taskIds.get(0);
    }

    /**
     * @return 最后一个执行单元的 ID，作为出边的起点
     */
    default String getLastTaskId() {
        List<String> taskIds = getTaskIds();
        return taskIds.get(taskIds.size() - 1);
    }

    /**
     * 生成代码中此节点占用的全部 Python 标识符 (任务变量、辅助函数等)。
     * 解析器用它检查不同节点之间的命名冲突。默认就是全部任务 ID。
     *
     * @return 标识符集合，按生成顺序
     */
    default Set<String> getGeneratedIdentifiers() {
        return new LinkedHashSet<>(getTaskIds());
    }

    /**
     * 将节点引用的附加资源从输入目录复制到输出目录。默认无操作。
     *
     * @param inputDirectory  工作流输入目录
     * @param outputDirectory 转换输出目录
     */
    default void copyExtraAssets(Path inputDirectory, Path outputDirectory) {
    }

    /**
     * 以指定能力查看此映射器。
     *
     * @param capability 能力接口
     * @param <T>        能力类型
     * @return 具备该能力时返回自身的视图，否则为空
     */
    default <T> Optional<T> as(Class<T> capability) {
        if (capability.isInstance(this)) {
            return Optional.of(capability.cast(this));
        }
        return Optional.empty();
    }
}
