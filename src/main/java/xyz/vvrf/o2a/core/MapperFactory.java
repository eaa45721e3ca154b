package xyz.vvrf.o2a.core;

/**
 * 映射器工厂。注册表中存放的是工厂而不是实例：每个节点都需要一个新的映射器。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface MapperFactory {

    /**
     * 为一个节点创建映射器。
     *
     * @param context 节点上下文
     * @return 新的映射器实例 (不能为 null)
     * @throws WorkflowStructureException 如果节点内容不满足该映射器的要求
     */
    ActionMapper create(MapperContext context);
}
