package xyz.vvrf.o2a.registry;

import xyz.vvrf.o2a.core.MapperFactory;

import java.util.Optional;
import java.util.Set;

/**
 * 映射器注册表接口。
 * 负责管理类型标签 (控制节点种类或动作子类型，例如 map-reduce) 到映射器工厂的映射。
 * 转换器使用两个互相独立的注册表：控制节点注册表 (固定六项) 和动作节点注册表
 * (可扩展，必须包含 {@link #UNKNOWN_TYPE} 兜底项)。
 *
 * @author ruifeng.wen
 */
public interface MapperRegistry {

    /** 无法识别的动作类型使用的兜底 key */
    String UNKNOWN_TYPE = "unknown";

    /**
     * 获取注册表名称，仅用于日志。
     *
     * @return 注册表名称
     */
    String getName();

    /**
     * 注册一个映射器工厂。
     *
     * @param type    类型标签 (在此注册表内唯一, 不能为空)
     * @param factory 映射器工厂 (不能为空)
     * @throws IllegalArgumentException 如果 type 已被注册
     */
    void register(String type, MapperFactory factory);

    /**
     * 根据类型标签获取映射器工厂。
     *
     * @param type 类型标签 (不能为空)
     * @return 工厂的 Optional，未注册时为空
     */
    Optional<MapperFactory> getFactory(String type);

    /**
     * @param type 类型标签
     * @return 是否已注册
     */
    default boolean contains(String type) {
        return getFactory(type).isPresent();
    }

    /**
     * @return 所有已注册类型标签的不可变集合
     */
    Set<String> getRegisteredTypes();
}
