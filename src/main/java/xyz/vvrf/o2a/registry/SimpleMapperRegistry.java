package xyz.vvrf.o2a.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.core.MapperFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MapperRegistry 的简单内存实现。
 * 转换是单线程的批处理，注册通常在启动时完成，因此这里不做并发控制。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleMapperRegistry implements MapperRegistry {

    private final String name;
    // 保持注册顺序，日志输出更易读
    private final Map<String, MapperFactory> factoryMap = new LinkedHashMap<>();

    /**
     * @param name 注册表名称 (不能为空)
     */
    public SimpleMapperRegistry(String name) {
        this.name = Objects.requireNonNull(name, "注册表名称不能为空");
        log.debug("SimpleMapperRegistry '{}' 已创建", name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void register(String type, MapperFactory factory) {
        Objects.requireNonNull(type, "类型标签不能为空");
        Objects.requireNonNull(factory, "映射器工厂不能为空");

        if (factoryMap.putIfAbsent(type, factory) != null) {
            throw new IllegalArgumentException(String.format("类型标签 '%s' 在注册表 '%s' 中已存在。", type, name));
        }
        log.debug("注册表 '{}': 已注册类型 '{}'", name, type);
    }

    @Override
    public Optional<MapperFactory> getFactory(String type) {
        Objects.requireNonNull(type, "类型标签不能为空");
        return Optional.ofNullable(factoryMap.get(type));
    }

    @Override
    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(factoryMap.keySet()));
    }

    @Override
    public String toString() {
        return String.format("MapperRegistry[%s, types=%s]", name, factoryMap.keySet());
    }
}
