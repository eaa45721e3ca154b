package xyz.vvrf.o2a.registry;

import xyz.vvrf.o2a.mapper.DecisionMapper;
import xyz.vvrf.o2a.mapper.DummyMapper;
import xyz.vvrf.o2a.mapper.FsMapper;
import xyz.vvrf.o2a.mapper.KillMapper;
import xyz.vvrf.o2a.mapper.MapReduceMapper;
import xyz.vvrf.o2a.mapper.PigMapper;
import xyz.vvrf.o2a.mapper.ShellMapper;
import xyz.vvrf.o2a.mapper.SparkMapper;
import xyz.vvrf.o2a.mapper.SshMapper;
import xyz.vvrf.o2a.mapper.SubWorkflowMapper;

/**
 * 内置的两个注册表。每次调用都返回新的实例，调用方可以继续注册自己的映射器。
 *
 * @author ruifeng.wen
 */
public final class DefaultMapperRegistries {

    public static final String CONTROL_REGISTRY_NAME = "control";
    public static final String ACTION_REGISTRY_NAME = "action";

    private DefaultMapperRegistries() {}

    /**
     * @return 控制节点注册表：decision、end、kill、fork、join、start
     */
    public static SimpleMapperRegistry controlRegistry() {
        SimpleMapperRegistry registry = new SimpleMapperRegistry(CONTROL_REGISTRY_NAME);
        registry.register("decision", DecisionMapper::of);
        registry.register("end", DummyMapper::of);
        registry.register("kill", KillMapper::of);
        registry.register("fork", DummyMapper::of);
        registry.register("join", DummyMapper::of);
        registry.register("start", DummyMapper::of);
        return registry;
    }

    /**
     * @return 动作节点注册表，包含 {@link MapperRegistry#UNKNOWN_TYPE} 兜底项
     */
    public static SimpleMapperRegistry actionRegistry() {
        SimpleMapperRegistry registry = new SimpleMapperRegistry(ACTION_REGISTRY_NAME);
        registry.register(MapperRegistry.UNKNOWN_TYPE, DummyMapper::placeholder);
        registry.register("ssh", SshMapper::new);
        registry.register("spark", SparkMapper::new);
        registry.register("pig", PigMapper::new);
        registry.register("sub-workflow", SubWorkflowMapper::new);
        registry.register("shell", ShellMapper::new);
        registry.register("map-reduce", MapReduceMapper::new);
        registry.register("fs", FsMapper::new);
        return registry;
    }
}
