package xyz.vvrf.o2a.converter;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.monitor.ConversionListener;
import xyz.vvrf.o2a.registry.MapperRegistry;
import xyz.vvrf.o2a.spring.boot.ConverterProperties;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 创建 {@link OozieConverter} 的工厂，持有在多次转换之间共享的注册表、配置和监听器。
 * 既可以由自动配置创建，也可以在不启动 Spring 的情况下直接构造 (命令行入口)。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class OozieConverterFactory {

    private final ConverterProperties properties;
    private final MapperRegistry controlRegistry;
    private final MapperRegistry actionRegistry;
    private final List<ConversionListener> listeners;
    private final DagFileWriter writer;

    public OozieConverterFactory(ConverterProperties properties,
                                 MapperRegistry controlRegistry,
                                 MapperRegistry actionRegistry,
                                 List<ConversionListener> listeners,
                                 ObjectMapper objectMapper) {
        this.properties = Objects.requireNonNull(properties, "配置属性不能为空");
        this.controlRegistry = Objects.requireNonNull(controlRegistry, "控制节点注册表不能为空");
        this.actionRegistry = Objects.requireNonNull(actionRegistry, "动作节点注册表不能为空");
        this.listeners = listeners == null ? Collections.emptyList() : List.copyOf(listeners);
        this.writer = new DagFileWriter(objectMapper);
        log.info("OozieConverterFactory 已创建: 控制节点类型 {}, 动作类型 {}, 监听器 {} 个",
                controlRegistry.getRegisteredTypes(), actionRegistry.getRegisteredTypes(), this.listeners.size());
    }

    /**
     * @return 已按配置填好调度设置和用户名默认值的请求构建器
     */
    public ConversionRequest.ConversionRequestBuilder requestBuilder() {
        ConverterProperties.Dag dag = properties.getDag();
        return ConversionRequest.builder()
                .startDaysAgo(dag.getStartDaysAgo())
                .scheduleInterval(dag.getScheduleInterval())
                .user(dag.getUser());
    }

    /**
     * @param request 转换参数 (不能为空)
     * @return 新的转换器
     */
    public OozieConverter create(ConversionRequest request) {
        return new OozieConverter(request, controlRegistry, actionRegistry,
                properties.getParser().isStrictDecisionDefault(), listeners, writer);
    }

    public MapperRegistry getControlRegistry() {
        return controlRegistry;
    }

    public MapperRegistry getActionRegistry() {
        return actionRegistry;
    }
}
