package xyz.vvrf.o2a.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.vvrf.o2a.annotation.MapperType;
import xyz.vvrf.o2a.converter.OozieConverterFactory;
import xyz.vvrf.o2a.monitor.ConversionListener;
import xyz.vvrf.o2a.monitor.LoggingConversionListener;
import xyz.vvrf.o2a.monitor.MicrometerConversionListener;
import xyz.vvrf.o2a.registry.DefaultMapperRegistries;
import xyz.vvrf.o2a.registry.MapperRegistry;
import xyz.vvrf.o2a.registry.SpringScanningMapperRegistry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 转换器的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link ConverterProperties}。
 * 2. 提供控制节点和动作节点两个注册表，在内置映射器之外自动注册 {@link MapperType} 标注的 Bean。
 * 3. 提供日志监听器，以及存在 {@link MeterRegistry} 时的 Micrometer 监听器。
 * 4. 提供 {@link OozieConverterFactory}，收集所有 {@link ConversionListener} Bean。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(ConverterProperties.class)
@Slf4j
public class ConverterAutoConfiguration {

    public static final String CONTROL_REGISTRY_BEAN = "controlMapperRegistry";
    public static final String ACTION_REGISTRY_BEAN = "actionMapperRegistry";

    public ConverterAutoConfiguration() {
        log.info("转换器自动配置 (ConverterAutoConfiguration) 已加载。");
    }

    @Bean(name = CONTROL_REGISTRY_BEAN)
    @ConditionalOnMissingBean(name = CONTROL_REGISTRY_BEAN)
    public SpringScanningMapperRegistry controlMapperRegistry() {
        return new SpringScanningMapperRegistry(MapperType.Registry.CONTROL, DefaultMapperRegistries.controlRegistry());
    }

    @Bean(name = ACTION_REGISTRY_BEAN)
    @ConditionalOnMissingBean(name = ACTION_REGISTRY_BEAN)
    public SpringScanningMapperRegistry actionMapperRegistry() {
        return new SpringScanningMapperRegistry(MapperType.Registry.ACTION, DefaultMapperRegistries.actionRegistry());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "o2a.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingConversionListener loggingConversionListener() {
        return new LoggingConversionListener();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public MicrometerConversionListener micrometerConversionListener(MeterRegistry meterRegistry) {
        log.info("检测到 MeterRegistry，注册 MicrometerConversionListener");
        return new MicrometerConversionListener(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public OozieConverterFactory oozieConverterFactory(@Qualifier(CONTROL_REGISTRY_BEAN) MapperRegistry controlRegistry,
                                                       @Qualifier(ACTION_REGISTRY_BEAN) MapperRegistry actionRegistry,
                                                       ConverterProperties properties,
                                                       ObjectProvider<ConversionListener> listenerProvider,
                                                       ObjectProvider<ObjectMapper> objectMapperProvider) {
        List<ConversionListener> listeners = listenerProvider.orderedStream().collect(Collectors.toList());
        log.info("正在创建 OozieConverterFactory: {}, 监听器 {} 个", properties, listeners.size());
        return new OozieConverterFactory(properties, controlRegistry, actionRegistry, listeners,
                objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }
}
