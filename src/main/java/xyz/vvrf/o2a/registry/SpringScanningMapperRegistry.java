package xyz.vvrf.o2a.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.o2a.annotation.MapperType;
import xyz.vvrf.o2a.core.MapperFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 一个 {@link MapperRegistry} 实现，在内置映射器的基础上自动发现并注册
 * 使用 {@link MapperType} 注解的 Spring Bean。
 * <p>
 * 只注册 {@link MapperType#registry()} 与本注册表种类相同、且实现了 {@link MapperFactory} 的 Bean。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningMapperRegistry implements MapperRegistry, ApplicationContextAware, InitializingBean {

    private final MapperType.Registry kind;
    private final MapperRegistry delegateRegistry;
    private ApplicationContext applicationContext;

    /**
     * @param kind             注册表种类 (不能为空)
     * @param delegateRegistry 存放注册信息的委托注册表，通常已预置内置映射器 (不能为空)
     */
    public SpringScanningMapperRegistry(MapperType.Registry kind, MapperRegistry delegateRegistry) {
        this.kind = Objects.requireNonNull(kind, "注册表种类不能为空");
        this.delegateRegistry = Objects.requireNonNull(delegateRegistry, "委托注册表不能为空");
        log.info("为 '{}' 创建了 SpringScanningMapperRegistry", delegateRegistry.getName());
    }

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningMapperRegistry (" + getName() + ") 中 ApplicationContext 未设置");
        }
        log.info("开始为注册表 '{}' 扫描 @MapperType Bean...", getName());
        scanAndRegisterMappers();
    }

    private void scanAndRegisterMappers() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(MapperType.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object beanInstance = entry.getValue();
            MapperType annotation = applicationContext.findAnnotationOnBean(beanName, MapperType.class);

            if (annotation == null || annotation.registry() != kind) {
                continue;
            }
            if (!(beanInstance instanceof MapperFactory)) {
                log.error("Bean '{}' 使用了 @MapperType 注解，但未实现 MapperFactory 接口。跳过注册。", beanName);
                continue;
            }

            String type = determineType(annotation, beanName);
            try {
                delegateRegistry.register(type, (MapperFactory) beanInstance);
                log.debug("注册表 '{}': 已注册扫描到的映射器 '{}' (Bean: '{}')", getName(), type, beanName);
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 重复的类型标签只记录错误，继续扫描
                log.error("注册映射器 Bean '{}' (类型: '{}') 失败: {}", beanName, type, e.getMessage());
            }
        }
        log.info("注册表 '{}' 的扫描完成。共注册了 {} 个映射器。", getName(), registeredCount);
    }

    private String determineType(MapperType annotation, String beanName) {
        String id = annotation.id();
        if (id.isEmpty()) {
            id = annotation.value();
        }
        if (id.isEmpty()) {
            log.warn("Bean '{}' 的 @MapperType 注解中未提供 'id' 或 'value'。将使用 Bean 名称作为类型标签。", beanName);
            return beanName;
        }
        return id;
    }

    @Override
    public String getName() {
        return delegateRegistry.getName();
    }

    @Override
    public void register(String type, MapperFactory factory) {
        delegateRegistry.register(type, factory);
    }

    @Override
    public Optional<MapperFactory> getFactory(String type) {
        return delegateRegistry.getFactory(type);
    }

    @Override
    public Set<String> getRegisteredTypes() {
        return delegateRegistry.getRegisteredTypes();
    }
}
