package xyz.vvrf.o2a.annotation;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个 {@link xyz.vvrf.o2a.core.MapperFactory} 实现为可被发现的映射器。
 * 使用此注解的 Bean 如果其 {@link #registry()} 与注册表的种类匹配，
 * 将会被 {@link xyz.vvrf.o2a.registry.SpringScanningMapperRegistry} 自动注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface MapperType {

    /**
     * 类型标签 (例如 {@code hive})，{@link #id()} 的别名。
     */
    @AliasFor("id")
    String value() default "";

    /**
     * 类型标签，{@link #value()} 的别名。
     */
    @AliasFor("value")
    String id() default "";

    /**
     * 注册到哪个注册表，默认是动作节点注册表。
     */
    Registry registry() default Registry.ACTION;

    enum Registry {
        /** 控制节点 (start、end、kill、fork、join、decision) */
        CONTROL,
        /** 动作节点子类型 */
        ACTION
    }
}
