package xyz.vvrf.o2a.core;

import lombok.Builder;
import lombok.Getter;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

/**
 * 创建映射器时传入的上下文（不可变）。
 * 对控制节点，{@code node} 是节点元素本身；对动作节点，是动作类型元素
 * (例如 {@code <map-reduce>})，它是 {@code <action>} 的第一个子元素。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
public class MapperContext {

    /** 源 XML 元素 (不能为空) */
    private final Element node;

    /** 规范化后的节点名称 (不能为空) */
    private final String name;

    /** 源文件中的动作类型标签，控制节点为节点种类标签 */
    private final String type;

    /** 已解析的工作流参数 (job.properties 等)，供 EL 替换使用 */
    @Builder.Default
    private final Map<String, String> params = Collections.emptyMap();

    /** 生成的 DAG 名称 */
    private final String dagName;

    /** 工作流输入目录，可为 null (例如只解析内存中的文档时) */
    private final Path inputDirectory;

    /** 转换输出目录，可为 null */
    private final Path outputDirectory;

    /**
     * 节点名称 -> 第一个执行单元 ID 的解析函数。
     * 在生成代码时才调用 (此时整个图已构建完成)，供需要按任务 ID 跳转的映射器 (decision) 使用。
     */
    @Builder.Default
    private final Function<String, String> taskIdResolver = Function.identity();
}
