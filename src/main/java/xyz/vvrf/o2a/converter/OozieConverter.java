package xyz.vvrf.o2a.converter;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.builder.RelationBuilder;
import xyz.vvrf.o2a.builder.TriggerRuleResolver;
import xyz.vvrf.o2a.core.ParsedNode;
import xyz.vvrf.o2a.core.Relation;
import xyz.vvrf.o2a.core.TriggerRuleAssignment;
import xyz.vvrf.o2a.core.WorkflowGraph;
import xyz.vvrf.o2a.el.ElUtils;
import xyz.vvrf.o2a.monitor.ConversionListener;
import xyz.vvrf.o2a.parser.OozieWorkflowParser;
import xyz.vvrf.o2a.registry.MapperRegistry;
import xyz.vvrf.o2a.util.GraphUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * 一次工作流转换。阶段严格按顺序执行：读取参数 -> 解析 -> 关系 -> 触发规则 -> 生成 -> 写出。
 * 任何阶段失败都会在写出之前中止，输出目录不会被改动。
 * <p>
 * 实例由 {@link OozieConverterFactory} 创建，只能执行一次 {@link #convert()}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class OozieConverter {

    private final ConversionRequest request;
    private final MapperRegistry controlRegistry;
    private final MapperRegistry actionRegistry;
    private final boolean strictDecisionDefault;
    private final List<ConversionListener> listeners;
    private final DagFileWriter writer;

    OozieConverter(ConversionRequest request,
                   MapperRegistry controlRegistry,
                   MapperRegistry actionRegistry,
                   boolean strictDecisionDefault,
                   List<ConversionListener> listeners,
                   DagFileWriter writer) {
        this.request = Objects.requireNonNull(request, "转换请求不能为空");
        Objects.requireNonNull(request.getDagName(), "DAG 名称不能为空");
        Objects.requireNonNull(request.getInputDirectory(), "输入目录不能为空");
        Objects.requireNonNull(request.getOutputDirectory(), "输出目录不能为空");
        this.controlRegistry = Objects.requireNonNull(controlRegistry, "控制节点注册表不能为空");
        this.actionRegistry = Objects.requireNonNull(actionRegistry, "动作节点注册表不能为空");
        this.strictDecisionDefault = strictDecisionDefault;
        this.listeners = List.copyOf(listeners);
        this.writer = Objects.requireNonNull(writer, "DagFileWriter 不能为空");
    }

    /**
     * 执行转换。
     *
     * @return 转换结果
     * @throws xyz.vvrf.o2a.core.WorkflowStructureException 如果工作流结构不合法
     * @throws IllegalArgumentException                    如果输入不是合法的 XML 或目录设置冲突
     * @throws UncheckedIOException                        如果读写文件失败
     */
    public ConversionResult convert() {
        String dagName = request.getDagName();
        long startNanos = System.nanoTime();
        notifyListeners(listener -> listener.onConversionStart(dagName, request.getInputDirectory().toString()));
        try {
            ConversionResult result = doConvert(startNanos);
            notifyListeners(listener -> listener.onConversionSuccess(dagName, result.getDuration(),
                    result.getGraph().size(), result.getRelations().size()));
            return result;
        } catch (RuntimeException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            log.error("DAG '{}' 转换失败: {}", dagName, e.getMessage());
            notifyListeners(listener -> listener.onConversionFailure(dagName, duration, e));
            throw e;
        }
    }

    private ConversionResult doConvert(long startNanos) {
        Path inputDirectory = request.getInputDirectory().toAbsolutePath().normalize();
        Path outputDirectory = request.getOutputDirectory().toAbsolutePath().normalize();
        if (inputDirectory.startsWith(outputDirectory)) {
            throw new IllegalArgumentException(String.format("输出目录 %s 不能包含输入目录 %s", outputDirectory, inputDirectory));
        }

        Map<String, String> params = loadParams(inputDirectory);

        OozieWorkflowParser parser = OozieWorkflowParser.builder()
                .controlRegistry(controlRegistry)
                .actionRegistry(actionRegistry)
                .dagName(request.getDagName())
                .params(params)
                .inputDirectory(inputDirectory)
                .outputDirectory(outputDirectory)
                .strictDecisionDefault(strictDecisionDefault)
                .listeners(listeners)
                .build();
        WorkflowGraph graph = parser.parse(inputDirectory.resolve(ConversionRequest.WORKFLOW_FILE));

        SortedSet<Relation> relations = RelationBuilder.build(graph);
        TriggerRuleAssignment triggerRules = TriggerRuleResolver.resolve(graph);
        if (log.isDebugEnabled()) {
            log.debug("DAG '{}' DOT 图形描述:\n--- DOT BEGIN ---\n{}--- DOT END ---", request.getDagName(), GraphUtils.toDot(graph));
        }

        // 先生成全部文本，生成失败时输出目录保持原样
        String content = writer.render(graph, relations, triggerRules, params, request);

        recreateOutputDirectory(outputDirectory);
        Path outputFile = outputDirectory.resolve(request.getDagName() + ".py");
        writer.write(outputFile, content);
        for (ParsedNode node : graph.getNodes().values()) {
            node.getMapper().copyExtraAssets(inputDirectory, outputDirectory);
        }

        return ConversionResult.builder()
                .dagName(request.getDagName())
                .outputFile(outputFile)
                .graph(graph)
                .relations(relations)
                .triggerRules(triggerRules)
                .duration(Duration.ofNanos(System.nanoTime() - startNanos))
                .build();
    }

    private Map<String, String> loadParams(Path inputDirectory) {
        Map<String, String> params = new LinkedHashMap<>();
        String user = request.getUser() != null ? request.getUser() : System.getProperty("user.name");
        params.put("user.name", user);
        params = ElUtils.loadProperties(inputDirectory.resolve(ConversionRequest.JOB_PROPERTIES_FILE), params);
        params = ElUtils.loadProperties(inputDirectory.resolve(ConversionRequest.CONFIGURATION_PROPERTIES_FILE), params);
        return params;
    }

    private static void recreateOutputDirectory(Path outputDirectory) {
        try {
            if (Files.exists(outputDirectory)) {
                try (Stream<Path> paths = Files.walk(outputDirectory)) {
                    for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                        Files.delete(path);
                    }
                }
            }
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("重建输出目录失败: " + outputDirectory, e);
        }
    }

    private void notifyListeners(Consumer<ConversionListener> action) {
        for (ConversionListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("监听器 {} 执行出错: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
