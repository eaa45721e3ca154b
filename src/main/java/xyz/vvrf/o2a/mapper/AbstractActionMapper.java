package xyz.vvrf.o2a.mapper;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.WorkflowStructureException;
import xyz.vvrf.o2a.el.ElUtils;
import xyz.vvrf.o2a.util.PythonLiterals;
import xyz.vvrf.o2a.util.XmlUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 动作节点映射器的公共基类。
 * 在构造时一次性读取动作元素中的通用部分 ({@code <configuration>}、{@code <prepare>})，
 * 并对文本做 EL 替换；同时为具备文件/归档能力的子类保存引用列表。
 * <p>
 * 子类按需实现 {@link xyz.vvrf.o2a.core.FileCapable}、{@link xyz.vvrf.o2a.core.ArchiveCapable}、
 * {@link xyz.vvrf.o2a.core.PrepareCapable}；本类只提供数据和默认实现，不声明这些能力。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class AbstractActionMapper extends BaseMapper {

    /** 附加资源在输出目录中的子目录 */
    public static final String ASSETS_DIRECTORY = "assets";

    protected final Element actionNode;
    protected final String type;
    protected final Map<String, String> params;
    protected final Map<String, String> properties;
    protected final List<String> prepareCommands;

    private final List<String> files = new ArrayList<>();
    private final List<String> archives = new ArrayList<>();

    protected AbstractActionMapper(MapperContext context) {
        super(context.getName());
        this.actionNode = Objects.requireNonNull(context.getNode(), "动作元素不能为空");
        this.type = context.getType();
        this.params = context.getParams();
        this.properties = parseConfiguration(actionNode);
        this.prepareCommands = parsePrepare(actionNode);
    }

    /**
     * 读取必需的子元素文本并做 EL 替换。
     *
     * @throws WorkflowStructureException 如果子元素不存在或为空
     */
    protected String requiredText(String tag) {
        String text = XmlUtils.childText(actionNode, tag)
                .filter(value -> !value.isEmpty())
                .orElseThrow(() -> new WorkflowStructureException(name, type,
                        String.format("缺少必需的子元素 <%s>", tag)));
        return el(text);
    }

    /**
     * 读取可选子元素文本并做 EL 替换，不存在时返回 null。
     */
    protected String optionalText(String tag) {
        return XmlUtils.childText(actionNode, tag).map(this::el).orElse(null);
    }

    /**
     * 读取所有同名子元素的文本并做 EL 替换。
     */
    protected List<String> texts(String tag) {
        List<String> values = new ArrayList<>();
        for (String text : XmlUtils.childTexts(actionNode, tag)) {
            values.add(el(text));
        }
        return values;
    }

    protected String el(String text) {
        return ElUtils.replaceElWithVar(text, params);
    }

    private Map<String, String> parseConfiguration(Element node) {
        Map<String, String> result = new LinkedHashMap<>();
        XmlUtils.findChild(node, "configuration").ifPresent(configuration -> {
            for (Element property : XmlUtils.childElements(configuration, "property")) {
                String key = XmlUtils.childText(property, "name").orElse("");
                if (key.isEmpty()) {
                    log.warn("节点 '{}': 忽略没有 <name> 的 configuration 属性", name);
                    continue;
                }
                result.put(el(key), el(XmlUtils.childText(property, "value").orElse("")));
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private List<String> parsePrepare(Element node) {
        List<String> commands = new ArrayList<>();
        XmlUtils.findChild(node, "prepare").ifPresent(prepare -> {
            for (Element operation : XmlUtils.childElements(prepare)) {
                String operationName = XmlUtils.localName(operation);
                String path = XmlUtils.attribute(operation, "path")
                        .map(this::el)
                        .orElseThrow(() -> new WorkflowStructureException(name, type,
                                String.format("prepare 操作 <%s> 缺少 path 属性", operationName)));
                switch (operationName) {
                    case "delete":
                        commands.add("hadoop fs -rm -r -f " + PythonLiterals.shellQuote(path));
                        break;
                    case "mkdir":
                        commands.add("hadoop fs -mkdir -p " + PythonLiterals.shellQuote(path));
                        break;
                    default:
                        throw new WorkflowStructureException(name, type,
                                String.format("不支持的 prepare 操作 <%s>", operationName));
                }
            }
        });
        return Collections.unmodifiableList(commands);
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    // ---- 能力的默认实现，仅在子类声明对应接口时才对外可见 ----

    public boolean hasPrepare() {
        return !prepareCommands.isEmpty();
    }

    public String getPrepareCommand() {
        return String.join(" && ", prepareCommands);
    }

    public void addFile(String filePath) {
        files.add(el(Objects.requireNonNull(filePath, "文件引用不能为空")));
    }

    public List<String> getFiles() {
        return Collections.unmodifiableList(files);
    }

    public void addArchive(String archivePath) {
        archives.add(el(Objects.requireNonNull(archivePath, "归档引用不能为空")));
    }

    public List<String> getArchives() {
        return Collections.unmodifiableList(archives);
    }

    /**
     * 把输入目录下实际存在的相对路径文件/归档复制到 {@code <output>/assets}。
     * 绝对路径和 URI (例如 hdfs://) 指向的是集群上的资源，不做处理。
     */
    @Override
    public void copyExtraAssets(Path inputDirectory, Path outputDirectory) {
        Objects.requireNonNull(inputDirectory, "输入目录不能为空");
        Objects.requireNonNull(outputDirectory, "输出目录不能为空");
        List<String> references = new ArrayList<>(files);
        references.addAll(archives);
        for (String reference : references) {
            String path = stripSymlink(reference);
            if (path.isEmpty() || path.startsWith("/") || path.contains(":") || path.contains("{{")) {
                continue;
            }
            Path source = inputDirectory.resolve(path).normalize();
            if (!source.startsWith(inputDirectory.normalize()) || !Files.isRegularFile(source)) {
                log.debug("节点 '{}': 资源 {} 不在输入目录中，跳过复制", name, reference);
                continue;
            }
            Path target = outputDirectory.resolve(ASSETS_DIRECTORY).resolve(path).normalize();
            try {
                Files.createDirectories(target.getParent());
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                log.debug("节点 '{}': 已复制资源 {} -> {}", name, source, target);
            } catch (IOException e) {
                throw new UncheckedIOException("复制资源失败: " + source, e);
            }
        }
    }

    static String stripSymlink(String reference) {
        int hash = reference.indexOf('#');
        return hash >= 0 ? reference.substring(0, hash) : reference;
    }

    /**
     * 生成 {@code key=value,} 参数行 (4 空格缩进)，value 为已经生成好的 Python 表达式。
     */
    protected static String arg(String key, String pythonExpression) {
        return "    " + key + "=" + pythonExpression + ",\n";
    }

    /**
     * Dataproc 相关算子使用的集群名称表达式。
     */
    protected static String clusterNameExpression() {
        return "PARAMS.get('dataproc_cluster', 'oozie-to-airflow-cluster')";
    }
}
