package xyz.vvrf.o2a.parser;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import xyz.vvrf.o2a.core.ActionMapper;
import xyz.vvrf.o2a.core.ArchiveCapable;
import xyz.vvrf.o2a.core.FileCapable;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.MapperFactory;
import xyz.vvrf.o2a.core.NodeKind;
import xyz.vvrf.o2a.core.ParsedNode;
import xyz.vvrf.o2a.core.PrepareCapable;
import xyz.vvrf.o2a.core.WorkflowGraph;
import xyz.vvrf.o2a.core.WorkflowStructureException;
import xyz.vvrf.o2a.mapper.PrepareMapper;
import xyz.vvrf.o2a.monitor.ConversionListener;
import xyz.vvrf.o2a.registry.MapperRegistry;
import xyz.vvrf.o2a.util.GraphUtils;
import xyz.vvrf.o2a.util.NameNormalizer;
import xyz.vvrf.o2a.util.XmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 工作流控制流解析器。
 * 读取 workflow.xml，为每个根级节点创建一个 {@link ParsedNode}，按标签分派到对应的构建逻辑，
 * 填充成功边 (downstream) 和失败边 (error)，并收集生成代码所需的 import。
 * <p>
 * 解析结果是不可变的 {@link WorkflowGraph}。解析器本身不保存跨调用的状态，
 * 同一个实例可以重复调用 {@code parse}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class OozieWorkflowParser {

    /** 每个 DAG 文件都需要的 import */
    public static final List<String> BASE_IMPORTS = List.of(
            "import datetime",
            "from airflow import models",
            "from airflow.utils.trigger_rule import TriggerRule");

    public static final String START_NODE_PREFIX = "start_node_";

    private final MapperRegistry controlRegistry;
    private final MapperRegistry actionRegistry;
    private final String dagName;
    private final Map<String, String> params;
    private final Path inputDirectory;
    private final Path outputDirectory;
    private final boolean strictDecisionDefault;
    private final List<ConversionListener> listeners;

    /**
     * @param controlRegistry       控制节点注册表 (不能为空)
     * @param actionRegistry        动作节点注册表 (不能为空，必须包含 unknown 兜底项)
     * @param dagName               DAG 名称
     * @param params                工作流参数 (可为 null)
     * @param inputDirectory        输入目录 (可为 null)
     * @param outputDirectory       输出目录 (可为 null)
     * @param strictDecisionDefault 是否要求 decision 恰好有一个 default 分支 (null 视为 true)
     * @param listeners             监听器 (可为 null)
     */
    @Builder
    public OozieWorkflowParser(MapperRegistry controlRegistry,
                               MapperRegistry actionRegistry,
                               String dagName,
                               Map<String, String> params,
                               Path inputDirectory,
                               Path outputDirectory,
                               Boolean strictDecisionDefault,
                               List<ConversionListener> listeners) {
        this.controlRegistry = Objects.requireNonNull(controlRegistry, "控制节点注册表不能为空");
        this.actionRegistry = Objects.requireNonNull(actionRegistry, "动作节点注册表不能为空");
        if (!actionRegistry.contains(MapperRegistry.UNKNOWN_TYPE)) {
            throw new IllegalArgumentException(String.format("动作节点注册表 '%s' 缺少 '%s' 兜底项。",
                    actionRegistry.getName(), MapperRegistry.UNKNOWN_TYPE));
        }
        this.dagName = dagName;
        this.params = params == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.inputDirectory = inputDirectory;
        this.outputDirectory = outputDirectory;
        this.strictDecisionDefault = strictDecisionDefault == null || strictDecisionDefault;
        this.listeners = listeners == null ? Collections.emptyList() : List.copyOf(listeners);
    }

    /**
     * 解析工作流文件。
     *
     * @param workflowXml workflow.xml 路径
     * @return 工作流图
     * @throws UncheckedIOException       如果文件无法读取
     * @throws IllegalArgumentException   如果文件不是格式正确的 XML
     * @throws WorkflowStructureException 如果工作流结构不合法
     */
    public WorkflowGraph parse(Path workflowXml) {
        Objects.requireNonNull(workflowXml, "工作流文件路径不能为空");
        log.info("DAG '{}': 开始解析 {}", dagName, workflowXml);
        try (InputStream inputStream = Files.newInputStream(workflowXml)) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException("读取工作流文件失败: " + workflowXml, e);
        }
    }

    public WorkflowGraph parse(InputStream inputStream) {
        Objects.requireNonNull(inputStream, "输入流不能为空");
        return parse(XmlUtils.parse(inputStream));
    }

    public WorkflowGraph parse(Document document) {
        Objects.requireNonNull(document, "工作流文档不能为空");
        Element root = document.getDocumentElement();
        ParseState state = new ParseState(root);

        for (Element child : XmlUtils.childElements(root)) {
            String tag = XmlUtils.localName(child);
            Optional<NodeKind> kind = NodeKind.fromTag(tag);
            if (kind.isEmpty()) {
                log.debug("DAG '{}': 跳过根级元素 <{}>", dagName, tag);
                continue;
            }
            if (state.isVisited(child)) {
                continue;
            }
            parseNode(child, kind.get(), state);
        }

        WorkflowGraph graph = new WorkflowGraph(dagName, state.nodes, state.dependencies, state.prepareAliases);
        state.graphHolder.set(graph);
        GraphUtils.validateReferences(graph);
        GraphUtils.checkTerminalReachability(graph);
        log.info("DAG '{}': 解析完成，共 {} 个节点, {} 个 import", dagName, graph.size(), graph.getDependencies().size());
        return graph;
    }

    private void parseNode(Element element, NodeKind kind, ParseState state) {
        state.markVisited(element);
        switch (kind) {
            case START:
                parseStart(element, state);
                break;
            case END:
            case KILL:
                parseTerminal(element, kind, state);
                break;
            case JOIN:
                parseJoin(element, state);
                break;
            case FORK:
                parseFork(element, state);
                break;
            case DECISION:
                parseDecision(element, state);
                break;
            case ACTION:
                parseAction(element, state);
                break;
            default:
                throw new IllegalStateException("无法解析的节点种类: " + kind);
        }
    }

    private void parseStart(Element element, ParseState state) {
        String name = START_NODE_PREFIX + String.format("%04x", ThreadLocalRandom.current().nextInt(0x10000));
        String to = requiredReference(element, "to", name, NodeKind.START.getTag());
        ActionMapper mapper = createControlMapper(element, name, NodeKind.START, state);
        state.addNode(new ParsedNode(name, NodeKind.START, mapper, List.of(to), null), NodeKind.START.getTag());
    }

    private void parseTerminal(Element element, NodeKind kind, ParseState state) {
        String name = requiredName(element, kind.getTag());
        ActionMapper mapper = createControlMapper(element, name, kind, state);
        state.addNode(new ParsedNode(name, kind, mapper, Collections.emptyList(), null), kind.getTag());
    }

    private void parseJoin(Element element, ParseState state) {
        String name = requiredName(element, NodeKind.JOIN.getTag());
        String to = requiredReference(element, "to", name, NodeKind.JOIN.getTag());
        ActionMapper mapper = createControlMapper(element, name, NodeKind.JOIN, state);
        state.addNode(new ParsedNode(name, NodeKind.JOIN, mapper, List.of(to), null), NodeKind.JOIN.getTag());
    }

    private void parseFork(Element element, ParseState state) {
        String name = requiredName(element, NodeKind.FORK.getTag());
        List<String> paths = new ArrayList<>();
        for (Element path : XmlUtils.childElements(element, "path")) {
            paths.add(requiredReference(path, "start", name, NodeKind.FORK.getTag()));
        }
        if (paths.isEmpty()) {
            throw new WorkflowStructureException(name, NodeKind.FORK.getTag(), "fork 没有任何 <path>");
        }
        ActionMapper mapper = createControlMapper(element, name, NodeKind.FORK, state);
        state.addNode(new ParsedNode(name, NodeKind.FORK, mapper, paths, null), NodeKind.FORK.getTag());

        // 分支起点就地解析，已访问过的元素不会重复解析
        for (String pathStart : paths) {
            Element target = state.rootIndex.get(pathStart);
            if (target == null) {
                throw new WorkflowStructureException(name, NodeKind.FORK.getTag(),
                        String.format("path 引用了不存在的节点 '%s'", pathStart));
            }
            if (!state.isVisited(target)) {
                Optional<NodeKind> targetKind = NodeKind.fromTag(XmlUtils.localName(target));
                if (targetKind.isPresent()) {
                    parseNode(target, targetKind.get(), state);
                }
            }
        }
    }

    private void parseDecision(Element element, ParseState state) {
        String name = requiredName(element, NodeKind.DECISION.getTag());
        String tag = NodeKind.DECISION.getTag();
        Element switchElement = XmlUtils.findChild(element, "switch")
                .orElseThrow(() -> new WorkflowStructureException(name, tag, "缺少 <switch> 元素"));

        List<String> downstream = new ArrayList<>();
        int defaultCount = 0;
        String defaultTarget = null;
        List<String> otherTargets = new ArrayList<>();
        for (Element branch : XmlUtils.childElements(switchElement)) {
            String branchTag = XmlUtils.localName(branch);
            boolean known = "case".equals(branchTag) || "default".equals(branchTag);
            if (!known) {
                if (strictDecisionDefault) {
                    throw new WorkflowStructureException(name, tag,
                            String.format("<switch> 中不允许出现 <%s>", branchTag));
                }
                log.warn("DAG '{}': decision '{}' 中的 <{}> 被当作 default 候选处理", dagName, name, branchTag);
            }
            if ("default".equals(branchTag)) {
                defaultCount++;
            }
            Optional<String> to = XmlUtils.attribute(branch, "to").map(NameNormalizer::normalize);
            if (to.isEmpty()) {
                if (strictDecisionDefault) {
                    throw new WorkflowStructureException(name, tag, String.format("<%s> 缺少 to 属性", branchTag));
                }
                log.warn("DAG '{}': decision '{}' 中忽略没有 to 属性的 <{}>", dagName, name, branchTag);
            } else if ("case".equals(branchTag)) {
                downstream.add(to.get());
            } else if ("default".equals(branchTag)) {
                if (defaultTarget == null) {
                    defaultTarget = to.get();
                }
            } else {
                otherTargets.add(to.get());
            }
        }
        if (defaultCount != 1) {
            if (strictDecisionDefault) {
                throw new WorkflowStructureException(name, tag,
                        String.format("<switch> 必须恰好有一个 <default>，实际为 %d 个", defaultCount));
            }
            log.warn("DAG '{}': decision '{}' 有 {} 个 <default> 分支", dagName, name, defaultCount);
        }
        // 与 DecisionMapper 的选择规则一致：第一个 default，没有时取最后一个非 case 分支
        if (defaultTarget == null && !otherTargets.isEmpty()) {
            defaultTarget = otherTargets.get(otherTargets.size() - 1);
        }
        if (defaultTarget != null) {
            downstream.add(defaultTarget);
        }
        if (downstream.isEmpty()) {
            throw new WorkflowStructureException(name, tag, "decision 没有任何分支");
        }

        ActionMapper mapper = createControlMapper(element, name, NodeKind.DECISION, state);
        state.addNode(new ParsedNode(name, NodeKind.DECISION, mapper, downstream, null), tag);
    }

    private void parseAction(Element element, ParseState state) {
        String actionTag = NodeKind.ACTION.getTag();
        String name = requiredName(element, actionTag);

        String ok = XmlUtils.findChild(element, "ok")
                .map(okElement -> requiredReference(okElement, "to", name, actionTag))
                .orElseThrow(() -> new WorkflowStructureException(name, actionTag, "缺少 <ok> 转移"));
        String error = XmlUtils.findChild(element, "error")
                .map(errorElement -> requiredReference(errorElement, "to", name, actionTag))
                .orElseThrow(() -> new WorkflowStructureException(name, actionTag, "缺少 <error> 转移"));

        Element typeElement = XmlUtils.childElements(element).stream()
                .filter(child -> !"ok".equals(XmlUtils.localName(child)) && !"error".equals(XmlUtils.localName(child)))
                .findFirst()
                .orElseThrow(() -> new WorkflowStructureException(name, actionTag, "缺少动作类型元素"));
        String type = XmlUtils.localName(typeElement);

        Optional<MapperFactory> registered = actionRegistry.getFactory(type);
        boolean placeholder = registered.isEmpty();
        MapperFactory factory = registered.orElseGet(() -> {
            log.warn("DAG '{}': 动作 '{}' 的类型 '{}' 不受支持，使用占位任务代替", dagName, name, type);
            return actionRegistry.getFactory(MapperRegistry.UNKNOWN_TYPE)
                    .orElseThrow(() -> new IllegalStateException("动作节点注册表缺少 unknown 兜底项"));
        });
        ActionMapper mapper = factory.create(state.contextFor(typeElement, name, type));

        attachFiles(mapper, typeElement, name, type, placeholder);
        attachArchives(mapper, typeElement, name, type, placeholder);

        Optional<PrepareCapable> prepare = mapper.as(PrepareCapable.class).filter(PrepareCapable::hasPrepare);
        if (prepare.isPresent()) {
            PrepareMapper prepareMapper = new PrepareMapper(name, prepare.get().getPrepareCommand());
            String prepareName = prepareMapper.getName();
            state.dependencies.addAll(prepareMapper.requiredImports());
            state.addNode(new ParsedNode(prepareName, NodeKind.PREPARE, prepareMapper, List.of(name), null),
                    NodeKind.PREPARE.getTag());
            state.prepareAliases.put(name, prepareName);
            log.debug("DAG '{}': 动作 '{}' 展开出 prepare 节点 '{}'", dagName, name, prepareName);
        }

        state.dependencies.addAll(mapper.requiredImports());
        state.addNode(new ParsedNode(name, NodeKind.ACTION, mapper, List.of(ok), error), type);
    }

    private void attachFiles(ActionMapper mapper, Element typeElement, String name, String type, boolean placeholder) {
        List<String> files = XmlUtils.childTexts(typeElement, "file");
        if (files.isEmpty()) {
            return;
        }
        Optional<FileCapable> fileCapable = mapper.as(FileCapable.class);
        if (fileCapable.isEmpty()) {
            if (placeholder) {
                log.warn("DAG '{}': 占位动作 '{}' 忽略 {} 个 <file>", dagName, name, files.size());
                return;
            }
            throw new WorkflowStructureException(name, type, "该动作类型不支持 <file>");
        }
        files.forEach(fileCapable.get()::addFile);
    }

    private void attachArchives(ActionMapper mapper, Element typeElement, String name, String type, boolean placeholder) {
        List<String> archives = XmlUtils.childTexts(typeElement, "archive");
        if (archives.isEmpty()) {
            return;
        }
        Optional<ArchiveCapable> archiveCapable = mapper.as(ArchiveCapable.class);
        if (archiveCapable.isEmpty()) {
            if (placeholder) {
                log.warn("DAG '{}': 占位动作 '{}' 忽略 {} 个 <archive>", dagName, name, archives.size());
                return;
            }
            throw new WorkflowStructureException(name, type, "该动作类型不支持 <archive>");
        }
        archives.forEach(archiveCapable.get()::addArchive);
    }

    private ActionMapper createControlMapper(Element element, String name, NodeKind kind, ParseState state) {
        MapperFactory factory = controlRegistry.getFactory(kind.getTag())
                .orElseThrow(() -> new IllegalStateException(String.format("控制节点注册表 '%s' 中没有 '%s' 的映射器。",
                        controlRegistry.getName(), kind.getTag())));
        ActionMapper mapper = factory.create(state.contextFor(element, name, kind.getTag()));
        state.dependencies.addAll(mapper.requiredImports());
        return mapper;
    }

    private static String requiredName(Element element, String nodeType) {
        String name = XmlUtils.attribute(element, "name").map(NameNormalizer::normalize).orElse("");
        if (name.isEmpty()) {
            throw new WorkflowStructureException(null, nodeType, "缺少 name 属性");
        }
        return name;
    }

    private static String requiredReference(Element element, String attribute, String nodeName, String nodeType) {
        String reference = XmlUtils.attribute(element, attribute).map(NameNormalizer::normalize).orElse("");
        if (reference.isEmpty()) {
            throw new WorkflowStructureException(nodeName, nodeType,
                    String.format("<%s> 缺少 %s 属性", XmlUtils.localName(element), attribute));
        }
        return reference;
    }

    /**
     * 单次解析的可变状态，解析结束后冻结成 {@link WorkflowGraph}。
     */
    private final class ParseState {
        private final Map<String, Element> rootIndex = new LinkedHashMap<>();
        private final Set<Element> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Map<String, ParsedNode> nodes = new LinkedHashMap<>();
        private final SortedSet<String> dependencies = new TreeSet<>(BASE_IMPORTS);
        private final Map<String, String> prepareAliases = new LinkedHashMap<>();
        // 生成代码中的 Python 标识符 -> 占用它的节点
        private final Map<String, String> identifierOwners = new HashMap<>();
        // decision 映射器在生成代码时才通过它查找目标的第一个任务 ID
        private final AtomicReference<WorkflowGraph> graphHolder = new AtomicReference<>();
        private final Function<String, String> taskIdResolver = this::resolveFirstTaskId;

        private ParseState(Element root) {
            for (Element child : XmlUtils.childElements(root)) {
                XmlUtils.attribute(child, "name")
                        .map(NameNormalizer::normalize)
                        .ifPresent(name -> rootIndex.putIfAbsent(name, child));
            }
        }

        private boolean isVisited(Element element) {
            return visited.contains(element);
        }

        private void markVisited(Element element) {
            visited.add(element);
        }

        private MapperContext contextFor(Element element, String name, String type) {
            return MapperContext.builder()
                    .node(element)
                    .name(name)
                    .type(type)
                    .params(params)
                    .dagName(dagName)
                    .inputDirectory(inputDirectory)
                    .outputDirectory(outputDirectory)
                    .taskIdResolver(taskIdResolver)
                    .build();
        }

        private void addNode(ParsedNode node, String sourceType) {
            if (nodes.containsKey(node.getName())) {
                throw new WorkflowStructureException(node.getName(), sourceType, "节点名称重复");
            }
            Set<String> identifiers = new LinkedHashSet<>();
            identifiers.add(node.getName());
            identifiers.addAll(node.getMapper().getGeneratedIdentifiers());
            for (String identifier : identifiers) {
                String owner = identifierOwners.get(identifier);
                if (owner != null && !owner.equals(node.getName())) {
                    throw new WorkflowStructureException(node.getName(), sourceType,
                            String.format("生成的标识符 '%s' 与节点 '%s' 冲突", identifier, owner));
                }
            }
            identifiers.forEach(identifier -> identifierOwners.put(identifier, node.getName()));
            nodes.put(node.getName(), node);
            log.debug("DAG '{}': 已解析节点 {}", dagName, node);
            for (ConversionListener listener : listeners) {
                try {
                    listener.onNodeParsed(dagName, node, sourceType);
                } catch (Exception e) {
                    log.error("监听器 {} 处理 onNodeParsed 时出错: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
                }
            }
        }

        private String resolveFirstTaskId(String nodeName) {
            WorkflowGraph graph = graphHolder.get();
            if (graph == null) {
                return nodeName;
            }
            String effective = graph.getPrepareAliases().getOrDefault(nodeName, nodeName);
            return graph.getNode(effective).map(ParsedNode::getFirstTaskId).orElse(nodeName);
        }
    }
}
