package xyz.vvrf.o2a.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.o2a.core.ArchiveCapable;
import xyz.vvrf.o2a.core.FileCapable;
import xyz.vvrf.o2a.core.NodeKind;
import xyz.vvrf.o2a.core.ParsedNode;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.core.WorkflowGraph;
import xyz.vvrf.o2a.core.WorkflowStructureException;
import xyz.vvrf.o2a.mapper.DecisionMapper;
import xyz.vvrf.o2a.mapper.DummyMapper;
import xyz.vvrf.o2a.mapper.KillMapper;
import xyz.vvrf.o2a.mapper.PrepareMapper;
import xyz.vvrf.o2a.mapper.ShellMapper;
import xyz.vvrf.o2a.monitor.ConversionListener;
import xyz.vvrf.o2a.registry.SimpleMapperRegistry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static xyz.vvrf.o2a.test.util.WorkflowXml.action;
import static xyz.vvrf.o2a.test.util.WorkflowXml.document;
import static xyz.vvrf.o2a.test.util.WorkflowXml.end;
import static xyz.vvrf.o2a.test.util.WorkflowXml.fork;
import static xyz.vvrf.o2a.test.util.WorkflowXml.join;
import static xyz.vvrf.o2a.test.util.WorkflowXml.kill;
import static xyz.vvrf.o2a.test.util.WorkflowXml.parse;
import static xyz.vvrf.o2a.test.util.WorkflowXml.parser;
import static xyz.vvrf.o2a.test.util.WorkflowXml.start;
import static xyz.vvrf.o2a.test.util.WorkflowXml.startNode;

class OozieWorkflowParserTest {

    @Test
    @DisplayName("线性工作流：节点、边和 import 都被正确收集")
    void parsesLinearWorkflow() {
        WorkflowGraph graph = parse(
                start("A"),
                action("A", "B", "K"),
                action("B", "end", "K"),
                kill("K"),
                end("end"));

        assertEquals(5, graph.size());
        ParsedNode start = startNode(graph);
        assertTrue(start.getName().matches("start_node_[0-9a-f]{4}"), start.getName());
        assertEquals(List.of("A"), start.getDownstreamNames());

        ParsedNode a = graph.getNode("A").orElseThrow();
        assertEquals(NodeKind.ACTION, a.getKind());
        assertEquals(List.of("B"), a.getDownstreamNames());
        assertEquals("K", a.getErrorName().orElseThrow());
        assertInstanceOf(ShellMapper.class, a.getMapper());

        ParsedNode k = graph.getNode("K").orElseThrow();
        assertInstanceOf(KillMapper.class, k.getMapper());
        assertTrue(k.getDownstreamNames().isEmpty());
        assertTrue(graph.getNode("end").orElseThrow().getDownstreamNames().isEmpty());

        assertTrue(graph.getDependencies().containsAll(OozieWorkflowParser.BASE_IMPORTS));
        assertTrue(graph.getDependencies().contains("from airflow.operators import bash_operator"));
        assertTrue(graph.getDependencies().contains("from airflow.operators import dummy_operator"));
    }

    @Test
    @DisplayName("声明处和引用处使用同一规则规范化名称")
    void normalizesNamesAtDeclarationAndReference() {
        WorkflowGraph graph = parse(
                start("load-data"),
                action("load-data", "clean.up", "kill-me"),
                action("clean.up", "the end", "kill-me"),
                kill("kill-me"),
                end("the end"));

        ParsedNode load = graph.getNode("load_data").orElseThrow();
        assertEquals(List.of("clean_up"), load.getDownstreamNames());
        assertEquals("kill_me", load.getErrorName().orElseThrow());
        assertTrue(graph.getNode("the_end").isPresent());
        assertEquals(List.of("load_data"), startNode(graph).getDownstreamNames());
    }

    @Test
    @DisplayName("动作缺少 ok 或 error 转移时报结构错误")
    void rejectsActionWithoutTransitions() {
        String noError = "<action name=\"A\"><shell><exec>ls</exec></shell><ok to=\"end\"/></action>";
        WorkflowStructureException e = assertThrows(WorkflowStructureException.class,
                () -> parse(start("A"), noError, end("end")));
        assertEquals("A", e.getNodeName());

        String noOk = "<action name=\"A\"><shell><exec>ls</exec></shell><error to=\"end\"/></action>";
        assertThrows(WorkflowStructureException.class, () -> parse(start("A"), noOk, end("end")));
    }

    @Test
    @DisplayName("引用不存在的节点时报结构错误")
    void rejectsDanglingReference() {
        WorkflowStructureException e = assertThrows(WorkflowStructureException.class,
                () -> parse(start("A"), action("A", "missing", "K"), kill("K"), end("end")));
        assertEquals("A", e.getNodeName());
        assertTrue(e.getMessage().contains("missing"));
    }

    @Test
    @DisplayName("规范化后重名的节点报结构错误")
    void rejectsDuplicateNames() {
        assertThrows(WorkflowStructureException.class,
                () -> parse(start("a-b"), action("a-b", "end", "K"), action("a_b", "end", "K"), kill("K"), end("end")));
    }

    @Test
    @DisplayName("error 目标与成功目标相同时报结构错误")
    void rejectsErrorEqualToOk() {
        assertThrows(WorkflowStructureException.class,
                () -> parse(start("A"), action("A", "end", "end"), end("end")));
    }

    @Test
    @DisplayName("未知的动作类型用占位映射器代替，未知的根级元素被跳过")
    void fallsBackForUnknownActionAndSkipsUnknownTags() {
        String hive = "<action name=\"H\"><hive xmlns=\"uri:oozie:hive-action:0.5\"><script>q.hql</script>"
                + "<file>udf.jar</file></hive><ok to=\"end\"/><error to=\"K\"/></action>";
        WorkflowGraph graph = parse(
                "<parameters><property><name>x</name></property></parameters>",
                "<global><job-tracker>jt</job-tracker></global>",
                start("H"), hive, kill("K"), end("end"));

        assertEquals(4, graph.size());
        ParsedNode h = graph.getNode("H").orElseThrow();
        DummyMapper mapper = assertInstanceOf(DummyMapper.class, h.getMapper());
        assertTrue(mapper.isPlaceholder());
        assertFalse(mapper.convertToText(TriggerRule.ALL_SUCCESS).contains("TODO"));
    }

    @Test
    @DisplayName("fork 分支起点就地解析，且每个节点只解析一次")
    void parsesForkPathsOnce() {
        WorkflowGraph graph = parse(
                start("F"),
                action("B", "J", "K"),
                fork("F", "A", "B"),
                action("A", "J", "K"),
                join("J", "end"),
                kill("K"),
                end("end"));

        assertEquals(7, graph.size());
        assertEquals(List.of("A", "B"), graph.getNode("F").orElseThrow().getDownstreamNames());
        assertEquals(List.of("end"), graph.getNode("J").orElseThrow().getDownstreamNames());
        // B 在 fork 之前声明，A 在 fork 中就地解析，因此 A 紧跟在 F 之后
        List<String> order = List.copyOf(graph.getNodes().keySet());
        assertEquals(order.indexOf("F") + 1, order.indexOf("A"));
    }

    @Test
    @DisplayName("fork 的 path 指向不存在的节点时报结构错误")
    void rejectsForkPathToMissingNode() {
        assertThrows(WorkflowStructureException.class,
                () -> parse(start("F"), fork("F", "A", "nowhere"), action("A", "end", "end_k"), kill("end_k"), end("end")));
    }

    @Test
    @DisplayName("严格模式下 decision 必须恰好有一个 default")
    void strictDecisionRequiresDefault() {
        String decision = "<decision name=\"D\"><switch><case to=\"A\">${x}</case></switch></decision>";
        WorkflowStructureException e = assertThrows(WorkflowStructureException.class,
                () -> parse(start("D"), decision, action("A", "end", "K"), kill("K"), end("end")));
        assertEquals("D", e.getNodeName());
    }

    @Test
    @DisplayName("start 或 join 缺少 to 属性时报结构错误")
    void rejectsStartAndJoinWithoutTo() {
        assertThrows(WorkflowStructureException.class,
                () -> parse("<start/>", action("A", "end", "K"), kill("K"), end("end")));

        WorkflowStructureException e = assertThrows(WorkflowStructureException.class,
                () -> parse(start("F"), fork("F", "A", "B"), action("A", "J", "K"), action("B", "J", "K"),
                        "<join name=\"J\"/>", kill("K"), end("end")));
        assertEquals("J", e.getNodeName());
    }

    @Test
    @DisplayName("宽松模式下没有 default 时，非 case 分支作为 default")
    void lenientDecisionAcceptsAnyBranch() {
        String decision = "<decision name=\"D\"><switch><case to=\"A\">${x}</case><otherwise to=\"B\"/></switch></decision>";
        WorkflowGraph graph = parser().strictDecisionDefault(false).build().parse(document(
                start("D"), decision, action("A", "end", "K"), action("B", "end", "K"), kill("K"), end("end")));

        assertEquals(List.of("A", "B"), graph.getNode("D").orElseThrow().getDownstreamNames());
    }

    @Test
    @DisplayName("宽松模式下已有 default 时，其余非 case 分支和多余的 default 不产生边")
    void lenientDecisionKeepsOnlySelectableBranches() {
        String decision = "<decision name=\"D\"><switch><case to=\"A\">${x}</case><otherwise to=\"B\"/>"
                + "<default to=\"C\"/><default to=\"B\"/></switch></decision>";
        WorkflowGraph graph = parser().strictDecisionDefault(false).build().parse(document(
                start("D"), decision, action("A", "end", "K"), action("B", "end", "K"), action("C", "end", "K"),
                kill("K"), end("end")));

        ParsedNode d = graph.getNode("D").orElseThrow();
        assertEquals(List.of("A", "C"), d.getDownstreamNames());
        DecisionMapper mapper = assertInstanceOf(DecisionMapper.class, d.getMapper());
        assertEquals("C", mapper.getDefaultTarget());
    }

    @Test
    @DisplayName("生成的任务变量与其他节点重名时报结构错误")
    void rejectsGeneratedIdentifierCollisions() {
        String fs = "<action name=\"clean\"><fs><mkdir path=\"/a\"/><mkdir path=\"/b\"/></fs>"
                + "<ok to=\"clean_fs_1\"/><error to=\"K\"/></action>";
        WorkflowStructureException e = assertThrows(WorkflowStructureException.class,
                () -> parse(start("clean"), fs, action("clean_fs_1", "end", "K"), kill("K"), end("end")));
        assertTrue(e.getMessage().contains("clean_fs_1"));

        // 顺序相反时同样能发现冲突
        assertThrows(WorkflowStructureException.class,
                () -> parse(start("clean_fs_1"), action("clean_fs_1", "clean", "K"),
                        fs.replace("clean_fs_1", "end"), kill("K"), end("end")));
    }

    @Test
    @DisplayName("decision 的辅助函数名与其他节点重名时报结构错误")
    void rejectsDecisionCallableCollision() {
        String decision = "<decision name=\"route\"><switch><case to=\"route_decision\">${x}</case>"
                + "<default to=\"end\"/></switch></decision>";
        assertThrows(WorkflowStructureException.class,
                () -> parse(start("route"), decision, action("route_decision", "end", "K"), kill("K"), end("end")));
    }

    @Test
    @DisplayName("不支持 file 的动作带 file 元素时报结构错误，支持时文件被附加")
    void attachesFilesThroughCapability() {
        String ssh = "<action name=\"S\"><ssh><host>me@box</host><command>ls</command><file>a.txt</file></ssh>"
                + "<ok to=\"end\"/><error to=\"K\"/></action>";
        assertThrows(WorkflowStructureException.class, () -> parse(start("S"), ssh, kill("K"), end("end")));

        String shell = "<action name=\"S\"><shell><exec>run.sh</exec><file>run.sh#run</file><archive>lib.zip</archive></shell>"
                + "<ok to=\"end\"/><error to=\"K\"/></action>";
        WorkflowGraph graph = parse(start("S"), shell, kill("K"), end("end"));
        ParsedNode s = graph.getNode("S").orElseThrow();
        assertEquals(List.of("run.sh#run"), s.getMapper().as(FileCapable.class).orElseThrow().getFiles());
        assertEquals(List.of("lib.zip"), s.getMapper().as(ArchiveCapable.class).orElseThrow().getArchives());
    }

    @Test
    @DisplayName("带 prepare 块的动作展开成 prepare 节点和主节点")
    void expandsPrepareIntoTwoNodes() {
        String mr = "<action name=\"mr\"><map-reduce><name-node>hdfs://nn</name-node>"
                + "<prepare><delete path=\"/tmp/out\"/><mkdir path=\"/tmp/out\"/></prepare></map-reduce>"
                + "<ok to=\"end\"/><error to=\"K\"/></action>";
        WorkflowGraph graph = parse(start("mr"), mr, kill("K"), end("end"));

        ParsedNode prepare = graph.getNode("mr_prepare").orElseThrow();
        assertEquals(NodeKind.PREPARE, prepare.getKind());
        assertEquals(List.of("mr"), prepare.getDownstreamNames());
        PrepareMapper mapper = assertInstanceOf(PrepareMapper.class, prepare.getMapper());
        assertEquals("hadoop fs -rm -r -f /tmp/out && hadoop fs -mkdir -p /tmp/out", mapper.getCommand());
        assertEquals("mr_prepare", graph.getPrepareAliases().get("mr"));

        ParsedNode start = startNode(graph);
        assertEquals("mr_prepare", graph.resolveReference(start, "mr").getName());
        assertEquals("mr", graph.resolveReference(prepare, "mr").getName());
    }

    @Test
    @DisplayName("动作节点注册表缺少 unknown 兜底项时无法创建解析器")
    void requiresUnknownFallback() {
        assertThrows(IllegalArgumentException.class, () -> parser().actionRegistry(new SimpleMapperRegistry("empty")).build());
    }

    @Test
    @DisplayName("每创建一个节点都通知监听器")
    void notifiesListenerForEachNode() {
        ConversionListener listener = mock(ConversionListener.class);
        parser().listeners(List.of(listener)).build().parse(document(
                start("A"), action("A", "end", "K"), kill("K"), end("end")));

        verify(listener, times(4)).onNodeParsed(eq("test_dag"), any(ParsedNode.class), any());
        verify(listener).onNodeParsed(eq("test_dag"), any(ParsedNode.class), eq("shell"));
    }
}
