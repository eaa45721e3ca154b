package xyz.vvrf.o2a.converter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.core.WorkflowStructureException;
import xyz.vvrf.o2a.monitor.ConversionListener;
import xyz.vvrf.o2a.registry.DefaultMapperRegistries;
import xyz.vvrf.o2a.spring.boot.ConverterProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static xyz.vvrf.o2a.test.util.WorkflowXml.copyWorkflow;

class OozieConverterTest {

    @TempDir
    Path temp;

    private Path input;
    private Path output;
    private ConversionListener listener;
    private OozieConverterFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        input = copyWorkflow("demo", Files.createDirectories(temp.resolve("demo")));
        output = temp.resolve("out");
        listener = mock(ConversionListener.class);
        factory = new OozieConverterFactory(new ConverterProperties(),
                DefaultMapperRegistries.controlRegistry(),
                DefaultMapperRegistries.actionRegistry(),
                List.of(listener),
                new ObjectMapper());
    }

    private ConversionRequest.ConversionRequestBuilder request() {
        return factory.requestBuilder()
                .dagName("demo")
                .inputDirectory(input)
                .outputDirectory(output)
                .user("tester");
    }

    @Test
    @DisplayName("完整转换 demo 工作流")
    void convertsDemoWorkflow() throws IOException {
        ConversionResult result = factory.create(request().scheduleInterval(1).startDaysAgo(2).build()).convert();

        Path dagFile = output.resolve("demo.py");
        assertEquals(dagFile, result.getOutputFile());
        String content = Files.readString(dagFile, StandardCharsets.UTF_8);

        assertTrue(content.startsWith("from airflow import models\n"));
        assertTrue(content.contains("from airflow.contrib.operators import dataproc_operator\n"));
        assertTrue(content.contains("from airflow.utils import dates\n"));
        assertTrue(content.contains("    \"nameNode\": \"hdfs://localhost:8020\","));
        assertTrue(content.contains("    \"user.name\": \"tester\""));
        assertTrue(content.contains("with models.DAG(\n    'demo',\n"
                + "    schedule_interval=datetime.timedelta(days=1),\n"
                + "    start_date=dates.days_ago(2),\n) as dag:\n"));

        // EL 在生成前已替换
        assertTrue(content.contains("hadoop fs -rm -r hdfs://localhost:8020/user/tester/examples/output"));
        assertTrue(content.contains("    mr_node_prepare = bash_operator.BashOperator("));
        assertTrue(content.contains("    prepare_data_fs_1.set_downstream(check_mode)\n"));
        assertTrue(content.contains("    check_mode.set_downstream(mr_node_prepare)\n"));
        assertTrue(content.contains("    check_mode.set_downstream(shell_node)\n"));
        assertTrue(content.contains("    mr_node_prepare.set_downstream(mr_node)\n"));
        assertTrue(content.contains("return 'mr_node_prepare'"));

        assertEquals(TriggerRule.ONE_FAILED, result.getTriggerRules().getTriggerRule("fail"));
        assertEquals(TriggerRule.ALL_SUCCESS, result.getTriggerRules().getTriggerRule("end"));
        assertEquals("print(\"map\")",
                Files.readString(output.resolve("assets/lib/mapper.py")).trim());

        verify(listener).onConversionStart(eq("demo"), any());
        verify(listener).onConversionSuccess(eq("demo"), any(), eq(result.getGraph().size()), anyInt());
    }

    @Test
    void staleOutputIsReplaced() throws IOException {
        Files.createDirectories(output);
        Files.writeString(output.resolve("stale.py"), "old");

        factory.create(request().build()).convert();

        assertFalse(Files.exists(output.resolve("stale.py")));
        assertTrue(Files.exists(output.resolve("demo.py")));
    }

    @Test
    @DisplayName("转换失败时不改动已有的输出目录")
    void failureLeavesOutputUntouched() throws IOException {
        Files.createDirectories(output);
        Files.writeString(output.resolve("keep.py"), "keep");
        Files.writeString(input.resolve("workflow.xml"),
                "<workflow-app xmlns=\"uri:oozie:workflow:0.5\" name=\"x\"><start to=\"missing\"/><end name=\"end\"/></workflow-app>");

        assertThrows(WorkflowStructureException.class, () -> factory.create(request().build()).convert());

        assertEquals("keep", Files.readString(output.resolve("keep.py")));
        assertFalse(Files.exists(output.resolve("demo.py")));
        verify(listener).onConversionFailure(eq("demo"), any(), any(WorkflowStructureException.class));
        verify(listener, never()).onConversionSuccess(any(), any(), anyInt(), anyInt());
    }

    @Test
    void outputMustNotContainInput() {
        ConversionRequest request = request().outputDirectory(temp).build();

        assertThrows(IllegalArgumentException.class, () -> factory.create(request).convert());
        assertTrue(Files.exists(input.resolve("workflow.xml")));
    }

    @Test
    void rendersNoScheduleByDefault() {
        assertEquals("with models.DAG(\n    'x',\n    schedule_interval=None,\n"
                        + "    start_date=dates.days_ago(0),\n) as dag:\n\n",
                DagFileWriter.renderHeader("x", 0, 0));
    }
}
