package xyz.vvrf.o2a.mapper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.vvrf.o2a.core.ArchiveCapable;
import xyz.vvrf.o2a.core.FileCapable;
import xyz.vvrf.o2a.core.PrepareCapable;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.core.WorkflowStructureException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.o2a.test.util.WorkflowXml.context;

class ActionMappersTest {

    private static final Map<String, String> PARAMS = Map.of("nameNode", "hdfs://nn:8020", "queue", "etl");

    @Test
    void mapReduceReadsConfigurationAndPrepare() {
        MapReduceMapper mapper = new MapReduceMapper(context("mr", "map-reduce",
                "<map-reduce><name-node>${nameNode}</name-node>"
                        + "<prepare><delete path=\"${nameNode}/out\"/><mkdir path=\"/tmp/x\"/></prepare>"
                        + "<configuration>"
                        + "<property><name>mapred.job.queue.name</name><value>${queue}</value></property>"
                        + "</configuration></map-reduce>",
                PARAMS));

        assertEquals("hdfs://nn:8020", mapper.getNameNode());
        assertEquals(Map.of("mapred.job.queue.name", "etl"), mapper.getProperties());
        assertTrue(mapper.hasPrepare());
        assertEquals("hadoop fs -rm -r -f hdfs://nn:8020/out && hadoop fs -mkdir -p /tmp/x",
                mapper.getPrepareCommand());
        assertTrue(mapper.as(PrepareCapable.class).isPresent());

        String text = mapper.convertToText(TriggerRule.ALL_SUCCESS);
        assertTrue(text.startsWith("mr = dataproc_operator.DataProcHadoopOperator("));
        assertTrue(text.contains("dataproc_hadoop_properties={'mapred.job.queue.name': 'etl'},"));
    }

    @Test
    void mapReduceRequiresNameNode() {
        assertThrows(WorkflowStructureException.class,
                () -> new MapReduceMapper(context("mr", "map-reduce", "<map-reduce/>")));
    }

    @Test
    void unsupportedPrepareOperationIsRejected() {
        assertThrows(WorkflowStructureException.class,
                () -> new ShellMapper(context("sh", "shell",
                        "<shell><exec>ls</exec><prepare><chmod path=\"/a\"/></prepare></shell>")));
    }

    @Test
    void shellQuotesArguments() {
        ShellMapper mapper = new ShellMapper(context("sh", "shell",
                "<shell><exec>echo</exec><argument>hello world</argument><argument>${queue}</argument></shell>",
                PARAMS));

        assertEquals("echo 'hello world' etl", mapper.getCommand());
        assertFalse(mapper.hasPrepare());
    }

    @Test
    void unknownParameterBecomesTemplate() {
        ShellMapper mapper = new ShellMapper(context("sh", "shell",
                "<shell><exec>echo</exec><argument>${missing}</argument></shell>"));

        assertEquals("echo '{{ params['\"'\"'missing'\"'\"'] }}'", mapper.getCommand());
    }

    @Test
    void sparkParsesConfOptions() {
        SparkMapper mapper = new SparkMapper(context("spark", "spark",
                "<spark><jar>app.jar</jar><class>com.example.Main</class>"
                        + "<spark-opts>--executor-memory 2G --conf spark.a=1 --conf spark.b=x=y</spark-opts>"
                        + "<arg>in</arg></spark>"));

        assertEquals("com.example.Main", mapper.getMainClass());
        assertEquals(Map.of("spark.a", "1", "spark.b", "x=y"), mapper.getSparkProperties());
        assertTrue(mapper.as(PrepareCapable.class).isPresent());
        assertFalse(mapper.as(FileCapable.class).isPresent());
        assertTrue(mapper.convertToText(TriggerRule.ALL_SUCCESS).contains("arguments=['in'],"));
    }

    @Test
    void sshHasNoCapabilities() {
        SshMapper mapper = new SshMapper(context("remote", "ssh",
                "<ssh><host>ops@gateway</host><command>uptime</command></ssh>"));

        assertFalse(mapper.as(PrepareCapable.class).isPresent());
        assertFalse(mapper.as(FileCapable.class).isPresent());
        assertFalse(mapper.as(ArchiveCapable.class).isPresent());
    }

    @Test
    void subWorkflowTriggersDagNamedAfterAppPath() {
        SubWorkflowMapper mapper = new SubWorkflowMapper(context("child", "sub-workflow",
                "<sub-workflow><app-path>${nameNode}/apps/child_flow/</app-path><propagate-configuration/></sub-workflow>",
                PARAMS));

        assertEquals("child_flow", mapper.getTriggerDagId());
        assertTrue(mapper.isPropagateConfiguration());
        assertTrue(mapper.convertToText(TriggerRule.ALL_SUCCESS).contains("params=PARAMS,"));
    }

    @Test
    void copiesOnlyLocalAssets(@TempDir Path temp) throws IOException {
        Path input = Files.createDirectories(temp.resolve("in"));
        Path output = Files.createDirectories(temp.resolve("out"));
        Files.createDirectories(input.resolve("lib"));
        Files.writeString(input.resolve("lib/run.sh"), "echo run");

        ShellMapper mapper = new ShellMapper(context("sh", "shell", "<shell><exec>run.sh</exec></shell>"));
        mapper.addFile("lib/run.sh#run.sh");
        mapper.addFile("hdfs://nn/apps/x.jar");
        mapper.addArchive("lib/missing.tgz");

        mapper.copyExtraAssets(input, output);

        assertEquals(List.of("lib/run.sh#run.sh", "hdfs://nn/apps/x.jar"), mapper.getFiles());
        assertEquals("echo run", Files.readString(output.resolve("assets/lib/run.sh")));
        assertFalse(Files.exists(output.resolve("assets/lib/missing.tgz")));
    }

    @Test
    void pigReadsScriptAndVariables() {
        PigMapper mapper = new PigMapper(context("pig", "pig",
                "<pig><script>id.pig</script><param>INPUT=${nameNode}/in</param><param>FLAG</param></pig>",
                PARAMS));

        assertEquals("id.pig", mapper.getScript());
        assertEquals(Map.of("INPUT", "hdfs://nn:8020/in", "FLAG", ""), mapper.getScriptVariables());
        assertTrue(mapper.convertToText(TriggerRule.ALL_SUCCESS).contains("query_uri='id.pig',"));
    }

    @Test
    void killKeepsMessageAsComment() {
        KillMapper mapper = KillMapper.of(context("fail", "kill", "<kill><message>boom</message></kill>"));

        assertEquals("boom", mapper.getMessage());
        String text = mapper.convertToText(TriggerRule.ONE_FAILED);
        assertTrue(text.startsWith("# Kill: boom\n"));
        assertTrue(text.contains("trigger_rule='one_failed',"));
    }
}
