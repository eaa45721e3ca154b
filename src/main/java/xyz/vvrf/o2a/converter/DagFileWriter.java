package xyz.vvrf.o2a.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.core.ParsedNode;
import xyz.vvrf.o2a.core.Relation;
import xyz.vvrf.o2a.core.TriggerRuleAssignment;
import xyz.vvrf.o2a.core.WorkflowGraph;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 生成 DAG 文件内容。输出顺序固定：import、PARAMS、DAG 头、各节点片段、关系。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DagFileWriter {

    public static final int INDENT = 4;
    static final String DATES_IMPORT = "from airflow.utils import dates";

    private final ObjectMapper objectMapper;

    public DagFileWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    /**
     * 生成完整的 DAG 文件文本。
     *
     * @param graph        工作流图
     * @param relations    单元之间的关系
     * @param triggerRules 各节点的触发规则
     * @param params       工作流参数
     * @param request      转换参数 (DAG 名称、调度设置)
     * @return Python 源码
     */
    public String render(WorkflowGraph graph,
                         SortedSet<Relation> relations,
                         TriggerRuleAssignment triggerRules,
                         Map<String, String> params,
                         ConversionRequest request) {
        StringBuilder text = new StringBuilder();

        SortedSet<String> imports = new TreeSet<>(graph.getDependencies());
        imports.add(DATES_IMPORT);
        text.append(String.join("\n", imports)).append("\n\n");

        text.append("PARAMS = ").append(renderParams(params)).append("\n\n");
        text.append(renderHeader(request.getDagName(), request.getScheduleInterval(), request.getStartDaysAgo()));

        for (ParsedNode node : graph.getNodes().values()) {
            String fragment = node.getMapper().convertToText(triggerRules.getTriggerRule(node.getName()));
            text.append(PythonLiterals.indent(fragment, INDENT)).append('\n');
            log.debug("已生成节点 '{}' 的代码", node.getName());
        }

        text.append('\n');
        for (Relation relation : relations) {
            text.append(" ".repeat(INDENT)).append(relation.getFromTaskId())
                    .append(".set_downstream(").append(relation.getToTaskId()).append(")\n");
        }
        return text.toString();
    }

    String renderParams(Map<String, String> params) {
        try {
            return objectMapper.writer(new PythonStylePrettyPrinter()).writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化 PARAMS 失败", e);
        }
    }

    static String renderHeader(String dagName, int scheduleInterval, int startDaysAgo) {
        String schedule = scheduleInterval > 0
                ? "datetime.timedelta(days=" + scheduleInterval + ")"
                : "None";
        return "with models.DAG(\n"
                + "    " + PythonLiterals.quote(dagName) + ",\n"
                + "    schedule_interval=" + schedule + ",\n"
                + "    start_date=dates.days_ago(" + startDaysAgo + "),\n"
                + ") as dag:\n\n";
    }

    /**
     * 写入文件 (UTF-8，覆盖已有内容)。
     */
    public void write(Path outputFile, String content) {
        try {
            Files.writeString(outputFile, content, StandardCharsets.UTF_8);
            log.info("已写入 DAG 文件: {}", outputFile);
        } catch (IOException e) {
            throw new UncheckedIOException("写入 DAG 文件失败: " + outputFile, e);
        }
    }

    /**
     * 四空格缩进，键值之间为 {@code ": "}，与 Python 的 json.dumps(indent=4) 输出一致。
     */
    static final class PythonStylePrettyPrinter extends DefaultPrettyPrinter {

        PythonStylePrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        PythonStylePrettyPrinter(PythonStylePrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new PythonStylePrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator generator) throws IOException {
            generator.writeRaw(": ");
        }
    }
}
