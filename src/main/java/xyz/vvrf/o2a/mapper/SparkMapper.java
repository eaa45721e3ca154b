package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.PrepareCapable;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * spark 动作，转换为 Dataproc 上的 Spark 作业。只支持 prepare 块，
 * 依赖文件通过 {@code <jar>} 和 {@code --jars} 选项传递，不接受 file/archive 元素。
 *
 * @author ruifeng.wen
 */
public class SparkMapper extends AbstractActionMapper implements PrepareCapable {

    private final String mainClass;
    private final String mainJar;
    private final String jobName;
    private final List<String> arguments;
    private final Map<String, String> sparkProperties;

    public SparkMapper(MapperContext context) {
        super(context);
        this.mainClass = optionalText("class");
        this.mainJar = requiredText("jar");
        this.jobName = optionalText("name");
        this.arguments = new ArrayList<>(texts("arg"));
        this.sparkProperties = new LinkedHashMap<>(properties);
        String sparkOpts = optionalText("spark-opts");
        if (sparkOpts != null) {
            parseSparkOpts(sparkOpts, sparkProperties);
        }
    }

    /**
     * 只识别 {@code --conf key=value} 形式的选项，其余选项忽略。
     */
    static void parseSparkOpts(String sparkOpts, Map<String, String> target) {
        String[] tokens = sparkOpts.trim().split("\\s+");
        for (int i = 0; i < tokens.length - 1; i++) {
            if ("--conf".equals(tokens[i])) {
                String pair = tokens[++i];
                int eq = pair.indexOf('=');
                if (eq > 0) {
                    target.put(pair.substring(0, eq), pair.substring(eq + 1));
                }
            }
        }
    }

    public String getMainClass() {
        return mainClass;
    }

    public String getMainJar() {
        return mainJar;
    }

    public Map<String, String> getSparkProperties() {
        return sparkProperties;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        StringBuilder text = new StringBuilder();
        text.append(name).append(" = dataproc_operator.DataProcSparkOperator(\n")
                .append(taskIdArg(name))
                .append(triggerRuleArg(triggerRule.getValue()));
        if (mainClass != null) {
            text.append(arg("main_class", PythonLiterals.quote(mainClass)))
                    .append(arg("dataproc_spark_jars", PythonLiterals.list(List.of(mainJar))));
        } else {
            text.append(arg("main_jar", PythonLiterals.quote(mainJar)));
        }
        if (jobName != null) {
            text.append(arg("job_name", PythonLiterals.quote(jobName)));
        }
        text.append(arg("arguments", PythonLiterals.list(arguments)))
                .append(arg("dataproc_spark_properties", PythonLiterals.dict(sparkProperties)))
                .append(arg("cluster_name", clusterNameExpression()))
                .append(arg("params", "PARAMS"))
                .append(")\n");
        return text.toString();
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.contrib.operators import dataproc_operator");
    }
}
