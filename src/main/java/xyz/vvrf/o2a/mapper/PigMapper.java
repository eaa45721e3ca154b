package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.ArchiveCapable;
import xyz.vvrf.o2a.core.FileCapable;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.PrepareCapable;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * pig 动作，转换为 Dataproc 上的 Pig 作业。
 * {@code <param>key=value</param>} 转换为脚本变量。
 *
 * @author ruifeng.wen
 */
public class PigMapper extends AbstractActionMapper implements PrepareCapable, FileCapable, ArchiveCapable {

    private final String script;
    private final Map<String, String> scriptVariables;

    public PigMapper(MapperContext context) {
        super(context);
        this.script = requiredText("script");
        this.scriptVariables = parseParams(texts("param"));
    }

    private static Map<String, String> parseParams(List<String> rawParams) {
        Map<String, String> variables = new LinkedHashMap<>();
        for (String raw : rawParams) {
            int eq = raw.indexOf('=');
            if (eq > 0) {
                variables.put(raw.substring(0, eq).trim(), raw.substring(eq + 1).trim());
            } else {
                variables.put(raw, "");
            }
        }
        return variables;
    }

    public String getScript() {
        return script;
    }

    public Map<String, String> getScriptVariables() {
        return scriptVariables;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        return name + " = dataproc_operator.DataProcPigOperator(\n"
                + taskIdArg(name)
                + triggerRuleArg(triggerRule.getValue())
                + arg("query_uri", PythonLiterals.quote(script))
                + arg("variables", PythonLiterals.dict(scriptVariables))
                + arg("dataproc_pig_properties", PythonLiterals.dict(properties))
                + arg("dataproc_pig_jars", PythonLiterals.list(getArchives()))
                + arg("files", PythonLiterals.list(getFiles()))
                + arg("cluster_name", clusterNameExpression())
                + arg("params", "PARAMS")
                + ")\n";
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.contrib.operators import dataproc_operator");
    }
}
