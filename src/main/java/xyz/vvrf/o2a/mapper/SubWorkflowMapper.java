package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.Set;

/**
 * sub-workflow 动作：触发以子工作流目录名命名的另一个 DAG。
 * 子工作流本身需要单独转换。
 *
 * @author ruifeng.wen
 */
public class SubWorkflowMapper extends AbstractActionMapper {

    private final String appPath;
    private final String triggerDagId;
    private final boolean propagateConfiguration;

    public SubWorkflowMapper(MapperContext context) {
        super(context);
        this.appPath = requiredText("app-path");
        this.triggerDagId = dagIdOf(appPath);
        this.propagateConfiguration = optionalText("propagate-configuration") != null;
    }

    static String dagIdOf(String appPath) {
        String trimmed = appPath.replaceAll("/+$", "");
        int slash = trimmed.lastIndexOf('/');
        String last = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return last.isEmpty() ? trimmed : last;
    }

    public String getTriggerDagId() {
        return triggerDagId;
    }

    public boolean isPropagateConfiguration() {
        return propagateConfiguration;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        StringBuilder text = new StringBuilder();
        text.append(name).append(" = dagrun_operator.TriggerDagRunOperator(\n")
                .append(taskIdArg(name))
                .append(triggerRuleArg(triggerRule.getValue()))
                .append(arg("trigger_dag_id", PythonLiterals.quote(triggerDagId)));
        if (propagateConfiguration) {
            text.append(arg("params", "PARAMS"));
        } else {
            text.append(arg("params", PythonLiterals.dict(properties)));
        }
        text.append(")\n");
        return text.toString();
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.operators import dagrun_operator");
    }
}
