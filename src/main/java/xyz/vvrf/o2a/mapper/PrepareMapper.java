package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.PrepareCapable;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.Objects;
import java.util.Set;

/**
 * 带 prepare 块的动作节点展开出的前置任务：在主任务之前执行清理/建目录命令。
 *
 * @author ruifeng.wen
 */
public class PrepareMapper extends BaseMapper {

    private final String command;

    /**
     * @param actionName 原动作节点名称，生成的任务名为 {@code <actionName>_prepare}
     * @param command    prepare 命令 (不能为空)
     */
    public PrepareMapper(String actionName, String command) {
        super(PrepareCapable.prepareNameOf(actionName));
        this.command = Objects.requireNonNull(command, "prepare 命令不能为空");
    }

    public String getCommand() {
        return command;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        return name + " = bash_operator.BashOperator(\n"
                + taskIdArg(name)
                + triggerRuleArg(triggerRule.getValue())
                + "    bash_command=" + PythonLiterals.quote(command) + ",\n"
                + ")\n";
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.operators import bash_operator");
    }
}
