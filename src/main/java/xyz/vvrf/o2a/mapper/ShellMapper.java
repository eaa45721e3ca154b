package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.ArchiveCapable;
import xyz.vvrf.o2a.core.FileCapable;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.PrepareCapable;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * shell 动作：{@code <exec>} 加上所有 {@code <argument>} 拼成一条 bash 命令。
 *
 * @author ruifeng.wen
 */
public class ShellMapper extends AbstractActionMapper implements PrepareCapable, FileCapable, ArchiveCapable {

    private final String command;

    public ShellMapper(MapperContext context) {
        super(context);
        List<String> parts = new ArrayList<>();
        parts.add(PythonLiterals.shellQuote(requiredText("exec")));
        for (String argument : texts("argument")) {
            parts.add(PythonLiterals.shellQuote(argument));
        }
        this.command = String.join(" ", parts);
    }

    public String getCommand() {
        return command;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        return name + " = bash_operator.BashOperator(\n"
                + taskIdArg(name)
                + triggerRuleArg(triggerRule.getValue())
                + arg("bash_command", PythonLiterals.quote(command))
                + arg("env", PythonLiterals.dict(properties))
                + arg("params", "PARAMS")
                + ")\n";
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.operators import bash_operator");
    }
}
