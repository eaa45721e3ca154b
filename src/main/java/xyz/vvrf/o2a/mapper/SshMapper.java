package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * ssh 动作：{@code <host>} 形如 {@code user@host}，缺省用户为 {@code user.name} 参数。
 *
 * @author ruifeng.wen
 */
public class SshMapper extends AbstractActionMapper {

    private final String user;
    private final String host;
    private final String command;

    public SshMapper(MapperContext context) {
        super(context);
        String address = requiredText("host");
        int at = address.indexOf('@');
        if (at >= 0) {
            this.user = address.substring(0, at);
            this.host = address.substring(at + 1);
        } else {
            this.user = params.get("user.name");
            this.host = address;
        }
        List<String> parts = new ArrayList<>();
        parts.add(PythonLiterals.shellQuote(requiredText("command")));
        for (String argument : texts("args")) {
            parts.add(PythonLiterals.shellQuote(argument));
        }
        this.command = String.join(" ", parts);
    }

    public String getUser() {
        return user;
    }

    public String getHost() {
        return host;
    }

    public String getCommand() {
        return command;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        return name + "_hook = ssh_hook.SSHHook(\n"
                + arg("ssh_conn_id", PythonLiterals.quote("ssh_default"))
                + arg("username", PythonLiterals.quote(user))
                + arg("remote_host", PythonLiterals.quote(host))
                + ")\n\n"
                + name + " = ssh_operator.SSHOperator(\n"
                + taskIdArg(name)
                + triggerRuleArg(triggerRule.getValue())
                + arg("ssh_hook", name + "_hook")
                + arg("command", PythonLiterals.quote(command))
                + ")\n";
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.contrib.operators import ssh_operator",
                "from airflow.contrib.hooks import ssh_hook");
    }
}
