package xyz.vvrf.o2a.mapper;

import org.w3c.dom.Element;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.core.WorkflowStructureException;
import xyz.vvrf.o2a.el.ElUtils;
import xyz.vvrf.o2a.util.PythonLiterals;
import xyz.vvrf.o2a.util.XmlUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * fs 动作：每个文件系统操作展开成一个独立的 bash 任务 {@code <name>_fs_<i>}，按顺序串联。
 * 没有任何操作时生成一个名为 {@code <name>} 的空任务。
 * <p>
 * 这是唯一的多单元映射器：入边落在第一个单元，出边从最后一个单元发出，
 * 单元之间的顺序关系在片段内部生成。
 *
 * @author ruifeng.wen
 */
public class FsMapper extends BaseMapper {

    private final String type;
    private final Map<String, String> params;
    private final List<SubTask> subTasks;

    public FsMapper(MapperContext context) {
        super(context.getName());
        this.type = context.getType();
        this.params = context.getParams();
        this.subTasks = parseOperations(context.getNode());
    }

    private List<SubTask> parseOperations(Element node) {
        List<Element> operations = XmlUtils.childElements(node);
        List<SubTask> result = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            Element operation = operations.get(i);
            result.add(new SubTask(name + "_fs_" + i, "hadoop fs " + toCommand(operation)));
        }
        return Collections.unmodifiableList(result);
    }

    private String toCommand(Element operation) {
        String operationName = XmlUtils.localName(operation);
        boolean recursive = XmlUtils.findChild(operation, "recursive").isPresent();
        switch (operationName) {
            case "mkdir":
                return "-mkdir " + quoted(operation, "path");
            case "delete": {
                String command = "-rm -r " + quoted(operation, "path");
                boolean skipTrash = XmlUtils.attribute(operation, "skip-trash")
                        .map(value -> !"false".equals(value))
                        .orElse(false);
                return skipTrash ? command + " -skipTrash" : command;
            }
            case "move":
                return "-mv " + quoted(operation, "source") + " " + quoted(operation, "target");
            case "chmod":
                return "-chmod " + (recursive ? "-R " : "")
                        + quoted(operation, "permissions") + " " + quoted(operation, "path");
            case "touchz":
                return "-touchz " + quoted(operation, "path");
            case "chgrp":
                return "-chgrp " + (recursive ? "-R " : "")
                        + quoted(operation, "group") + " " + quoted(operation, "path");
            case "setrep":
                return "-setrep " + quoted(operation, "replication-factor") + " " + quoted(operation, "path");
            default:
                throw new WorkflowStructureException(name, type,
                        String.format("未知的 fs 操作 <%s>", operationName));
        }
    }

    private String quoted(Element operation, String attribute) {
        String value = XmlUtils.attribute(operation, attribute)
                .orElseThrow(() -> new WorkflowStructureException(name, type,
                        String.format("fs 操作 <%s> 缺少属性 '%s'", XmlUtils.localName(operation), attribute)));
        return PythonLiterals.shellQuote(ElUtils.replaceElWithVar(value, params));
    }

    @Override
    public List<String> getTaskIds() {
        if (subTasks.isEmpty()) {
            return List.of(name);
        }
        List<String> taskIds = new ArrayList<>();
        for (SubTask subTask : subTasks) {
            taskIds.add(subTask.taskId);
        }
        return taskIds;
    }

    /**
     * @return 各单元的 shell 命令，按执行顺序
     */
    public List<String> getCommands() {
        List<String> commands = new ArrayList<>();
        for (SubTask subTask : subTasks) {
            commands.add(subTask.command);
        }
        return commands;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        if (subTasks.isEmpty()) {
            return DummyMapper.dummyTask(name, triggerRule);
        }
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < subTasks.size(); i++) {
            SubTask subTask = subTasks.get(i);
            // 只有第一个单元承接外部入边，其余单元只依赖前一个单元
            TriggerRule rule = (i == 0) ? triggerRule : TriggerRule.ALL_SUCCESS;
            text.append(subTask.taskId).append(" = bash_operator.BashOperator(\n")
                    .append(taskIdArg(subTask.taskId))
                    .append(triggerRuleArg(rule.getValue()))
                    .append("    bash_command=").append(PythonLiterals.quote(subTask.command)).append(",\n")
                    .append(")\n");
        }
        for (int i = 1; i < subTasks.size(); i++) {
            text.append(subTasks.get(i - 1).taskId).append(".set_downstream(")
                    .append(subTasks.get(i).taskId).append(")\n");
        }
        return text.toString();
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.operators import dummy_operator",
                "from airflow.operators import bash_operator");
    }

    private static final class SubTask {
        private final String taskId;
        private final String command;

        private SubTask(String taskId, String command) {
            this.taskId = taskId;
            this.command = command;
        }
    }
}
