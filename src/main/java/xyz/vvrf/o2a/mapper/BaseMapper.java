package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.ActionMapper;
import xyz.vvrf.o2a.util.PythonLiterals;

import java.util.Objects;

/**
 * 所有映射器的基类，只持有节点名称并提供生成 Airflow 算子的公共片段。
 *
 * @author ruifeng.wen
 */
public abstract class BaseMapper implements ActionMapper {

    protected final String name;

    protected BaseMapper(String name) {
        this.name = Objects.requireNonNull(name, "节点名称不能为空");
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * 生成 {@code task_id='x',} 这一行 (含 4 空格缩进和结尾换行)。
     */
    protected static String taskIdArg(String taskId) {
        return "    task_id=" + PythonLiterals.quote(taskId) + ",\n";
    }

    /**
     * 生成 {@code trigger_rule='x',} 这一行 (含 4 空格缩进和结尾换行)。
     */
    protected static String triggerRuleArg(String triggerRule) {
        return "    trigger_rule=" + PythonLiterals.quote(triggerRule) + ",\n";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
