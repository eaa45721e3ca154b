package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.TriggerRule;

import java.util.Set;

/**
 * 生成空操作任务 (DummyOperator)。
 * 用于 start、end、fork、join 这些只影响控制流的节点，
 * 也作为无法识别的动作类型的兜底映射器：此时生成的片段带有占位说明注释。
 *
 * @author ruifeng.wen
 */
public class DummyMapper extends BaseMapper {

    private final String unsupportedType;

    public DummyMapper(String name) {
        this(name, null);
    }

    /**
     * @param name            节点名称
     * @param unsupportedType 被替代的动作类型；不为 null 时表示这是一个占位任务
     */
    public DummyMapper(String name, String unsupportedType) {
        super(name);
        this.unsupportedType = unsupportedType;
    }

    /** 控制节点的工厂方法 */
    public static DummyMapper of(MapperContext context) {
        return new DummyMapper(context.getName());
    }

    /** 未知动作类型的工厂方法 */
    public static DummyMapper placeholder(MapperContext context) {
        return new DummyMapper(context.getName(), context.getType());
    }

    public boolean isPlaceholder() {
        return unsupportedType != null;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        StringBuilder text = new StringBuilder();
        if (isPlaceholder()) {
            text.append("# Placeholder: action type '").append(unsupportedType)
                    .append("' is not supported by the converter and was replaced with a dummy task.\n");
        }
        return text.append(dummyTask(name, triggerRule)).toString();
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.operators import dummy_operator");
    }

    /**
     * 生成单个 DummyOperator 片段，供其他映射器在没有实际操作时复用。
     */
    static String dummyTask(String taskId, TriggerRule triggerRule) {
        return taskId + " = dummy_operator.DummyOperator(\n"
                + taskIdArg(taskId)
                + triggerRuleArg(triggerRule.getValue())
                + ")\n";
    }
}
