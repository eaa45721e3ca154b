package xyz.vvrf.o2a.mapper;

import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.util.XmlUtils;

import java.util.Set;

/**
 * kill 节点：工作流以失败结束。只能经由 error 边到达，
 * 生成的任务只在上游失败时执行；message 仅作为诊断注释输出。
 *
 * @author ruifeng.wen
 */
public class KillMapper extends BaseMapper {

    private final String message;

    public KillMapper(String name, String message) {
        super(name);
        this.message = message == null ? "" : message;
    }

    public static KillMapper of(MapperContext context) {
        String message = XmlUtils.childText(context.getNode(), "message").orElse("");
        return new KillMapper(context.getName(), message);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        StringBuilder text = new StringBuilder();
        if (!message.isEmpty()) {
            // 注释中不能出现换行
            text.append("# Kill: ").append(message.replaceAll("\\s+", " ")).append('\n');
        }
        text.append(DummyMapper.dummyTask(name, triggerRule));
        return text.toString();
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.operators import dummy_operator");
    }
}
