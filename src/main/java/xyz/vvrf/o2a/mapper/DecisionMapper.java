package xyz.vvrf.o2a.mapper;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;
import xyz.vvrf.o2a.core.MapperContext;
import xyz.vvrf.o2a.core.TriggerRule;
import xyz.vvrf.o2a.core.WorkflowStructureException;
import xyz.vvrf.o2a.util.NameNormalizer;
import xyz.vvrf.o2a.util.PythonLiterals;
import xyz.vvrf.o2a.util.XmlUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * decision 节点：生成 BranchPythonOperator。
 * 各 case 的谓词按声明顺序在运行期用 DAG 的模板环境渲染，第一个结果为 true 的分支被选中；
 * 都不成立时走 default 分支。谓词本身对转换器是不透明字符串。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DecisionMapper extends BaseMapper {

    static final String CALLABLE_SUFFIX = "_decision";

    private final List<Branch> cases;
    private final String defaultTarget;
    private final Function<String, String> taskIdResolver;

    public DecisionMapper(String name, List<Branch> cases, String defaultTarget,
                          Function<String, String> taskIdResolver) {
        super(name);
        this.cases = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(cases, "分支列表不能为空")));
        this.defaultTarget = defaultTarget;
        this.taskIdResolver = Objects.requireNonNull(taskIdResolver, "任务 ID 解析函数不能为空");
    }

    public static DecisionMapper of(MapperContext context) {
        Element switchElement = XmlUtils.findChild(context.getNode(), "switch")
                .orElseThrow(() -> new WorkflowStructureException(context.getName(), context.getType(),
                        "缺少 <switch> 元素"));
        List<Branch> cases = new ArrayList<>();
        String defaultTarget = null;
        String fallbackTarget = null;
        for (Element child : XmlUtils.childElements(switchElement)) {
            String target = XmlUtils.attribute(child, "to").map(NameNormalizer::normalize).orElse(null);
            if (target == null) {
                continue;
            }
            String tag = XmlUtils.localName(child);
            if ("case".equals(tag)) {
                cases.add(new Branch(child.getTextContent().trim(), target));
            } else if ("default".equals(tag)) {
                if (defaultTarget == null) {
                    defaultTarget = target;
                }
            } else {
                fallbackTarget = target;
            }
        }
        if (defaultTarget == null && fallbackTarget != null) {
            log.debug("decision '{}': 没有 <default>，使用最后一个非 case 分支 '{}'", context.getName(), fallbackTarget);
            defaultTarget = fallbackTarget;
        }
        return new DecisionMapper(context.getName(), cases, defaultTarget, context.getTaskIdResolver());
    }

    public List<Branch> getCases() {
        return cases;
    }

    public String getDefaultTarget() {
        return defaultTarget;
    }

    String getCallableName() {
        return name + CALLABLE_SUFFIX;
    }

    @Override
    public Set<String> getGeneratedIdentifiers() {
        Set<String> identifiers = new LinkedHashSet<>(getTaskIds());
        identifiers.add(getCallableName());
        return identifiers;
    }

    @Override
    public String convertToText(TriggerRule triggerRule) {
        String callable = getCallableName();
        StringBuilder text = new StringBuilder();
        text.append("def ").append(callable).append("(**context):\n")
                .append("    env = context['dag'].get_template_env()\n");
        for (Branch branch : cases) {
            text.append("    if env.from_string(").append(PythonLiterals.quote(toTemplate(branch.getPredicate())))
                    .append(").render(**context) == 'True':\n")
                    .append("        return ").append(PythonLiterals.quote(taskIdResolver.apply(branch.getTarget())))
                    .append('\n');
        }
        String fallback = defaultTarget == null ? "None" : PythonLiterals.quote(taskIdResolver.apply(defaultTarget));
        text.append("    return ").append(fallback).append("\n\n\n");

        text.append(name).append(" = python_operator.BranchPythonOperator(\n")
                .append(taskIdArg(name))
                .append(triggerRuleArg(triggerRule.getValue()))
                .append("    python_callable=").append(callable).append(",\n")
                .append("    provide_context=True,\n")
                .append(")\n");
        return text.toString();
    }

    /**
     * 把 {@code ${expr}} 形式的谓词改写成 Jinja 表达式 {@code {{ expr }}}。
     */
    static String toTemplate(String predicate) {
        String trimmed = predicate.trim();
        if (trimmed.startsWith("${") && trimmed.endsWith("}")) {
            return "{{ " + trimmed.substring(2, trimmed.length() - 1).trim() + " }}";
        }
        return trimmed;
    }

    @Override
    public Set<String> requiredImports() {
        return Set.of("from airflow.operators import python_operator");
    }

    /**
     * 一个条件分支：谓词 -> 目标节点名称。
     */
    public static final class Branch {
        private final String predicate;
        private final String target;

        public Branch(String predicate, String target) {
            this.predicate = Objects.requireNonNull(predicate, "谓词不能为空");
            this.target = Objects.requireNonNull(target, "分支目标不能为空");
        }

        public String getPredicate() {
            return predicate;
        }

        public String getTarget() {
            return target;
        }

        @Override
        public String toString() {
            return predicate + " -> " + target;
        }
    }
}
