package xyz.vvrf.o2a.core;

import java.util.Arrays;
import java.util.Optional;

/**
 * 工作流控制流节点的种类。
 * 与 workflow.xml 中根级标签一一对应，{@link #PREPARE} 除外：
 * 它是带 prepare 块的动作节点展开出来的前置节点，源文件中没有对应标签。
 *
 * @author ruifeng.wen
 */
public enum NodeKind {
    START("start"),
    ACTION("action"),
    KILL("kill"),
    END("end"),
    FORK("fork"),
    JOIN("join"),
    DECISION("decision"),
    PREPARE("prepare");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * @return 源文件中的标签名 (同时也是控制节点注册表中的 key)
     */
    public String getTag() {
        return tag;
    }

    /**
     * 根据根级标签名查找节点种类。PREPARE 不会被匹配。
     *
     * @param tag 去掉命名空间后的标签名
     * @return 节点种类；未知标签返回空
     */
    public static Optional<NodeKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind != PREPARE)
                .filter(kind -> kind.tag.equals(tag))
                .findFirst();
    }
}
