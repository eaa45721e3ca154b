package xyz.vvrf.o2a.core;

/**
 * 工作流结构错误：缺少必需的边、悬空引用、重复的节点名称、映射器缺少所需能力等。
 * 这类错误不可恢复，会中止整个转换，且不会产生任何输出。
 *
 * @author ruifeng.wen
 */
public class WorkflowStructureException extends IllegalStateException {

    private final String nodeName;
    private final String nodeType;

    /**
     * @param nodeName 出错节点的名称 (开始节点等无名节点可为 null)
     * @param nodeType 出错节点的类型标签 (例如 action、map-reduce)
     * @param message  错误描述
     */
    public WorkflowStructureException(String nodeName, String nodeType, String message) {
        super(String.format("节点 '%s' (类型: %s): %s", nodeName, nodeType, message));
        this.nodeName = nodeName;
        this.nodeType = nodeType;
    }

    public WorkflowStructureException(String nodeName, String nodeType, String message, Throwable cause) {
        super(String.format("节点 '%s' (类型: %s): %s", nodeName, nodeType, message), cause);
        this.nodeName = nodeName;
        this.nodeType = nodeType;
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getNodeType() {
        return nodeType;
    }
}
