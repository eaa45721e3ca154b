package xyz.vvrf.o2a.core;

/**
 * 支持 {@code <prepare>} 块的映射器能力。
 * 声明了 prepare 步骤的动作节点会被解析器展开成两个节点：
 * {@code <name>_prepare} 在前，原节点在后。
 *
 * @author ruifeng.wen
 */
public interface PrepareCapable {

    /** prepare 节点名称的后缀 */
    String PREPARE_SUFFIX = "_prepare";

    /**
     * @return 源节点中是否存在非空的 prepare 块
     */
    boolean hasPrepare();

    /**
     * @return prepare 块对应的 shell 命令；没有 prepare 块时为空字符串
     */
    String getPrepareCommand();

    /**
     * @param nodeName 动作节点名称
     * @return 展开出的 prepare 节点名称
     */
    static String prepareNameOf(String nodeName) {
        return nodeName + PREPARE_SUFFIX;
    }
}
