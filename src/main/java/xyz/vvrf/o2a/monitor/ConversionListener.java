package xyz.vvrf.o2a.monitor;

import xyz.vvrf.o2a.core.ParsedNode;

import java.time.Duration;

/**
 * 用于监控工作流转换过程的监听器接口。
 * 包括转换级别和节点级别的事件。
 *
 * @author ruifeng.wen
 */
public interface ConversionListener {

    /**
     * 转换开始时调用。
     *
     * @param dagName        DAG 名称
     * @param inputDirectory 工作流输入目录 (只解析文档时为 null)
     */
    void onConversionStart(String dagName, String inputDirectory);

    /**
     * 解析器创建一个节点后调用。prepare 展开出的节点也会单独回调。
     *
     * @param dagName    DAG 名称
     * @param node       新创建的节点
     * @param sourceType 源文件中的类型标签 (控制节点种类或动作子类型)
     */
    void onNodeParsed(String dagName, ParsedNode node, String sourceType);

    /**
     * 转换成功完成时调用。
     *
     * @param dagName       DAG 名称
     * @param duration      总耗时
     * @param nodeCount     节点数
     * @param relationCount 关系数
     */
    void onConversionSuccess(String dagName, Duration duration, int nodeCount, int relationCount);

    /**
     * 转换失败时调用，之后异常会继续向上抛出。
     *
     * @param dagName  DAG 名称
     * @param duration 失败前的耗时
     * @param error    导致失败的错误
     */
    void onConversionFailure(String dagName, Duration duration, Throwable error);
}
