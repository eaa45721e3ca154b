package xyz.vvrf.o2a.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.core.ParsedNode;

import java.time.Duration;

/**
 * 把转换事件输出到日志。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingConversionListener implements ConversionListener {

    @Override
    public void onConversionStart(String dagName, String inputDirectory) {
        log.info("[MONITOR] DAG:[{}] 开始转换。 输入:[{}]", dagName, inputDirectory);
    }

    @Override
    public void onNodeParsed(String dagName, ParsedNode node, String sourceType) {
        log.debug("[MONITOR] DAG:[{}] 节点:[{}] 已解析。 种类:[{}], 类型:[{}], 映射器:[{}]",
                dagName, node.getName(), node.getKind(), sourceType, node.getMapper().getClass().getSimpleName());
    }

    @Override
    public void onConversionSuccess(String dagName, Duration duration, int nodeCount, int relationCount) {
        log.info("[MONITOR] DAG:[{}] 转换成功。 耗时:[{}ms], 节点数:[{}], 关系数:[{}]",
                dagName, duration.toMillis(), nodeCount, relationCount);
    }

    @Override
    public void onConversionFailure(String dagName, Duration duration, Throwable error) {
        log.error("[MONITOR] DAG:[{}] 转换失败。 耗时:[{}ms], 错误:[{}]",
                dagName, duration.toMillis(), error.getMessage());
    }
}
