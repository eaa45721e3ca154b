package xyz.vvrf.o2a.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.o2a.core.ParsedNode;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 把转换事件记录为 Micrometer 指标。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerConversionListener implements ConversionListener {

    // 指标名称
    public static final String METRIC_NODE_PARSED_TOTAL = "o2a.node.parsed.total";
    public static final String METRIC_CONVERSION_TIME = "o2a.conversion.time";

    // 标签键
    private static final String TAG_DAG_NAME = "dag.name";
    private static final String TAG_NODE_KIND = "node.kind";
    private static final String TAG_NODE_TYPE = "node.type";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;

    public MicrometerConversionListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onConversionStart(String dagName, String inputDirectory) {
        // 计时在结束事件中记录
    }

    @Override
    public void onNodeParsed(String dagName, ParsedNode node, String sourceType) {
        Tags tags = Tags.of(
                Tag.of(TAG_DAG_NAME, String.valueOf(dagName)),
                Tag.of(TAG_NODE_KIND, node.getKind().getTag()),
                Tag.of(TAG_NODE_TYPE, String.valueOf(sourceType))
        );
        try {
            Counter.builder(METRIC_NODE_PARSED_TOTAL)
                    .tags(tags)
                    .description("按种类统计的已解析节点数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onConversionSuccess(String dagName, Duration duration, int nodeCount, int relationCount) {
        recordTimer(Tags.of(Tag.of(TAG_DAG_NAME, String.valueOf(dagName)), Tag.of(TAG_STATUS, STATUS_SUCCESS)), duration);
    }

    @Override
    public void onConversionFailure(String dagName, Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        recordTimer(Tags.of(
                Tag.of(TAG_DAG_NAME, String.valueOf(dagName)),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTagValue)), duration);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer.builder(METRIC_CONVERSION_TIME)
                    .tags(tags)
                    .description("工作流转换耗时")
                    .register(meterRegistry)
                    .record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }
}
