package xyz.vvrf.o2a.converter;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * 单次转换的输入参数。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public class ConversionRequest {

    /** 工作流文件名 */
    public static final String WORKFLOW_FILE = "workflow.xml";
    public static final String JOB_PROPERTIES_FILE = "job.properties";
    public static final String CONFIGURATION_PROPERTIES_FILE = "configuration.properties";

    /** 生成的 DAG 名称，同时也是输出文件名 (不含 .py) */
    private final String dagName;

    /** 包含 workflow.xml 的输入目录 */
    private final Path inputDirectory;

    /** 输出目录，转换成功后会被重建 */
    private final Path outputDirectory;

    /** 替换 ${user.name} 的用户名 */
    private final String user;

    /** DAG 起始日期：距今天数 */
    @Builder.Default
    private final int startDaysAgo = 0;

    /** DAG 调度间隔天数，0 表示不定时调度 */
    @Builder.Default
    private final int scheduleInterval = 0;
}
