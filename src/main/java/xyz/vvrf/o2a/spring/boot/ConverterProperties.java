package xyz.vvrf.o2a.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;

/**
 * 转换器的配置属性类，绑定 'o2a' 前缀下的属性。
 * 命令行入口不启动 Spring，直接使用这里的默认值。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "o2a")
@Validated
public class ConverterProperties {

    @Valid
    private final Parser parser = new Parser();
    @Valid
    private final Dag dag = new Dag();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Parser {
        /**
         * decision 节点是否必须恰好有一个 default 分支。
         * 关闭后 switch 中任何带 to 属性的元素都被当作分支，并记录警告。
         */
        private boolean strictDecisionDefault = true;
    }

    @Getter
    @Setter
    public static class Dag {
        /**
         * DAG 起始日期：距今天数。
         */
        @Min(0)
        private int startDaysAgo = 0;

        /**
         * 调度间隔天数，0 表示不定时调度。
         */
        @Min(0)
        private int scheduleInterval = 0;

        /**
         * 替换 ${user.name} 的用户名，为空时使用当前系统用户。
         */
        private String user;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册输出转换日志的监听器。
         */
        private boolean loggingEnabled = true;
    }

    @Override
    public String toString() {
        return "ConverterProperties{" +
                "parser={strictDecisionDefault=" + parser.strictDecisionDefault +
                "}, dag={startDaysAgo=" + dag.startDaysAgo +
                ", scheduleInterval=" + dag.scheduleInterval +
                ", user='" + dag.user + '\'' +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
