package xyz.vvrf.o2a.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import xyz.vvrf.o2a.converter.ConversionRequest;
import xyz.vvrf.o2a.converter.ConversionResult;
import xyz.vvrf.o2a.converter.OozieConverterFactory;
import xyz.vvrf.o2a.monitor.LoggingConversionListener;
import xyz.vvrf.o2a.registry.DefaultMapperRegistries;
import xyz.vvrf.o2a.spring.boot.ConverterProperties;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 命令行入口：把一个 Oozie 工作流目录转换为 Airflow DAG 文件。
 * 不启动 Spring，直接使用内置注册表和 {@link ConverterProperties} 的默认值。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class O2aCommandLine {

    static final String CMD_SYNTAX = "o2a -i <input-directory> -o <output-directory> [options]";

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private final OozieConverterFactory converterFactory;

    public O2aCommandLine() {
        this(new OozieConverterFactory(new ConverterProperties(),
                DefaultMapperRegistries.controlRegistry(),
                DefaultMapperRegistries.actionRegistry(),
                List.of(new LoggingConversionListener()),
                new ObjectMapper()));
    }

    O2aCommandLine(OozieConverterFactory converterFactory) {
        this.converterFactory = converterFactory;
    }

    public static void main(String[] args) {
        System.exit(new O2aCommandLine().run(args));
    }

    /**
     * @param args 命令行参数
     * @return 进程退出码
     */
    public int run(String[] args) {
        Options options = declareOptions();
        CommandLine cmdLine;
        try {
            cmdLine = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            System.err.println(usage(options));
            return EXIT_USAGE;
        }

        ConversionRequest request;
        try {
            request = toRequest(cmdLine);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        }

        try {
            ConversionResult result = converterFactory.create(request).convert();
            System.out.println("已生成 " + result.getOutputFile());
            return EXIT_OK;
        } catch (IllegalStateException | IllegalArgumentException | UncheckedIOException e) {
            log.debug("转换失败", e);
            System.err.println("转换失败: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    ConversionRequest toRequest(CommandLine cmdLine) {
        Path input = Paths.get(cmdLine.getOptionValue("i"));
        Path output = Paths.get(cmdLine.getOptionValue("o"));
        String dagName = cmdLine.getOptionValue("d");
        if (dagName == null || dagName.isBlank()) {
            Path fileName = input.toAbsolutePath().normalize().getFileName();
            dagName = fileName == null ? "dag" : fileName.toString();
        }

        ConversionRequest.ConversionRequestBuilder builder = converterFactory.requestBuilder()
                .dagName(dagName)
                .inputDirectory(input)
                .outputDirectory(output);
        if (cmdLine.hasOption("u")) {
            builder.user(cmdLine.getOptionValue("u"));
        }
        if (cmdLine.hasOption("s")) {
            builder.startDaysAgo(nonNegative(cmdLine.getOptionValue("s"), "start-days-ago"));
        }
        if (cmdLine.hasOption("v")) {
            builder.scheduleInterval(nonNegative(cmdLine.getOptionValue("v"), "schedule-interval"));
        }
        return builder.build();
    }

    private static int nonNegative(String value, String optionName) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException(String.format("--%s 不能为负数: %s", optionName, value));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("--%s 必须是整数: %s", optionName, value), e);
        }
    }

    static Options declareOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i").longOpt("input-directory-path").hasArg().argName("dir")
                .required().desc("Oozie 工作流目录 (包含 workflow.xml)").build());
        options.addOption(Option.builder("o").longOpt("output-directory-path").hasArg().argName("dir")
                .required().desc("输出目录，转换成功后会被重建").build());
        options.addOption(Option.builder("d").longOpt("dag-name").hasArg().argName("name")
                .desc("DAG 名称 [默认为输入目录名]").build());
        options.addOption(Option.builder("u").longOpt("user").hasArg().argName("user")
                .desc("替换 ${user.name} 的用户名 [默认为当前用户]").build());
        options.addOption(Option.builder("s").longOpt("start-days-ago").hasArg().argName("days")
                .desc("DAG 起始日期：距今天数 [默认 0]").build());
        options.addOption(Option.builder("v").longOpt("schedule-interval").hasArg().argName("days")
                .desc("DAG 调度间隔天数 [默认 0，不定时调度]").build());
        return options;
    }

    static String usage(Options options) {
        StringWriter out = new StringWriter();
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, CMD_SYNTAX,
                "将 Oozie 工作流转换为 Airflow DAG", options, HelpFormatter.DEFAULT_LEFT_PAD,
                HelpFormatter.DEFAULT_DESC_PAD, "");
        writer.flush();
        return out.toString();
    }
}
