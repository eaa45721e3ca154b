package xyz.vvrf.o2a.util;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 生成 Python 字面量和 shell 参数的工具方法。
 *
 * @author ruifeng.wen
 */
public final class PythonLiterals {

    private static final Pattern SHELL_SAFE = Pattern.compile("[\\w@%+=:,./-]+");

    private PythonLiterals() {}

    /**
     * 生成单引号 Python 字符串字面量。
     *
     * @param value 原始字符串 (null 生成 None)
     * @return Python 字面量
     */
    public static String quote(String value) {
        if (value == null) {
            return "None";
        }
        StringBuilder builder = new StringBuilder("'");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\':
                    builder.append("\\\\");
                    break;
                case '\'':
                    builder.append("\\'");
                    break;
                case '\n':
                    builder.append("\\n");
                    break;
                case '\r':
                    builder.append("\\r");
                    break;
                case '\t':
                    builder.append("\\t");
                    break;
                default:
                    builder.append(c);
            }
        }
        return builder.append('\'').toString();
    }

    /**
     * @param values 字符串集合
     * @return Python 列表字面量，例如 {@code ['a', 'b']}
     */
    public static String list(Collection<String> values) {
        return values.stream().map(PythonLiterals::quote).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * @param values 字符串映射 (按迭代顺序输出)
     * @return Python 字典字面量，例如 {@code {'k': 'v'}}
     */
    public static String dict(Map<String, String> values) {
        return values.entrySet().stream()
                .map(entry -> quote(entry.getKey()) + ": " + quote(entry.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    /**
     * 与 Python 的 shlex.quote 行为一致：安全字符串原样返回，否则用单引号包裹。
     *
     * @param value shell 参数
     * @return 可安全拼入 shell 命令的参数
     */
    public static String shellQuote(String value) {
        if (value == null || value.isEmpty()) {
            return "''";
        }
        if (SHELL_SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    /**
     * 给多行文本的每个非空行加上缩进。
     *
     * @param text   文本
     * @param spaces 缩进空格数
     * @return 缩进后的文本
     */
    public static String indent(String text, int spaces) {
        String prefix = " ".repeat(spaces);
        return text.lines()
                .map(line -> line.isBlank() ? line : prefix + line)
                .collect(Collectors.joining("\n", "", text.endsWith("\n") ? "\n" : ""));
    }
}
