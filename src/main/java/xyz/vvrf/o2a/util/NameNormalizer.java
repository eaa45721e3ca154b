package xyz.vvrf.o2a.util;

import java.util.regex.Pattern;

/**
 * 节点名称规范化工具。
 * 生成的 Python 代码把节点名用作变量名，因此所有不合法字符 (例如 '-') 都被替换为 '_'。
 * 声明处 (name) 和所有引用处 (to / error / start) 必须使用同一个方法，否则边无法解析。
 *
 * @author ruifeng.wen
 */
public final class NameNormalizer {

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_]");
    private static final String REPLACEMENT = "_";

    private NameNormalizer() {}

    /**
     * @param rawName 源文件中的原始名称
     * @return 规范化后的名称；输入为 null 时返回 null
     */
    public static String normalize(String rawName) {
        if (rawName == null) {
            return null;
        }
        return DISALLOWED.matcher(rawName.trim()).replaceAll(REPLACEMENT);
    }
}
