package xyz.vvrf.o2a.el;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 工作流表达式语言 (EL) 的替换工具。
 * 只处理 {@code ${name}} 形式的属性引用：已知属性直接替换为值，
 * 未知的简单属性引用转换为运行期由 Airflow 渲染的 Jinja 模板，
 * 其余表达式 (函数调用、运算) 原样保留。
 * <p>
 * 映射器在构造时对每段原始文本只调用一次 {@link #replaceElWithVar(String, Map)}，
 * 不会对已经替换过的文本再次替换。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class ElUtils {

    private static final Pattern EL_PATTERN = Pattern.compile("\\$\\{([^}]*)}");
    private static final Pattern SIMPLE_PROPERTY = Pattern.compile("[A-Za-z_][\\w.\\-]*");

    private ElUtils() {}

    /**
     * 替换文本中的 EL 属性引用。
     *
     * @param text   原始文本 (可为 null)
     * @param params 当前参数映射 (不能为空)
     * @return 替换后的文本；输入为 null 时返回 null
     */
    public static String replaceElWithVar(String text, Map<String, String> params) {
        Objects.requireNonNull(params, "参数映射不能为空");
        return substitute(text, params::get);
    }

    /**
     * @param lookup 属性名 -> 值，未知属性返回 null
     */
    private static String substitute(String text, Function<String, String> lookup) {
        if (text == null || text.indexOf("${") < 0) {
            return text;
        }
        Matcher matcher = EL_PATTERN.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String expression = matcher.group(1).trim();
            String value = lookup.apply(expression);
            String replacement;
            if (value != null) {
                replacement = value;
            } else if (SIMPLE_PROPERTY.matcher(expression).matches()) {
                replacement = "{{ params['" + expression + "'] }}";
            } else {
                log.debug("EL 表达式 '{}' 不是属性引用，保持原样", expression);
                replacement = matcher.group(0);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * 读取属性文件 (job.properties / configuration.properties)，对每个值做 EL 替换后合并到参数中。
     * 文件中的属性会覆盖同名的已有参数。文件不存在时原样返回参数的副本。
     *
     * @param propertiesFile 属性文件路径 (不能为空)
     * @param params         已有参数 (不能为空)
     * @return 合并后的新参数映射
     * @throws UncheckedIOException 如果文件存在但读取失败
     */
    public static Map<String, String> loadProperties(Path propertiesFile, Map<String, String> params) {
        Objects.requireNonNull(propertiesFile, "属性文件路径不能为空");
        Objects.requireNonNull(params, "参数映射不能为空");

        Map<String, String> merged = new LinkedHashMap<>(params);
        if (!Files.isRegularFile(propertiesFile)) {
            log.debug("属性文件 {} 不存在，跳过", propertiesFile);
            return merged;
        }

        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("读取属性文件失败: " + propertiesFile, e);
        }

        // Properties 无序，按 key 排序保证日志和结果顺序稳定
        Map<String, String> raw = new LinkedHashMap<>();
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            raw.put(key, properties.getProperty(key));
        }
        PropertyResolver resolver = new PropertyResolver(raw, params);
        for (String key : raw.keySet()) {
            merged.put(key, resolver.resolve(key));
        }
        log.info("已从 {} 读取 {} 个属性", propertiesFile, properties.size());
        return merged;
    }

    /**
     * 按需递归解析同一文件中的属性引用，结果与 key 的处理顺序无关。
     * 文件中的属性优先于已有参数；循环引用保持 {@code ${name}} 原样并记录警告。
     */
    private static final class PropertyResolver {

        private final Map<String, String> raw;
        private final Map<String, String> params;
        private final Map<String, String> resolved = new HashMap<>();
        private final Set<String> resolving = new HashSet<>();

        private PropertyResolver(Map<String, String> raw, Map<String, String> params) {
            this.raw = raw;
            this.params = params;
        }

        private String resolve(String key) {
            String cached = resolved.get(key);
            if (cached != null) {
                return cached;
            }
            resolving.add(key);
            String value = substitute(raw.get(key), this::lookup);
            resolving.remove(key);
            resolved.put(key, value);
            return value;
        }

        private String lookup(String name) {
            if (!raw.containsKey(name)) {
                return params.get(name);
            }
            if (resolving.contains(name)) {
                log.warn("属性 '{}' 存在循环引用，保持原样", name);
                return "${" + name + "}";
            }
            return resolve(name);
        }
    }
}
