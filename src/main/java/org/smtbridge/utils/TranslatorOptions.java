package org.smtbridge.utils;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * 类型翻译层的配置项。
 * 默认值来自 classpath 上的 {@value #RESOURCE_NAME}，JVM 系统属性可覆盖同名键。
 * 此类是不可变的，with* 方法返回新的实例。
 * @author Ayalyt
 */
@Getter
public final class TranslatorOptions {

    private static final Logger logger = LoggerFactory.getLogger(TranslatorOptions.class);

    public static final String RESOURCE_NAME = "smtbridge.properties";

    public static final String KEY_MAX_DEPTH = "smtbridge.sort.max-depth";
    public static final String KEY_SSA_SEPARATOR = "smtbridge.ssa.separator";
    public static final String KEY_LOG_ASSERTIONS = "smtbridge.solver.log-assertions";

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final String DEFAULT_SSA_SEPARATOR = "_";

    private static final TranslatorOptions DEFAULTS =
            new TranslatorOptions(DEFAULT_MAX_DEPTH, DEFAULT_SSA_SEPARATOR, false);

    // 类型嵌套（映射值类型、函数参数/返回类型）的最大递归深度
    private final int maxNestingDepth;
    // SSA 版本名的分隔符：name + separator + index
    private final String ssaSeparator;
    // 为 true 时每条断言都以 info 级别记录
    private final boolean logAssertions;

    private TranslatorOptions(int maxNestingDepth, String ssaSeparator, boolean logAssertions) {
        Contracts.require(maxNestingDepth > 0, "TranslatorOptions: {} 必须为正数，实际为 {}", KEY_MAX_DEPTH, maxNestingDepth);
        Contracts.require(StringUtils.isNotEmpty(ssaSeparator) && !StringUtils.containsWhitespace(ssaSeparator),
                "TranslatorOptions: {} 不能为空或包含空白，实际为 '{}'", KEY_SSA_SEPARATOR, ssaSeparator);
        this.maxNestingDepth = maxNestingDepth;
        this.ssaSeparator = ssaSeparator;
        this.logAssertions = logAssertions;
    }

    /**
     * 内置默认值，不读取任何外部配置。
     */
    public static TranslatorOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 读取 classpath 资源 {@value #RESOURCE_NAME}，再叠加 JVM 系统属性。
     * 资源不存在时使用内置默认值。
     */
    public static TranslatorOptions load() {
        Properties properties = new Properties();
        try (InputStream in = TranslatorOptions.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
                logger.debug("从 {} 读取了 {} 个配置项", RESOURCE_NAME, properties.size());
            } else {
                logger.debug("classpath 上没有 {}，使用默认配置", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("读取 " + RESOURCE_NAME + " 失败", e);
        }
        for (String key : new String[]{KEY_MAX_DEPTH, KEY_SSA_SEPARATOR, KEY_LOG_ASSERTIONS}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    /**
     * 从给定的属性集合构造配置，缺失的键取默认值。
     * @throws ContractViolationException 如果某个值无法解析或越界。
     */
    public static TranslatorOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "TranslatorOptions-fromProperties: properties 不能为 null");
        int maxDepth = parseInt(properties.getProperty(KEY_MAX_DEPTH), DEFAULT_MAX_DEPTH);
        String separator = StringUtils.defaultIfBlank(properties.getProperty(KEY_SSA_SEPARATOR), DEFAULT_SSA_SEPARATOR).trim();
        boolean logAssertions = parseBoolean(properties.getProperty(KEY_LOG_ASSERTIONS));
        TranslatorOptions options = new TranslatorOptions(maxDepth, separator, logAssertions);
        logger.info("类型翻译配置: {}", options);
        return options;
    }

    public TranslatorOptions withMaxNestingDepth(int maxNestingDepth) {
        return new TranslatorOptions(maxNestingDepth, ssaSeparator, logAssertions);
    }

    public TranslatorOptions withSsaSeparator(String ssaSeparator) {
        return new TranslatorOptions(maxNestingDepth, ssaSeparator, logAssertions);
    }

    public TranslatorOptions withLogAssertions(boolean logAssertions) {
        return new TranslatorOptions(maxNestingDepth, ssaSeparator, logAssertions);
    }

    private static int parseInt(String raw, int fallback) {
        if (StringUtils.isBlank(raw)) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ContractViolationException("TranslatorOptions: " + KEY_MAX_DEPTH + " 不是整数: " + raw, e);
        }
    }

    private static boolean parseBoolean(String raw) {
        if (StringUtils.isBlank(raw)) {
            return false;
        }
        String value = raw.trim();
        Contracts.require("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value),
                "TranslatorOptions: {} 只能是 true 或 false，实际为 '{}'", KEY_LOG_ASSERTIONS, value);
        return Boolean.parseBoolean(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TranslatorOptions that = (TranslatorOptions) o;
        return maxNestingDepth == that.maxNestingDepth
                && logAssertions == that.logAssertions
                && ssaSeparator.equals(that.ssaSeparator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxNestingDepth, ssaSeparator, logAssertions);
    }

    @Override
    public String toString() {
        return "TranslatorOptions{maxNestingDepth=" + maxNestingDepth
                + ", ssaSeparator='" + ssaSeparator + "'"
                + ", logAssertions=" + logAssertions + "}";
    }
}
