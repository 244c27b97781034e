package org.csu.jfor.common.config;

import lombok.Getter;
import lombok.Setter;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * @description: 解释器运行参数
 *
 * jfor.trace   是否在 stderr 上打印各阶段的 [TRACE] 诊断信息，默认 false
 * jfor.charset 读取脚本文件时使用的字符集，默认 UTF-8
 */
@Getter
@Setter
public class JforConfig {
    public static final String TRACE_PROPERTY = "jfor.trace";
    public static final String CHARSET_PROPERTY = "jfor.charset";

    private boolean traceEnabled = false;
    private Charset sourceCharset = StandardCharsets.UTF_8;

    public static JforConfig defaults() {
        return new JforConfig();
    }

    public static JforConfig fromSystemProperties() {
        JforConfig config = new JforConfig();
        config.setTraceEnabled(Boolean.parseBoolean(System.getProperty(TRACE_PROPERTY, "false")));
        String charsetName = System.getProperty(CHARSET_PROPERTY);
        if (charsetName != null && !charsetName.isBlank()) {
            config.setSourceCharset(Charset.forName(charsetName.trim()));
        }
        return config;
    }

    /**
     * 开启 trace 时向 stderr 打印一行诊断信息。stdout 只留给 print 语句。
     */
    public void trace(String message) {
        if (traceEnabled) {
            System.err.println("[TRACE] " + message);
        }
    }
}
