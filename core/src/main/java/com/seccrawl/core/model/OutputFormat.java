package com.seccrawl.core.model;

import com.seccrawl.core.error.ConfigurationException;

import java.util.Locale;

/** ResultSink 출력 형식. 확장자 추론 대신 명시 enum으로 분기한다. */
public enum OutputFormat {
    JSON("json"),
    CSV("csv");

    private final String extension;

    OutputFormat(String extension) { this.extension = extension; }

    public String extension() { return extension; }

    /** 대소문자 무시. 지원하지 않는 값이면 ConfigurationException. */
    public static OutputFormat parse(String name) {
        if (name != null) {
            String s = name.trim().toUpperCase(Locale.ROOT);
            for (OutputFormat f : values()) {
                if (f.name().equals(s)) return f;
            }
        }
        throw new ConfigurationException("Unsupported output format: " + name + " (json or csv)");
    }
}
