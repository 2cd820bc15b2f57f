package io.powledger.core.chainio;

import java.util.Locale;

public enum ChainFormat {
    JSON("application/json", "json"),
    YAML("application/x-yaml", "yaml"),
    TXT("text/plain", "txt");

    private final String contentType;
    private final String extension;

    ChainFormat(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String contentType() { return contentType; }
    public String extension() { return extension; }

    /** Case-insensitive lookup by name or extension ("yml" is accepted for YAML). */
    public static ChainFormat fromName(String name) {
        if (name == null || name.isBlank()) return JSON;
        String n = name.trim().toLowerCase(Locale.ROOT);
        if (n.equals("yml")) return YAML;
        for (ChainFormat f : values()) {
            if (f.extension.equals(n)) return f;
        }
        throw new IllegalArgumentException("Unknown chain format: " + name);
    }
}
