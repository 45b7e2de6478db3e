package io.jsonlogic.core.error;

/**
 * Thrown when engine configuration loading fails: missing file, invalid YAML, or an invalid
 * value. URN: {@code urn:jsonlogic:error:config-load-failed}
 */
public final class ConfigLoadException extends LogicLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:jsonlogic:error:config-load-failed";

    public ConfigLoadException(String message, String source) {
        super(message, null, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, null, source);
    }
}
