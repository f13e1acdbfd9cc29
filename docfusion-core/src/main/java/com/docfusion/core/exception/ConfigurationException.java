package com.docfusion.core.exception;

/**
 * Fatal configuration problem detected before any translation runs.
 *
 * <p>Raised for malformed extension-point cardinality (a single-valued point with zero or
 * several implementations), an empty platform set, duplicate platforms, a cycle among plugin
 * ordering declarations, and unreadable configuration files.
 */
public class ConfigurationException extends DocFusionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
