package com.dicomweb.oauth.error;

public class ConfigurationException extends DicomWebOAuthException {

    public ConfigurationException(String message) {
        this(ErrorCode.CONFIG_INVALID_VALUE, null, message, null);
    }

    public ConfigurationException(ErrorCode errorCode, String serverName, String message) {
        this(errorCode, serverName, message, null);
    }

    public ConfigurationException(ErrorCode errorCode, String serverName, String message, Throwable cause) {
        super(errorCode, serverName, message, cause);
    }

    public static ConfigurationException unknownServer(String serverName) {
        return new ConfigurationException(ErrorCode.UNKNOWN_SERVER, serverName, "not configured");
    }

    public static ConfigurationException missing(String serverName, String key) {
        return new ConfigurationException(ErrorCode.CONFIG_MISSING_KEY, serverName, "missing required key '" + key + "'");
    }
}
