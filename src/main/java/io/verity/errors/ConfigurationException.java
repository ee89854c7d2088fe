package io.verity.errors;

/**
 * Invalid engine input that the caller has to fix: a scenario catalog with a
 * cycle, an unknown item or feature id, checks missing at a requested depth.
 */
public final class ConfigurationException extends VerityException {
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION_GAP, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION_GAP, message, cause);
    }
}
