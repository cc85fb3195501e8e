package work.lcod.register.api;

/**
 * A registry manifest could not be read or is not valid TOML.
 */
public final class ManifestException extends RuntimeException {
    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
