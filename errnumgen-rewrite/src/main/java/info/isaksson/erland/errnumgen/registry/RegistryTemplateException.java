package info.isaksson.erland.errnumgen.registry;

/** Thrown when the registry template is missing or cannot be rendered. */
public class RegistryTemplateException extends RuntimeException {

    public RegistryTemplateException(String message) {
        super(message);
    }

    public RegistryTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
