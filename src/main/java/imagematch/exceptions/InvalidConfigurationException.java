package imagematch.exceptions;

/**
 * Thrown when a run is configured with values that cannot be acted on, such as a threshold
 * outside [0,100] or a missing input path. Raised before any work starts.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

}
