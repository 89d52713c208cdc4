package imagematch.exceptions;

/**
 * Thrown when two fingerprints produced by different algorithms, or with different bit
 * lengths, are compared.
 */
public class IncompatibleFingerprintException extends IllegalArgumentException {

    public IncompatibleFingerprintException(String message) {
        super(message);
    }

}
