package imagematch.models;

// Outcome of hashing one file: a fingerprint, no fingerprint (not an image / undecodable), or an error.
public record HashResult(
        FileIdentity identity,
        Fingerprint fingerprint,
        Throwable error
) {

    public static HashResult hashed(FileIdentity identity, Fingerprint fingerprint) {
        return new HashResult(identity, fingerprint, null);
    }

    public static HashResult noHash(FileIdentity identity) {
        return new HashResult(identity, null, null);
    }

    public static HashResult failed(FileIdentity identity, Throwable error) {
        return new HashResult(identity, null, error);
    }

    public boolean isHashed() {
        return fingerprint != null;
    }

    public boolean isFailed() {
        return error != null;
    }
}
