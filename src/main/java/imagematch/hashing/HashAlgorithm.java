package imagematch.hashing;

// Selectable fingerprint algorithms. The chosen algorithm and size are fixed for a run.
public enum HashAlgorithm {
    AHASH {
        @Override
        public HashComputer create(int size) {
            return new AverageHashComputer(size);
        }
    },
    PHASH {
        @Override
        public HashComputer create(int size) {
            return new PerceptionHashComputer(size);
        }
    };

    public static final int DEFAULT_SIZE = 8;

    public abstract HashComputer create(int size);
}
