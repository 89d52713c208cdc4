package imagematch;

public final class ExitCode {
    public static final int OK = 0;
    public static final int NO_MATCH = 1;
    public static final int INVALID_INPUT = 2;
    public static final int IO_ERROR = 3;
    public static final int ERROR = 4;

    private ExitCode() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", ExitCode.class.getName()));
    }

}
