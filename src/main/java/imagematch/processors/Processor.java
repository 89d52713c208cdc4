package imagematch.processors;

import java.io.*;

public interface Processor {
    /** Runs to completion and returns the process exit code. */
    int run() throws IOException;
}
