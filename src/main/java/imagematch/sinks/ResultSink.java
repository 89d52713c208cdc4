package imagematch.sinks;

import imagematch.models.*;

import java.io.*;

// Append-only destination for near-duplicate pairs.
public interface ResultSink extends Closeable {
    void accept(ComparisonResult result) throws IOException;
}
