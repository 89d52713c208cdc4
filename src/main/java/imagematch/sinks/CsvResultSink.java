package imagematch.sinks;

import imagematch.models.*;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.util.*;

/**
 * Writes results as CSV rows {@code filePath1,filePath2,similarity}. The header is written on
 * open and each row is flushed as soon as it is accepted, so rows found before a crash survive.
 */
public class CsvResultSink implements ResultSink {
    public static final List<String> HEADERS = List.of("filePath1", "filePath2", "similarity");

    private final BufferedWriter writer;

    public CsvResultSink(Path outputFile) throws IOException {
        this(Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8));
    }

    CsvResultSink(BufferedWriter writer) throws IOException {
        this.writer = writer;
        writeRow(HEADERS);
    }

    @Override
    public void accept(ComparisonResult result) throws IOException {
        writeRow(List.of(
                result.pathA().toString(),
                result.pathB().toString(),
                formatPercent(result.similarity())));
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    static String formatPercent(double similarity) {
        return String.format(Locale.ROOT, "%.2f%%", similarity);
    }

    private void writeRow(List<String> fields) throws IOException {
        StringJoiner row = new StringJoiner(",");
        for (String field : fields) row.add(escape(field));
        writer.write(row.toString());
        writer.newLine();
        writer.flush();
    }

    // RFC 4180 quoting: wrap fields holding a comma, quote or line break; double embedded quotes.
    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
