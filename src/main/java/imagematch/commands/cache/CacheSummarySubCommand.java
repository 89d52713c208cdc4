package imagematch.commands.cache;

import imagematch.processors.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;

@Command(
    name = "summary",
    description = "Summarize one or more fingerprint cache files.",
    mixinStandardHelpOptions = true
)
public class CacheSummarySubCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FILES", description = "Cache file(s) to summarize")
    private List<File> cacheFiles;

    @Override
    public Integer call() {
        return new CacheSummaryProcessor(cacheFiles).run();
    }

}
