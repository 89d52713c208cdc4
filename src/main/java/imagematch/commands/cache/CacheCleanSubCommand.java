package imagematch.commands.cache;

import imagematch.processors.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;

@Command(
        name = "clean",
        description = "Remove cache entries whose file is missing or whose size or timestamp changed",
        mixinStandardHelpOptions = true
)
public class CacheCleanSubCommand implements Callable<Integer> {

    @Parameters(index = "0..*", arity = "1..*",
            paramLabel = "FILES...",
            description = "One or more cache files to clean")
    private List<File> cacheFiles;

    @Option(names = {"--no-dryrun"},
            description = "Rewrite the cache files instead of only reporting what would be removed")
    private boolean noDryRun;

    @Option(names = {"--verbose"}, negatable = true, defaultValue = "false",
            description = "Log each entry kept or removed (default: false)")
    private boolean verbose;

    @Override
    public Integer call() throws IOException {
        return new CacheCleanProcessor(cacheFiles, !noDryRun, verbose).run();
    }
}
