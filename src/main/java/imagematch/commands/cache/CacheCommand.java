package imagematch.commands.cache;

import picocli.CommandLine.*;

@Command(
        name = "cache",
        description = "Fingerprint cache tools: inspect and prune cache files",
        subcommands = {
            CacheSummarySubCommand.class,
            CacheCleanSubCommand.class,
        },
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true
)
public class CacheCommand implements Runnable {
    @Spec
    Model.CommandSpec spec;
    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
