package imagematch;

import imagematch.commands.*;
import imagematch.commands.cache.*;
import imagematch.exceptions.*;
import imagematch.utils.*;
import picocli.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.concurrent.*;

@Command(
    name = "imagematch",
    description = "Finds visually similar images using cached perceptual fingerprints.",
    mixinStandardHelpOptions = true,
    versionProvider = ManifestVersionProvider.class,
    subcommands = {
        DedupCommand.class,
        FindCommand.class,
        CacheCommand.class,
    }
)
public class MainCli implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return ExitCode.OK;
    }

    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new MainCli());
        cli.setExecutionExceptionHandler(new ShortErrorHandler());
        cli.setCaseInsensitiveEnumValuesAllowed(true);
        cli.setUsageHelpAutoWidth(true);
        return cli;
    }

    public static void main(String[] args) {
        CommandLine cli = commandLine();
        cli.setColorScheme(Help.defaultColorScheme(Help.Ansi.AUTO));

        if (args.length == 0) {
            cli.usage(System.out);
            System.exit(ExitCode.OK);
        }

        int exitCode = cli.execute(args);
        System.exit(exitCode);
    }

    static class ShortErrorHandler implements IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
            cmd.getErr().println(cmd.getColorScheme().errorText("ERROR: " + ex.getMessage()));
            if (ex instanceof InvalidConfigurationException) {
                cmd.usage(cmd.getErr(), cmd.getColorScheme());
                return ExitCode.INVALID_INPUT;
            }
            if (ex instanceof IOException || ex instanceof UncheckedIOException) {
                return ExitCode.IO_ERROR;
            }
            return ExitCode.ERROR;
        }
    }

}
