package work.lcod.pumslabel.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine(new LabelCommand()).execute(args));
    }

    static CommandLine commandLine(LabelCommand command) {
        return new CommandLine(command)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
