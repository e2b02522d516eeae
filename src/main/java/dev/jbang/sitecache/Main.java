package dev.jbang.sitecache;

import dev.jbang.sitecache.config.ConfigException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Main application class with CLI support */
@Command(
		name = "site-cache",
		version = "1.0.0",
		description = "Scrapes an authenticated website and keeps the results in a freshness-gated cache",
		mixinStandardHelpOptions = true,
		subcommands = {FetchCommand.class, RefreshCommand.class, ListCommand.class, RunCommand.class})
public class Main implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_CONFIG = 2;

	@Override
	public Integer call() {
		CommandLine.usage(this, System.out);
		return 0;
	}

	/** The command line with the exit code mapping used by {@link #main(String[])} */
	public static CommandLine commandLine() {
		return new CommandLine(new Main()).setExecutionExceptionHandler((ex, cmd, parseResult) -> {
			if (ex instanceof ConfigException) {
				logger.error("Configuration error: {}", ex.getMessage());
				return EXIT_CONFIG;
			}
			logger.error("Error: {}", ex.getMessage(), ex);
			return EXIT_FAILURE;
		});
	}

	public static void main(String[] args) {
		int exitCode = commandLine().execute(args);
		System.exit(exitCode);
	}
}
