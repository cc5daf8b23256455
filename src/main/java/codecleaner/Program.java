package codecleaner;

import codecleaner.operations.CleanDirectory;
import codecleaner.operations.CleanFile;
import codecleaner.operations.FileStats;
import codecleaner.operations.Summary;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Program {
	private static final Logger logger = Logger.getLogger("");

	static final int EXIT_PATH_NOT_FOUND = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = String.join(System.lineSeparator(),
			"Usage: codecleaner <path> [options]",
			"  -f, --functions a,b.c       names of the calls to remove (default: print)",
			"  -c, --remove-comments       also strip # comments",
			"  -r, --recursive             descend into subdirectories",
			"  -d, --dry-run               report changes without writing them",
			"  -n, --no-backup             do not back up modified files",
			"  -e, --empty-blocks POLICY   pass, remove or keep (default: pass)",
			"      --log LEVEL             java.util.logging level",
			"  -h, --help                  show this help");

	public static void main(String[] args) {
		System.exit(run(args));
	}

	static int run(String[] args) {
		Locale.setDefault(new Locale("en", "US"));
		List<String> argsList = Arrays.asList(args);
		try {
			int i = argsList.indexOf("--log");
			if (i > -1 && i + 1 < argsList.size()) {
				Level logLevel = Level.parse(argsList.get(i + 1).toUpperCase());

				for (Handler handler : logger.getHandlers())
					handler.setLevel(logLevel);
				logger.setLevel(logLevel);
			}
		}
		catch (IllegalArgumentException e) {
			logger.warning("Unknown log level: " + e.getMessage());
		}

		if (argsList.contains("-h") || argsList.contains("--help")) {
			System.out.println(USAGE);
			return 0;
		}

		Path path;
		CleanerOptions options = new CleanerOptions();
		try {
			path = parseOptions(args, options);
		}
		catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println(USAGE);
			return EXIT_USAGE;
		}

		if (!Files.exists(path)) {
			System.err.println("Path not found: " + path);
			return EXIT_PATH_NOT_FOUND;
		}

		logger.fine(() -> "Removing calls to " + String.join(", ", options.getFunctionNames())
				+ ", empty blocks: " + options.getEmptyBlockPolicy().getOptionName());
		if (Files.isDirectory(path)) {
			var stats = new CleanDirectory(path, options).edit();
			printSummary(Summary.of(stats), System.out);
		} else {
			printFileStats(new CleanFile(path, options).clean(), System.out);
		}

		if (options.isDryRun())
			System.out.println("Dry run: no file was modified.");
		return 0;
	}

	/**
	 * Fills <code>options</code> from the command line.
	 *
	 * @return the path to clean
	 * @throws IllegalArgumentException on an unknown option, a missing value or a missing path
	 */
	static Path parseOptions(String[] args, CleanerOptions options) {
		Path path = null;
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			switch (arg) {
				case "-f":
				case "--functions":
					options.setFunctionNames(parseNames(valueOf(args, ++i, arg)));
					break;
				case "-c":
				case "--remove-comments":
					options.setRemoveComments(true);
					break;
				case "-r":
				case "--recursive":
					options.setRecursive(true);
					break;
				case "-d":
				case "--dry-run":
					options.setDryRun(true);
					break;
				case "-n":
				case "--no-backup":
					options.setBackup(false);
					break;
				case "-e":
				case "--empty-blocks":
					options.setEmptyBlockPolicy(EmptyBlockPolicy.parse(valueOf(args, ++i, arg)));
					break;
				case "--log":
					// handled before parsing
					valueOf(args, ++i, arg);
					break;
				default:
					if (arg.startsWith("-"))
						throw new IllegalArgumentException("Unknown option: " + arg);
					if (path != null)
						throw new IllegalArgumentException("Only one path can be given, got " + path + " and " + arg);
					path = Path.of(arg);
			}
		}

		if (path == null)
			throw new IllegalArgumentException("Missing path");
		return path;
	}

	private static String valueOf(String[] args, int i, String option) {
		if (i >= args.length)
			throw new IllegalArgumentException("Missing value for " + option);
		return args[i];
	}

	private static Set<String> parseNames(String value) {
		var names = new LinkedHashSet<String>();
		for (String name : value.split(",")) {
			if (!name.isBlank())
				names.add(name.strip());
		}
		if (names.isEmpty())
			throw new IllegalArgumentException("No function names in '" + value + "'");
		return names;
	}

	static void printFileStats(FileStats stats, PrintStream out) {
		out.println("File: " + stats.getPath());
		if (stats.getFailure() != null)
			out.println("  Failed: " + stats.getFailure());
		out.println("  Calls removed: " + stats.getCallsRemoved());
		out.println("  Comments removed: " + (stats.isCommentsChanged() ? "yes" : "no"));
		out.println("  Bytes removed: " + stats.getBytesRemoved());
		if (!stats.getBackupPath().isEmpty())
			out.println("  Backup: " + stats.getBackupPath());
	}

	static void printSummary(Summary summary, PrintStream out) {
		out.println("Files processed: " + summary.getFilesProcessed());
		out.println("Files modified: " + summary.getFilesModified());
		out.println("Calls removed: " + summary.getTotalCallsRemoved());
		out.println("Files with comments removed: " + summary.getFilesWithCommentsRemoved());
		if (summary.getFilesFailed() > 0)
			out.println("Files failed: " + summary.getFilesFailed());
	}
}
