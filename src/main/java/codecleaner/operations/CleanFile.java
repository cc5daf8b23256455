package codecleaner.operations;

import codecleaner.CallRemover;
import codecleaner.CleanerOptions;
import codecleaner.CommentStripper;
import codecleaner.FileHelper;
import codecleaner.FormatHelper;
import codecleaner.PythonSyntaxException;
import codecleaner.RewriteResult;
import codecleaner.SourcePrinter;
import codecleaner.SyntaxTreeBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Removes the configured calls from one Python file and optionally strips its comments.
 * Nothing in here throws for a single bad file; the problem is logged and recorded in the returned {@link FileStats}.
 */
public class CleanFile extends SourceEdit {

	public CleanFile(Path file, CleanerOptions options) {
		super("Clean " + file, file, options);
	}

	@Override
	protected List<FileStats> editCore() {
		return List.of(clean());
	}

	public FileStats clean() {
		var stats = new FileStats(target);
		if (!FileHelper.isPythonFile(target)) {
			logger.fine(() -> "Skipped " + target + ", not a Python file");
			return stats;
		}

		String original;
		try {
			original = Files.readString(target, StandardCharsets.UTF_8);
		}
		catch (IOException exception) {
			logger.severe("Unable to read " + target + ": " + exception);
			stats.setFailure(exception.toString());
			return stats;
		}

		String lineEnding = FileHelper.getFileLineEnding(original);
		RewriteResult result;
		try {
			var tree = SyntaxTreeBuilder.build(FormatHelper.normalizeLineEndings(original));
			result = CallRemover.transform(tree, options.getFunctionNames(), options.getEmptyBlockPolicy());
		}
		catch (PythonSyntaxException exception) {
			logger.severe("Unable to parse " + target + ": " + exception.getMessage());
			stats.setFailure(exception.getMessage());
			result = RewriteResult.unparsed();
		}

		String content = original;
		if (result.getRemovedCount() > 0)
			content = FormatHelper.changeLineEnding(SourcePrinter.print(result.getTree()), lineEnding);

		if (options.isRemoveComments()) {
			var stripped = CommentStripper.strip(content);
			content = stripped.getText();
			result.setCommentsChanged(stripped.isChanged());
		}

		stats.setCallsRemoved(result.getRemovedCount());
		stats.setCommentsChanged(result.isCommentsChanged());
		if (!stats.isModified())
			return stats;

		long bytesRemoved = original.getBytes(StandardCharsets.UTF_8).length - content.getBytes(StandardCharsets.UTF_8).length;
		if (options.isDryRun()) {
			stats.setBytesRemoved(bytesRemoved);
			return stats;
		}

		if (options.isBackup()) {
			try {
				Path backup = FileHelper.createBackup(target, options.getBackupDirectory(), LocalDateTime.now());
				stats.setBackupPath(backup.toString());
			}
			catch (IOException exception) {
				logger.warning("Unable to back up " + target + ", writing it anyway: " + exception);
			}
		}

		try {
			write(content);
			stats.setBytesRemoved(bytesRemoved);
		}
		catch (IOException exception) {
			logger.severe("Unable to write " + target + ": " + exception);
			stats.setFailure(exception.toString());
		}
		return stats;
	}

	void write(String content) throws IOException {
		Files.writeString(target, content, StandardCharsets.UTF_8);
	}
}
