package codecleaner.operations;

import codecleaner.CleanerOptions;
import codecleaner.FileHelper;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Cleans every Python file of a directory, in path order, and of its subdirectories when the options say so.
 */
public class CleanDirectory extends SourceEdit {

	public CleanDirectory(Path directory, CleanerOptions options) {
		super("Clean Python files in " + directory, directory, options);
	}

	@Override
	protected List<FileStats> editCore() throws IOException {
		var results = new ArrayList<FileStats>();
		for (var f : findPythonFiles()) {
			var stats = createCleanFile(f).clean();
			logger.fine(stats::toString);
			results.add(stats);
		}
		return results;
	}

	CleanFile createCleanFile(Path file) {
		return new CleanFile(file, options);
	}

	List<Path> findPythonFiles() throws IOException {
		if (options.isRecursive()) {
			try (Stream<Path> files = Files.walk(target)) {
				return files.filter(Files::isRegularFile).filter(FileHelper::isPythonFile).sorted().collect(Collectors.toList());
			}
		}

		var found = new ArrayList<Path>();
		try (DirectoryStream<Path> files = Files.newDirectoryStream(target, "*" + FileHelper.PYTHON_EXTENSION)) {
			for (var f : files) {
				if (Files.isRegularFile(f))
					found.add(f);
			}
		}
		Collections.sort(found);
		return found;
	}
}
