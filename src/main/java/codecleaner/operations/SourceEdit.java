package codecleaner.operations;

import codecleaner.CleanerOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * An edit over one file or a tree of files. Failures on single files are reported through their
 * {@link FileStats}; only a failure of the edit as a whole ends up here.
 */
public abstract class SourceEdit {
	protected final Path target;
	protected final CleanerOptions options;
	protected Logger logger = Logger.getLogger(this.getClass().getSimpleName());

	private final String description;

	public SourceEdit(String description, Path target, CleanerOptions options) {
		this.description = description;
		this.target = target;
		this.options = options;
	}

	/**
	 * @return statistics of every file the edit looked at
	 */
	protected abstract List<FileStats> editCore() throws IOException;

	public List<FileStats> edit() {
		logger.info(description);
		try {
			return editCore();
		}
		catch (IOException exception) {
			logger.severe(exception.toString());
			return List.of();
		}
	}
}
