package codecleaner.operations;

import java.nio.file.Path;

/**
 * What cleaning did, or in a dry run would do, to one file.
 */
public class FileStats {
	private final Path path;
	private int callsRemoved = 0;
	private boolean commentsChanged = false;
	private String backupPath = "";
	private long bytesRemoved = 0;
	private String failure = null;

	public FileStats(Path path) {
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

	public int getCallsRemoved() {
		return callsRemoved;
	}

	void setCallsRemoved(int callsRemoved) {
		this.callsRemoved = callsRemoved;
	}

	public boolean isCommentsChanged() {
		return commentsChanged;
	}

	void setCommentsChanged(boolean commentsChanged) {
		this.commentsChanged = commentsChanged;
	}

	/**
	 * @return path of the backup copy, empty if none was made
	 */
	public String getBackupPath() {
		return backupPath;
	}

	void setBackupPath(String backupPath) {
		this.backupPath = backupPath;
	}

	/**
	 * @return UTF-8 size of the original minus the size of the result. Hypothetical in a dry run.
	 */
	public long getBytesRemoved() {
		return bytesRemoved;
	}

	void setBytesRemoved(long bytesRemoved) {
		this.bytesRemoved = bytesRemoved;
	}

	/**
	 * @return why the file could not be read, parsed or written; null if nothing failed
	 */
	public String getFailure() {
		return failure;
	}

	void setFailure(String failure) {
		this.failure = failure;
	}

	public boolean isModified() {
		return callsRemoved > 0 || commentsChanged;
	}

	@Override
	public String toString() {
		return String.format("%s: %d call(s) removed, comments removed: %s, %d byte(s) removed", path, callsRemoved, commentsChanged, bytesRemoved);
	}
}
