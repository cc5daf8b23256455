package codecleaner.operations;

import java.util.List;

public class Summary {
	private final int filesProcessed;
	private final int filesModified;
	private final int totalCallsRemoved;
	private final int filesWithCommentsRemoved;
	private final int filesFailed;

	private Summary(int filesProcessed, int filesModified, int totalCallsRemoved, int filesWithCommentsRemoved, int filesFailed) {
		this.filesProcessed = filesProcessed;
		this.filesModified = filesModified;
		this.totalCallsRemoved = totalCallsRemoved;
		this.filesWithCommentsRemoved = filesWithCommentsRemoved;
		this.filesFailed = filesFailed;
	}

	public static Summary of(List<FileStats> stats) {
		return new Summary(stats.size(),
				(int) stats.stream().filter(FileStats::isModified).count(),
				stats.stream().mapToInt(FileStats::getCallsRemoved).sum(),
				(int) stats.stream().filter(FileStats::isCommentsChanged).count(),
				(int) stats.stream().filter(s -> s.getFailure() != null).count());
	}

	public int getFilesProcessed() {
		return filesProcessed;
	}

	public int getFilesModified() {
		return filesModified;
	}

	public int getTotalCallsRemoved() {
		return totalCallsRemoved;
	}

	public int getFilesWithCommentsRemoved() {
		return filesWithCommentsRemoved;
	}

	public int getFilesFailed() {
		return filesFailed;
	}
}
