package codecleaner;

import codecleaner.tree.Module;

import java.util.List;

public class RewriteResult {
	private final int removedCount;
	private final Module tree;
	private final List<String> warnings;
	private boolean commentsChanged;

	public RewriteResult(int removedCount, Module tree, List<String> warnings) {
		this.removedCount = removedCount;
		this.tree = tree;
		this.warnings = List.copyOf(warnings);
	}

	/**
	 * Result for a source that could not be parsed.
	 */
	public static RewriteResult unparsed() {
		return new RewriteResult(0, null, List.of());
	}

	public int getRemovedCount() {
		return removedCount;
	}

	/**
	 * @return the rewritten tree, null if the source could not be parsed
	 */
	public Module getTree() {
		return tree;
	}

	/**
	 * @return constructs left structurally invalid by the rewrite, e.g. a try without handlers and finally
	 */
	public List<String> getWarnings() {
		return warnings;
	}

	public boolean isCommentsChanged() {
		return commentsChanged;
	}

	public void setCommentsChanged(boolean commentsChanged) {
		this.commentsChanged = commentsChanged;
	}
}
