package codecleaner;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Settings of a cleaning run. Defaults: remove <code>print</code> calls, keep comments, do not recurse,
 * write changes, back up into the temporary directory, and put <code>pass</code> into emptied blocks.
 */
public class CleanerOptions {
	private Set<String> functionNames = new LinkedHashSet<>(Set.of("print"));
	private boolean removeComments = false;
	private boolean recursive = false;
	private boolean dryRun = false;
	private boolean backup = true;
	private EmptyBlockPolicy emptyBlockPolicy = EmptyBlockPolicy.Synthesize;
	private Path backupDirectory = Path.of(System.getProperty("java.io.tmpdir"));

	public Set<String> getFunctionNames() {
		return functionNames;
	}

	public CleanerOptions setFunctionNames(Set<String> functionNames) {
		this.functionNames = new LinkedHashSet<>(functionNames);
		return this;
	}

	public boolean isRemoveComments() {
		return removeComments;
	}

	public CleanerOptions setRemoveComments(boolean removeComments) {
		this.removeComments = removeComments;
		return this;
	}

	public boolean isRecursive() {
		return recursive;
	}

	public CleanerOptions setRecursive(boolean recursive) {
		this.recursive = recursive;
		return this;
	}

	public boolean isDryRun() {
		return dryRun;
	}

	public CleanerOptions setDryRun(boolean dryRun) {
		this.dryRun = dryRun;
		return this;
	}

	public boolean isBackup() {
		return backup;
	}

	public CleanerOptions setBackup(boolean backup) {
		this.backup = backup;
		return this;
	}

	public EmptyBlockPolicy getEmptyBlockPolicy() {
		return emptyBlockPolicy;
	}

	public CleanerOptions setEmptyBlockPolicy(EmptyBlockPolicy emptyBlockPolicy) {
		this.emptyBlockPolicy = emptyBlockPolicy;
		return this;
	}

	public Path getBackupDirectory() {
		return backupDirectory;
	}

	public CleanerOptions setBackupDirectory(Path backupDirectory) {
		this.backupDirectory = backupDirectory;
		return this;
	}
}
