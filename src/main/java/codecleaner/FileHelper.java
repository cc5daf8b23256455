package codecleaner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public class FileHelper {
	public static final String PYTHON_EXTENSION = ".py";

	private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

	public static String getFileNameWithoutExtension(String fileName) {
		int pos = fileName.lastIndexOf(".");
		if (pos > 0) {
			fileName = fileName.substring(0, pos);
		}
		return fileName;
	}

	/**
	 * @return the extension including the dot, or an empty string.
	 */
	public static String getFileExtension(String fileName) {
		int pos = fileName.lastIndexOf(".");
		if (pos > 0)
			return fileName.substring(pos);
		else
			return "";
	}

	public static boolean isPythonFile(Path file) {
		return file.getFileName() != null && file.getFileName().toString().endsWith(PYTHON_EXTENSION);
	}

	public static String getFileLineEnding(String content) {
		if (content.contains("\r\n"))
			return "\r\n";
		else if (content.contains("\n"))
			return "\n";
		else if (content.contains("\r"))
			return "\r";
		else
			return System.lineSeparator();
	}

	/**
	 * @return <code>&lt;stem&gt;_&lt;yyyyMMdd_HHmmss&gt;&lt;ext&gt;</code>
	 */
	public static String getBackupFileName(Path file, LocalDateTime time) {
		String fileName = file.getFileName().toString();
		return getFileNameWithoutExtension(fileName) + "_" + BACKUP_TIMESTAMP.format(time) + getFileExtension(fileName);
	}

	/**
	 * Copies the file, with its attributes, into the backup directory. An existing backup of the same name is replaced.
	 *
	 * @return path of the copy
	 */
	public static Path createBackup(Path file, Path backupDirectory, LocalDateTime time) throws IOException {
		Path backup = backupDirectory.resolve(getBackupFileName(file, time));
		Files.createDirectories(backupDirectory);
		Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
		return backup;
	}
}
