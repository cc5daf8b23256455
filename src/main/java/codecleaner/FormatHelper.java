package codecleaner;

import java.util.Arrays;
import java.util.List;

public class FormatHelper {
	private static final String ANY_LINE_ENDING = "((?<!\\r)\\n|\\r(?!\\n)|\\r\\n)";

	/**
	 * Splits on '\n', the only line terminator ANTLR counts, and drops the '\r' of CRLF endings.
	 *
	 * @return the lines of the text. A text ending with a line break yields an empty last element.
	 */
	public static List<String> splitLines(String text) {
		String[] lines = text.split("\n", -1);
		for (int i = 0; i < lines.length; i++) {
			if (lines[i].endsWith("\r"))
				lines[i] = lines[i].substring(0, lines[i].length() - 1);
		}
		return Arrays.asList(lines);
	}

	/**
	 * @return the spaces, tabs and form feeds the line starts with
	 */
	public static String leadingWhitespace(String line) {
		int i = 0;
		while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t' || line.charAt(i) == '\f'))
			i++;
		return line.substring(0, i);
	}

	public static int countLineBreaks(String text) {
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n')
				count++;
		}
		return count;
	}

	public static boolean endsWithLineBreak(String text) {
		return text.endsWith("\n") || text.endsWith("\r");
	}

	public static String normalizeLineEndings(String content) {
		return changeLineEnding(content, "\n");
	}

	public static String changeLineEnding(String content, String lineEnding) {
		return content.replaceAll(ANY_LINE_ENDING, lineEnding);
	}
}
