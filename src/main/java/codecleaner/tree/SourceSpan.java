package codecleaner.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Original source text of a statement or a clause header, with the layout around it.
 */
public class SourceSpan {
	private final String text;
	private final String indent;
	private final List<String> leadingTrivia;
	private final String trailingComment;
	private final int stopIndex;
	private final int previousStopIndex;
	private final String separator;

	/**
	 * @param text              source text, from the first token to the last one
	 * @param indent            whitespace in front of the text, null if the text does not start its line
	 * @param leadingTrivia     blank and comment-only lines directly above the text
	 * @param trailingComment   comment after the text on its last line, including the gap before it. May be null.
	 * @param stopIndex         character index of the last character of the text
	 * @param previousStopIndex for text that does not start its line, the stop index of the header or statement
	 *                          it follows on that line; -1 otherwise
	 * @param separator         what stood between that predecessor and the text, e.g. <code>"; "</code>
	 */
	public SourceSpan(String text, String indent, List<String> leadingTrivia, String trailingComment,
					  int stopIndex, int previousStopIndex, String separator) {
		this.text = text;
		this.indent = indent;
		this.leadingTrivia = new ArrayList<>(leadingTrivia);
		this.trailingComment = trailingComment;
		this.stopIndex = stopIndex;
		this.previousStopIndex = previousStopIndex;
		this.separator = separator;
	}

	public String getText() {
		return text;
	}

	public String getIndent() {
		return indent;
	}

	public List<String> getLeadingTrivia() {
		return leadingTrivia;
	}

	/**
	 * Puts lines in front of the current leading trivia, e.g. the comments of a removed statement above.
	 */
	public void prependTrivia(List<String> trivia) {
		leadingTrivia.addAll(0, trivia);
	}

	public String getTrailingComment() {
		return trailingComment;
	}

	public int getStopIndex() {
		return stopIndex;
	}

	public int getPreviousStopIndex() {
		return previousStopIndex;
	}

	public String getSeparator() {
		return separator;
	}

	@Override
	public String toString() {
		return text;
	}
}
