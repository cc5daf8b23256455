package codecleaner;

import java.util.regex.Pattern;

/**
 * Deletes <code>#</code> comments with a lexical scan. A <code>#</code> right after a quote is left alone, every
 * other one is taken as the start of a comment, so a <code>#</code> inside a string literal is not safe.
 * Multi-line string state is not tracked.
 */
public class CommentStripper {
	private static final Pattern COMMENT = Pattern.compile("(?<!['\"])#[^\r\n]*");

	public static StripResult strip(String text) {
		String stripped = COMMENT.matcher(text).replaceAll("");
		return new StripResult(stripped, !stripped.equals(text));
	}

	public static class StripResult {
		private final String text;
		private final boolean changed;

		public StripResult(String text, boolean changed) {
			this.text = text;
			this.changed = changed;
		}

		public String getText() {
			return text;
		}

		public boolean isChanged() {
			return changed;
		}
	}
}
