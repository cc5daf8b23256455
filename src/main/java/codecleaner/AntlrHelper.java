package codecleaner;

import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;

public class AntlrHelper {

	/**
	 * @return the original text from the start of <code>start</code> to the end of <code>stop</code>,
	 * including whitespace and comments between them.
	 */
	public static String getText(CharStream input, Token start, Token stop) {
		return input.getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
	}

	/**
	 * @return the comment following the token on the same line, together with the whitespace in front of it.
	 * Null if there is none.
	 */
	public static String findTrailingComment(BufferedTokenStream tokens, CharStream input, Token token) {
		var hidden = tokens.getHiddenTokensToRight(token.getTokenIndex(), Token.HIDDEN_CHANNEL);
		if (hidden == null)
			return null;

		int lastLine = token.getLine() + FormatHelper.countLineBreaks(token.getText());
		for (var t : hidden) {
			if (t.getType() == PythonLexer.COMMENT && t.getLine() == lastLine)
				return input.getText(Interval.of(token.getStopIndex() + 1, t.getStopIndex()));
		}
		return null;
	}

	/**
	 * Descends through rule contexts that wrap exactly one other rule context.
	 *
	 * @return the first descendant that has several children, is a token, or is of the requested type.
	 */
	public static ParseTree unwrap(ParseTree tree, Class<? extends ParserRuleContext> stopAt) {
		ParseTree current = tree;
		while (!stopAt.isInstance(current) && current.getChildCount() == 1 && current.getChild(0) instanceof ParserRuleContext)
			current = current.getChild(0);
		return current;
	}
}
