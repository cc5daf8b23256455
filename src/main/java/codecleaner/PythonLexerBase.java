package codecleaner;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;

/**
 * Turns physical line breaks into the logical NEWLINE, INDENT and DEDENT tokens the parser works with.
 * Line breaks inside brackets, blank lines and comment-only lines produce nothing.
 */
public abstract class PythonLexerBase extends Lexer {
	private final LinkedList<Token> pending = new LinkedList<>();
	private final Deque<Integer> indents = new ArrayDeque<>();
	private int opened = 0;
	private Token lastToken = null;
	private boolean eofHandled = false;

	protected PythonLexerBase(CharStream input) {
		super(input);
	}

	@Override
	public void emit(Token token) {
		super.setToken(token);
		pending.offer(token);
		if (token.getChannel() == Token.DEFAULT_CHANNEL && token.getType() != Token.EOF)
			lastToken = token;
	}

	@Override
	public Token nextToken() {
		if (_input.LA(1) == EOF && !eofHandled) {
			eofHandled = true;
			// a file may end without a line break, or inside an indented block
			if (lastToken != null && lastToken.getType() != PythonLexer.NEWLINE && lastToken.getType() != PythonLexer.DEDENT)
				emit(commonToken(PythonLexer.NEWLINE, ""));
			while (!indents.isEmpty()) {
				emit(createDedent());
				indents.pop();
			}
		}

		Token next = super.nextToken();
		return pending.isEmpty() ? next : pending.poll();
	}

	@Override
	public void reset() {
		pending.clear();
		indents.clear();
		opened = 0;
		lastToken = null;
		eofHandled = false;
		super.reset();
	}

	protected boolean atStartOfInput() {
		return getCharPositionInLine() == 0 && getLine() == 1;
	}

	protected void openBrace() {
		opened++;
	}

	protected void closeBrace() {
		if (opened > 0)
			opened--;
	}

	protected void onNewLine() {
		String newLine = getText().replaceAll("[^\r\n\f]+", "");
		String spaces = getText().replaceAll("[\r\n\f]+", "");
		int next = _input.LA(1);

		if (opened > 0 || next == '\r' || next == '\n' || next == '\f' || next == '#') {
			skip();
			return;
		}

		emit(commonToken(PythonLexer.NEWLINE, newLine));
		if (next == EOF) {
			// close every open block before the lexer queues its EOF token
			eofHandled = true;
			while (!indents.isEmpty()) {
				emit(createDedent());
				indents.pop();
			}
			return;
		}

		int indent = getIndentationCount(spaces);
		int previous = indents.isEmpty() ? 0 : indents.peek();
		if (indent == previous) {
			skip();
		} else if (indent > previous) {
			indents.push(indent);
			emit(commonToken(PythonLexer.INDENT, spaces));
		} else {
			while (!indents.isEmpty() && indents.peek() > indent) {
				emit(createDedent());
				indents.pop();
			}
		}
	}

	static int getIndentationCount(String spaces) {
		int count = 0;
		for (char ch : spaces.toCharArray()) {
			if (ch == '\t')
				count += 8 - (count % 8);
			else
				count++;
		}
		return count;
	}

	private Token createDedent() {
		CommonToken dedent = commonToken(PythonLexer.DEDENT, "");
		if (lastToken != null)
			dedent.setLine(lastToken.getLine());
		return dedent;
	}

	private CommonToken commonToken(int type, String text) {
		int stop = getCharIndex() - 1;
		int start = text.isEmpty() ? stop : stop - text.length() + 1;
		CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
		token.setText(text);
		return token;
	}
}
