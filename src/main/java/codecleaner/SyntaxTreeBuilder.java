package codecleaner;

import codecleaner.tree.ExceptHandler;
import codecleaner.tree.Expr;
import codecleaner.tree.Module;
import codecleaner.tree.SourceSpan;
import codecleaner.tree.Stmt;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the syntax tree of a Python file from the ANTLR parse tree. Statements and clause headers keep their
 * original text; blank lines and comments are attached to the statement below them.
 */
public class SyntaxTreeBuilder extends PythonParserBaseVisitor<List<Stmt>> {
	private static final String DEFAULT_INDENT_UNIT = "    ";

	public static Module build(String source) throws PythonSyntaxException {
		CharStream input = CharStreams.fromString(source);
		var lexer = new PythonLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

		var tokens = new CommonTokenStream(lexer);
		var parser = new PythonParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(ThrowingErrorListener.INSTANCE);

		try {
			var fileInput = parser.fileInput();
			return new SyntaxTreeBuilder(input, tokens, source).buildModule(fileInput);
		}
		catch (ParseCancellationException e) {
			throw new PythonSyntaxException(e.getMessage(), e);
		}
	}


	private final CharStream input;
	private final CommonTokenStream tokens;
	private final List<String> lines;
	private final boolean endsWithNewline;

	/**
	 * 1-based number of the first line not yet attributed to any statement.
	 */
	private int nextTriviaLine = 1;

	private SyntaxTreeBuilder(CharStream input, CommonTokenStream tokens, String source) {
		this.input = input;
		this.tokens = tokens;
		this.endsWithNewline = FormatHelper.endsWithLineBreak(source);

		var allLines = FormatHelper.splitLines(source);
		// a final line break does not open another line
		this.lines = endsWithNewline ? allLines.subList(0, allLines.size() - 1) : allLines;
	}

	private Module buildModule(PythonParser.FileInputContext ctx) {
		var body = new ArrayList<Stmt>();
		for (var stmt : ctx.stmt())
			body.addAll(visitStmt(stmt));

		var trailing = collectTrivia(lines.size() + 1);
		return new Module(body, trailing, findIndentUnit(), endsWithNewline);
	}

	@Override
	public List<Stmt> visitStmt(PythonParser.StmtContext ctx) {
		if (ctx.simpleStmt() != null)
			return visitSimpleStmt(ctx.simpleStmt());
		else
			return visitCompoundStmt(ctx.compoundStmt());
	}

	@Override
	public List<Stmt> visitSimpleStmt(PythonParser.SimpleStmtContext ctx) {
		var statements = new ArrayList<Stmt>();
		for (var smallStmt : ctx.smallStmt())
			statements.add(buildSmallStmt(smallStmt));
		return statements;
	}

	@Override
	public List<Stmt> visitSuite(PythonParser.SuiteContext ctx) {
		if (ctx.simpleStmt() != null)
			return visitSimpleStmt(ctx.simpleStmt());

		var body = new ArrayList<Stmt>();
		for (var stmt : ctx.stmt())
			body.addAll(visitStmt(stmt));
		return body;
	}

	@Override
	public List<Stmt> visitCompoundStmt(PythonParser.CompoundStmtContext ctx) {
		return buildCompound((ParserRuleContext) ctx.getChild(0), ctx.start);
	}

	private Stmt buildSmallStmt(PythonParser.SmallStmtContext ctx) {
		var source = span(ctx.start, ctx.stop);
		if (ctx.passStmt() != null)
			return new Stmt.PassStmt(source);

		var exprStmt = ctx.exprStmt();
		if (exprStmt != null && exprStmt.getChildCount() == 1)
			return new Stmt.ExprStmt(buildExpr(exprStmt.testListStarExpr(0)), source);

		return new Stmt.OtherStmt(source);
	}

	/**
	 * @param headerStart first token of the header. Decorators and <code>async</code> belong to the header of the
	 *                    statement they introduce.
	 */
	private List<Stmt> buildCompound(ParserRuleContext ctx, Token headerStart) {
		Stmt stmt;
		if (ctx instanceof PythonParser.IfStmtContext)
			stmt = buildIf((PythonParser.IfStmtContext) ctx, headerStart);
		else if (ctx instanceof PythonParser.WhileStmtContext)
			stmt = buildWhile((PythonParser.WhileStmtContext) ctx, headerStart);
		else if (ctx instanceof PythonParser.ForStmtContext)
			stmt = buildFor((PythonParser.ForStmtContext) ctx, headerStart);
		else if (ctx instanceof PythonParser.TryStmtContext)
			stmt = buildTry((PythonParser.TryStmtContext) ctx, headerStart);
		else if (ctx instanceof PythonParser.WithStmtContext) {
			var with = (PythonParser.WithStmtContext) ctx;
			stmt = buildScope(Stmt.ScopeType.With, headerStart, with.COLON().getSymbol(), with.suite());
		}
		else if (ctx instanceof PythonParser.FuncDefContext) {
			var funcDef = (PythonParser.FuncDefContext) ctx;
			stmt = buildScope(Stmt.ScopeType.Function, headerStart, funcDef.COLON().getSymbol(), funcDef.suite());
		}
		else if (ctx instanceof PythonParser.ClassDefContext) {
			var classDef = (PythonParser.ClassDefContext) ctx;
			stmt = buildScope(Stmt.ScopeType.Class, headerStart, classDef.COLON().getSymbol(), classDef.suite());
		}
		else if (ctx instanceof PythonParser.DecoratedContext)
			return buildCompound((ParserRuleContext) ctx.getChild(1), headerStart);
		else if (ctx instanceof PythonParser.AsyncStmtContext || ctx instanceof PythonParser.AsyncFuncDefContext)
			return buildCompound((ParserRuleContext) ctx.getChild(1), headerStart);
		else
			throw new IllegalStateException("Unexpected compound statement " + ctx.getClass().getSimpleName());

		var result = new ArrayList<Stmt>(1);
		result.add(stmt);
		return result;
	}

	private Stmt buildIf(PythonParser.IfStmtContext ctx, Token headerStart) {
		var header = span(headerStart, ctx.COLON().getSymbol());
		var conditional = new Stmt.IfStmt(header, visitSuite(ctx.suite()), false);

		var tail = conditional;
		for (var elif : ctx.elifClause()) {
			var elifHeader = span(elif.start, elif.COLON().getSymbol());
			var branch = new Stmt.IfStmt(elifHeader, visitSuite(elif.suite()), true);
			tail.setOrElse(newList(branch), null);
			tail = branch;
		}
		if (ctx.elseClause() != null)
			buildElse(tail, ctx.elseClause());
		return conditional;
	}

	private Stmt buildWhile(PythonParser.WhileStmtContext ctx, Token headerStart) {
		var header = span(headerStart, ctx.COLON().getSymbol());
		var loop = new Stmt.WhileStmt(header, visitSuite(ctx.suite()));
		if (ctx.elseClause() != null)
			buildElse(loop, ctx.elseClause());
		return loop;
	}

	private Stmt buildFor(PythonParser.ForStmtContext ctx, Token headerStart) {
		var header = span(headerStart, ctx.COLON().getSymbol());
		var loop = new Stmt.ForStmt(header, visitSuite(ctx.suite()));
		if (ctx.elseClause() != null)
			buildElse(loop, ctx.elseClause());
		return loop;
	}

	private Stmt buildTry(PythonParser.TryStmtContext ctx, Token headerStart) {
		var header = span(headerStart, ctx.COLON().getSymbol());
		var tryStmt = new Stmt.TryStmt(header, visitSuite(ctx.suite()));

		var handlers = new ArrayList<ExceptHandler>();
		for (var except : ctx.exceptClause()) {
			var handlerHeader = span(except.start, except.COLON().getSymbol());
			handlers.add(new ExceptHandler(handlerHeader, visitSuite(except.suite())));
		}
		tryStmt.setHandlers(handlers);

		if (ctx.elseClause() != null)
			buildElse(tryStmt, ctx.elseClause());

		var finallyClause = ctx.finallyClause();
		if (finallyClause != null) {
			var finallyHeader = span(finallyClause.start, finallyClause.COLON().getSymbol());
			tryStmt.setFinalBody(visitSuite(finallyClause.suite()), finallyHeader);
		}
		return tryStmt;
	}

	private void buildElse(Stmt.WithElse owner, PythonParser.ElseClauseContext ctx) {
		var elseHeader = span(ctx.start, ctx.COLON().getSymbol());
		owner.setOrElse(visitSuite(ctx.suite()), elseHeader);
	}

	private Stmt buildScope(Stmt.ScopeType type, Token headerStart, Token colon, PythonParser.SuiteContext suite) {
		var header = span(headerStart, colon);
		return new Stmt.ScopeStmt(type, header, visitSuite(suite));
	}

	/**
	 * Models the expression of an expression statement. Only a chain of names, attribute accesses and calls is
	 * broken down, looking through redundant parentheses; anything else stays opaque.
	 */
	private Expr buildExpr(ParserRuleContext ctx) {
		var inner = AntlrHelper.unwrap(ctx, PythonParser.AtomExprContext.class);
		if (!(inner instanceof PythonParser.AtomExprContext))
			return new Expr.OtherExpr(text(ctx));

		var atomExpr = (PythonParser.AtomExprContext) inner;
		if (atomExpr.AWAIT() != null)
			return new Expr.OtherExpr(text(atomExpr));

		var atom = atomExpr.atom();
		Expr current;
		if (atom.NAME() != null)
			current = new Expr.Name(atom.NAME().getText());
		else if (isParenthesized(atom))
			current = buildExpr(atom.testListComp());
		else
			current = new Expr.OtherExpr(text(atom));

		for (var trailer : atomExpr.trailer()) {
			if (trailer.DOT() != null)
				current = new Expr.Attribute(current, trailer.NAME().getText());
			else if (trailer.OPEN_PAREN() != null)
				current = new Expr.Call(current, trailer.argList() == null ? "" : text(trailer.argList()));
			else
				current = new Expr.OtherExpr(AntlrHelper.getText(input, atomExpr.start, trailer.stop));
		}
		return current;
	}

	/**
	 * @return true for <code>( expression )</code>, false for a tuple, a generator or <code>()</code>
	 */
	private static boolean isParenthesized(PythonParser.AtomContext atom) {
		var content = atom.testListComp();
		return atom.OPEN_PAREN() != null && content != null && content.getChildCount() == 1
				&& content.getChild(0) instanceof PythonParser.NamedExprTestContext;
	}

	private String text(ParserRuleContext ctx) {
		return AntlrHelper.getText(input, ctx.start, ctx.stop);
	}

	/**
	 * Captures the source of a statement or header and claims the trivia lines above it.
	 * Must be called in source order.
	 */
	private SourceSpan span(Token start, Token stop) {
		String indent = findIndent(start);
		List<String> leading = indent == null ? List.of() : collectTrivia(start.getLine());
		String text = AntlrHelper.getText(input, start, stop);
		String comment = AntlrHelper.findTrailingComment(tokens, input, stop);

		int previousStop = -1;
		String separator = null;
		if (indent == null) {
			var previous = findPredecessor(start);
			if (previous != null) {
				previousStop = previous.getStopIndex();
				separator = input.getText(Interval.of(previousStop + 1, start.getStartIndex() - 1));
			}
		}

		nextTriviaLine = Math.max(nextTriviaLine, stop.getLine() + FormatHelper.countLineBreaks(stop.getText()) + 1);
		return new SourceSpan(text, indent, leading, comment, stop.getStopIndex(), previousStop, separator);
	}

	/**
	 * @return the last token of the header or statement that <code>start</code> follows on the same line,
	 * skipping the semicolon between two statements
	 */
	private Token findPredecessor(Token start) {
		Token previous = previousDefaultToken(start.getTokenIndex());
		if (previous != null && previous.getType() == PythonLexer.SEMI_COLON)
			previous = previousDefaultToken(previous.getTokenIndex());
		return previous != null && previous.getLine() + FormatHelper.countLineBreaks(previous.getText()) == start.getLine() ? previous : null;
	}

	private Token previousDefaultToken(int tokenIndex) {
		for (int i = tokenIndex - 1; i >= 0; i--) {
			var token = tokens.get(i);
			if (token.getChannel() == Token.DEFAULT_CHANNEL)
				return token;
		}
		return null;
	}

	/**
	 * @return lines from the first unclaimed line up to, not including, <code>line</code>
	 */
	private List<String> collectTrivia(int line) {
		var trivia = new ArrayList<String>();
		for (int i = nextTriviaLine; i < line && i <= lines.size(); i++)
			trivia.add(lines.get(i - 1));
		nextTriviaLine = Math.max(nextTriviaLine, line);
		return trivia;
	}

	/**
	 * @return the whitespace in front of the token, or null if the token is not the first one on its line
	 */
	private String findIndent(Token start) {
		String line = lines.get(start.getLine() - 1);
		String whitespace = FormatHelper.leadingWhitespace(line);
		return whitespace.length() == start.getCharPositionInLine() ? whitespace : null;
	}

	/**
	 * The first INDENT of a file always opens a block from column zero, so its width is the file's indent unit.
	 */
	private String findIndentUnit() {
		for (var token : tokens.getTokens()) {
			if (token.getType() == PythonLexer.INDENT && !token.getText().isEmpty())
				return token.getText();
		}
		return DEFAULT_INDENT_UNIT;
	}

	private static List<Stmt> newList(Stmt stmt) {
		var list = new ArrayList<Stmt>();
		list.add(stmt);
		return list;
	}
}
