package codecleaner;

import codecleaner.tree.Module;
import codecleaner.tree.SourceSpan;
import codecleaner.tree.Stmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a syntax tree back into source text. Statements and headers that came from the source are printed
 * with their original text, indentation and comments; synthesized ones are indented one unit deeper than their
 * header. A statement that shared a line with its predecessor stays on that line as long as the predecessor
 * is still printed right before it.
 */
public class SourcePrinter implements Stmt.Visitor<Void> {

	public static String print(Module module) {
		var printer = new SourcePrinter(module.getIndentUnit());
		printer.printBlock(module.getBody(), "");
		printer.lines.addAll(module.getTrailingTrivia());

		if (printer.lines.isEmpty())
			return "";
		String text = String.join("\n", printer.lines);
		return module.endsWithNewline() ? text + "\n" : text;
	}


	private final String indentUnit;
	private final List<String> lines = new ArrayList<>();

	/**
	 * Indentation for a statement whose source does not tell, i.e. a synthesized one or one that shared
	 * a line with its header.
	 */
	private String blockIndent = "";

	/**
	 * Stop index of the span that ended the last printed line, -1 if that line was synthesized.
	 */
	private int lastStopIndex = -1;

	private SourcePrinter(String indentUnit) {
		this.indentUnit = indentUnit;
	}

	private void printBlock(List<Stmt> block, String indent) {
		for (var stmt : block) {
			blockIndent = indent;
			stmt.accept(this);
		}
	}

	/**
	 * @return the indentation the span was printed with
	 */
	private String printSpan(SourceSpan span) {
		lines.addAll(span.getLeadingTrivia());
		String comment = span.getTrailingComment() != null ? span.getTrailingComment() : "";

		if (span.getIndent() == null && span.getLeadingTrivia().isEmpty()
				&& span.getPreviousStopIndex() >= 0 && span.getPreviousStopIndex() == lastStopIndex) {
			int last = lines.size() - 1;
			lines.set(last, lines.get(last) + span.getSeparator() + span.getText() + comment);
			lastStopIndex = span.getStopIndex();
			return blockIndent;
		}

		String indent = span.getIndent() != null ? span.getIndent() : blockIndent;
		lines.add(indent + span.getText() + comment);
		lastStopIndex = span.getStopIndex();
		return indent;
	}

	@Override
	public Void visitExprStmt(Stmt.ExprStmt stmt) {
		printSpan(stmt.getSource());
		return null;
	}

	@Override
	public Void visitOtherStmt(Stmt.OtherStmt stmt) {
		printSpan(stmt.getSource());
		return null;
	}

	@Override
	public Void visitPassStmt(Stmt.PassStmt stmt) {
		if (stmt.isSynthesized()) {
			lines.addAll(stmt.getLeadingTrivia());
			lines.add(blockIndent + "pass");
			lastStopIndex = -1;
		} else
			printSpan(stmt.getSource());
		return null;
	}

	@Override
	public Void visitIfStmt(Stmt.IfStmt stmt) {
		String indent = printCompound(stmt);

		var elif = stmt.getElifBranch();
		if (elif != null) {
			blockIndent = indent;
			elif.accept(this);
		} else {
			printClause(stmt.getElseHeader(), "else:", stmt.getOrElse(), indent);
		}
		return null;
	}

	@Override
	public Void visitForStmt(Stmt.ForStmt stmt) {
		String indent = printCompound(stmt);
		printClause(stmt.getElseHeader(), "else:", stmt.getOrElse(), indent);
		return null;
	}

	@Override
	public Void visitWhileStmt(Stmt.WhileStmt stmt) {
		String indent = printCompound(stmt);
		printClause(stmt.getElseHeader(), "else:", stmt.getOrElse(), indent);
		return null;
	}

	@Override
	public Void visitTryStmt(Stmt.TryStmt stmt) {
		String indent = printCompound(stmt);
		for (var handler : stmt.getHandlers())
			printClause(handler.getHeader(), "except:", handler.getBody(), indent);
		printClause(stmt.getElseHeader(), "else:", stmt.getOrElse(), indent);
		printClause(stmt.getFinallyHeader(), "finally:", stmt.getFinalBody(), indent);
		return null;
	}

	@Override
	public Void visitScopeStmt(Stmt.ScopeStmt stmt) {
		printCompound(stmt);
		return null;
	}

	private String printCompound(Stmt.Compound stmt) {
		String indent = printSpan(stmt.getHeader());
		printBlock(stmt.getBody(), indent + indentUnit);
		return indent;
	}

	/**
	 * Prints an else, except or finally clause. An absent clause prints nothing; a clause without a header of its
	 * own gets <code>fallbackHeader</code> at the indentation of its statement.
	 */
	private void printClause(SourceSpan header, String fallbackHeader, List<Stmt> body, String indent) {
		if (body == null)
			return;

		if (header != null) {
			blockIndent = indent;
			indent = printSpan(header);
		} else {
			lines.add(indent + fallbackHeader);
			lastStopIndex = -1;
		}
		printBlock(body, indent + indentUnit);
	}
}
