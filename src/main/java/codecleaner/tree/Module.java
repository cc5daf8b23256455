package codecleaner.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed file.
 */
public class Module extends Node {
	private List<Stmt> body;
	private final List<String> trailingTrivia;
	private final String indentUnit;
	private final boolean endsWithNewline;

	/**
	 * @param trailingTrivia  blank and comment lines after the last statement
	 * @param indentUnit      indentation of the first indented block, used for synthesized statements
	 * @param endsWithNewline whether the source ended with a line break
	 */
	public Module(List<Stmt> body, List<String> trailingTrivia, String indentUnit, boolean endsWithNewline) {
		this.body = body;
		this.trailingTrivia = new ArrayList<>(trailingTrivia);
		this.indentUnit = indentUnit;
		this.endsWithNewline = endsWithNewline;
	}

	public List<Stmt> getBody() {
		return body;
	}

	public void setBody(List<Stmt> body) {
		this.body = body;
	}

	public List<String> getTrailingTrivia() {
		return trailingTrivia;
	}

	public void prependTrailingTrivia(List<String> trivia) {
		trailingTrivia.addAll(0, trivia);
	}

	public String getIndentUnit() {
		return indentUnit;
	}

	public boolean endsWithNewline() {
		return endsWithNewline;
	}

	@Override
	public Kind getKind() {
		return Kind.Module;
	}
}
