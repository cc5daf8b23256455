package codecleaner.tree;

import java.util.List;

/**
 * One <code>except</code> clause of a {@link Stmt.TryStmt}.
 */
public class ExceptHandler extends Node {
	private final SourceSpan header;
	private List<Stmt> body;

	public ExceptHandler(SourceSpan header, List<Stmt> body) {
		this.header = header;
		this.body = body;
	}

	public SourceSpan getHeader() {
		return header;
	}

	public List<Stmt> getBody() {
		return body;
	}

	public void setBody(List<Stmt> body) {
		this.body = body;
	}

	@Override
	public Kind getKind() {
		return Kind.ExceptionHandler;
	}
}
