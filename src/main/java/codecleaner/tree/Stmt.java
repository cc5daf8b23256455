package codecleaner.tree;

import java.util.ArrayList;
import java.util.List;

public abstract class Stmt extends Node {
	public interface Visitor<R> {
		R visitExprStmt(ExprStmt stmt);

		R visitOtherStmt(OtherStmt stmt);

		R visitPassStmt(PassStmt stmt);

		R visitIfStmt(IfStmt stmt);

		R visitForStmt(ForStmt stmt);

		R visitWhileStmt(WhileStmt stmt);

		R visitTryStmt(TryStmt stmt);

		R visitScopeStmt(ScopeStmt stmt);
	}

	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * A statement evaluated only for its value, e.g. <code>print("a")</code>.
	 */
	public static class ExprStmt extends Stmt {
		private final Expr value;
		private final SourceSpan source;

		public ExprStmt(Expr value, SourceSpan source) {
			this.value = value;
			this.source = source;
		}

		public Expr getValue() {
			return value;
		}

		public SourceSpan getSource() {
			return source;
		}

		@Override
		public Kind getKind() {
			return Kind.ExpressionStatement;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExprStmt(this);
		}
	}

	/**
	 * Assignments, imports, returns and every other simple statement. Kept verbatim.
	 */
	public static class OtherStmt extends Stmt {
		private final SourceSpan source;

		public OtherStmt(SourceSpan source) {
			this.source = source;
		}

		public SourceSpan getSource() {
			return source;
		}

		@Override
		public Kind getKind() {
			return Kind.SimpleStatement;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOtherStmt(this);
		}
	}

	/**
	 * The no-op statement. Written in the source, or synthesized for a body that became empty.
	 */
	public static class PassStmt extends Stmt {
		private final SourceSpan source;
		private final List<String> leadingTrivia;

		/**
		 * A synthesized placeholder.
		 *
		 * @param leadingTrivia lines to print above it, taken over from removed statements
		 */
		public PassStmt(List<String> leadingTrivia) {
			this.source = null;
			this.leadingTrivia = new ArrayList<>(leadingTrivia);
		}

		public PassStmt(SourceSpan source) {
			this.source = source;
			this.leadingTrivia = source.getLeadingTrivia();
		}

		/**
		 * @return null for a synthesized placeholder.
		 */
		public SourceSpan getSource() {
			return source;
		}

		public List<String> getLeadingTrivia() {
			return leadingTrivia;
		}

		public boolean isSynthesized() {
			return source == null;
		}

		@Override
		public Kind getKind() {
			return Kind.Placeholder;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPassStmt(this);
		}
	}

	/**
	 * A statement with a header line and an indented body.
	 */
	public abstract static class Compound extends Stmt {
		private final SourceSpan header;
		private List<Stmt> body;

		protected Compound(SourceSpan header, List<Stmt> body) {
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
	}

	/**
	 * A compound statement that may carry an <code>else</code> clause. A null else-clause is absent;
	 * an empty one was emptied by a rewrite.
	 */
	public abstract static class WithElse extends Compound {
		private SourceSpan elseHeader;
		private List<Stmt> orElse;

		protected WithElse(SourceSpan header, List<Stmt> body) {
			super(header, body);
		}

		public SourceSpan getElseHeader() {
			return elseHeader;
		}

		public List<Stmt> getOrElse() {
			return orElse;
		}

		public void setOrElse(List<Stmt> orElse, SourceSpan elseHeader) {
			this.orElse = orElse;
			this.elseHeader = elseHeader;
		}

		public void setOrElse(List<Stmt> orElse) {
			this.orElse = orElse;
		}

		public void removeOrElse() {
			setOrElse(null, null);
		}
	}

	/**
	 * <code>if</code>, or an <code>elif</code> branch. An elif branch is the only statement of the else-clause
	 * of the conditional it continues, and that else-clause has no header of its own.
	 */
	public static class IfStmt extends WithElse {
		private final boolean elif;

		public IfStmt(SourceSpan header, List<Stmt> body, boolean elif) {
			super(header, body);
			this.elif = elif;
		}

		public boolean isElif() {
			return elif;
		}

		/**
		 * @return the elif branch continuing this conditional, null if there is none.
		 */
		public IfStmt getElifBranch() {
			var orElse = getOrElse();
			if (getElseHeader() == null && orElse != null && orElse.size() == 1 && orElse.get(0) instanceof IfStmt) {
				var branch = (IfStmt) orElse.get(0);
				if (branch.isElif())
					return branch;
			}
			return null;
		}

		@Override
		public Kind getKind() {
			return Kind.Conditional;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIfStmt(this);
		}
	}

	public static class ForStmt extends WithElse {
		public ForStmt(SourceSpan header, List<Stmt> body) {
			super(header, body);
		}

		@Override
		public Kind getKind() {
			return Kind.ForLoop;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitForStmt(this);
		}
	}

	public static class WhileStmt extends WithElse {
		public WhileStmt(SourceSpan header, List<Stmt> body) {
			super(header, body);
		}

		@Override
		public Kind getKind() {
			return Kind.WhileLoop;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitWhileStmt(this);
		}
	}

	/**
	 * <code>try</code> with its handlers, optional <code>else</code> and optional <code>finally</code>.
	 */
	public static class TryStmt extends WithElse {
		private List<ExceptHandler> handlers = new ArrayList<>();
		private SourceSpan finallyHeader;
		private List<Stmt> finalBody;

		public TryStmt(SourceSpan header, List<Stmt> body) {
			super(header, body);
		}

		public List<ExceptHandler> getHandlers() {
			return handlers;
		}

		public void setHandlers(List<ExceptHandler> handlers) {
			this.handlers = handlers;
		}

		public SourceSpan getFinallyHeader() {
			return finallyHeader;
		}

		public List<Stmt> getFinalBody() {
			return finalBody;
		}

		public void setFinalBody(List<Stmt> finalBody, SourceSpan finallyHeader) {
			this.finalBody = finalBody;
			this.finallyHeader = finallyHeader;
		}

		public void setFinalBody(List<Stmt> finalBody) {
			this.finalBody = finalBody;
		}

		public void removeFinalBody() {
			setFinalBody(null, null);
		}

		@Override
		public Kind getKind() {
			return Kind.TryBlock;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTryStmt(this);
		}
	}

	/**
	 * Function and class definitions and <code>with</code> blocks: statements whose body is never dropped.
	 */
	public static class ScopeStmt extends Compound {
		private final ScopeType type;

		public ScopeStmt(ScopeType type, SourceSpan header, List<Stmt> body) {
			super(header, body);
			this.type = type;
		}

		public ScopeType getType() {
			return type;
		}

		@Override
		public Kind getKind() {
			return Kind.Scope;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitScopeStmt(this);
		}
	}

	public enum ScopeType {
		Function,
		Class,
		With,
	}
}
