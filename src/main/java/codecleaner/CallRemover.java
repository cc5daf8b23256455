package codecleaner;

import codecleaner.checkers.CallChecker;
import codecleaner.tree.ExceptHandler;
import codecleaner.tree.Module;
import codecleaner.tree.SourceSpan;
import codecleaner.tree.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Removes statements that only call one of the given names, then reconciles every body that became empty.
 * <p>
 * Children are rewritten before their parent looks at its own bodies, so a construct deleted for being empty
 * can in turn empty its parent within the same pass. Each visit returns whether the statement stays in its list;
 * lists are rebuilt from the survivors rather than edited while being iterated.
 * <p>
 * Blank lines and comments above a removed statement are handed on to whatever is printed next: the following
 * statement or clause header, the placeholder that replaces an emptied body, or the end of the file.
 */
public class CallRemover implements Stmt.Visitor<Boolean> {
	private static final Logger logger = Logger.getLogger(CallRemover.class.getSimpleName());

	public static RewriteResult transform(Module tree, Set<String> names, EmptyBlockPolicy policy) {
		var remover = new CallRemover(names, policy);
		tree.setBody(remover.rewrite(tree.getBody()));
		tree.prependTrailingTrivia(remover.pendingTrivia);
		return new RewriteResult(remover.removedCount, tree, remover.warnings);
	}


	private final Set<String> names;
	private final EmptyBlockPolicy policy;
	private final List<String> warnings = new ArrayList<>();
	private int removedCount = 0;

	/**
	 * Trivia of removed statements, in source order, not yet given to a printed span.
	 */
	private final List<String> pendingTrivia = new ArrayList<>();

	private CallRemover(Set<String> names, EmptyBlockPolicy policy) {
		this.names = names;
		this.policy = policy;
	}

	private List<Stmt> rewrite(List<Stmt> block) {
		var kept = new ArrayList<Stmt>(block.size());
		for (var stmt : block) {
			if (stmt.accept(this))
				kept.add(stmt);
		}
		return kept;
	}

	/**
	 * Rewrites a body, else-clause, handler or finally-clause. An emptied one gets a placeholder right away
	 * if placeholders are wanted.
	 */
	private List<Stmt> rewriteBlock(List<Stmt> block) {
		var kept = rewrite(block);
		if (kept.isEmpty() && policy == EmptyBlockPolicy.Synthesize)
			kept.add(newPlaceholder());
		return kept;
	}

	private Stmt.PassStmt newPlaceholder() {
		var placeholder = new Stmt.PassStmt(pendingTrivia);
		pendingTrivia.clear();
		return placeholder;
	}

	private void claimTrivia(SourceSpan span) {
		if (span == null || pendingTrivia.isEmpty())
			return;
		span.prependTrivia(pendingTrivia);
		pendingTrivia.clear();
	}

	/**
	 * Hands the trivia of a span that will not be printed on to the next printed one.
	 */
	private void releaseTrivia(SourceSpan span) {
		if (span != null)
			pendingTrivia.addAll(0, span.getLeadingTrivia());
	}

	@Override
	public Boolean visitExprStmt(Stmt.ExprStmt stmt) {
		claimTrivia(stmt.getSource());
		if (CallChecker.isCallTo(stmt, names)) {
			removedCount++;
			logger.fine(() -> "Removed " + stmt.getSource());
			releaseTrivia(stmt.getSource());
			return false;
		}
		return true;
	}

	@Override
	public Boolean visitOtherStmt(Stmt.OtherStmt stmt) {
		claimTrivia(stmt.getSource());
		return true;
	}

	@Override
	public Boolean visitPassStmt(Stmt.PassStmt stmt) {
		claimTrivia(stmt.getSource());
		return true;
	}

	@Override
	public Boolean visitIfStmt(Stmt.IfStmt stmt) {
		return rewriteWithElse(stmt);
	}

	@Override
	public Boolean visitForStmt(Stmt.ForStmt stmt) {
		return rewriteWithElse(stmt);
	}

	@Override
	public Boolean visitWhileStmt(Stmt.WhileStmt stmt) {
		return rewriteWithElse(stmt);
	}

	@Override
	public Boolean visitTryStmt(Stmt.TryStmt stmt) {
		claimTrivia(stmt.getHeader());
		stmt.setBody(rewriteBlock(stmt.getBody()));
		for (var handler : stmt.getHandlers()) {
			claimTrivia(handler.getHeader());
			handler.setBody(rewriteBlock(handler.getBody()));
		}
		rewriteElse(stmt);
		if (stmt.getFinalBody() != null) {
			claimTrivia(stmt.getFinallyHeader());
			stmt.setFinalBody(rewriteBlock(stmt.getFinalBody()));
		}

		if (!reconcileBody(stmt))
			return false;

		if (policy == EmptyBlockPolicy.Delete)
			deleteEmptyClauses(stmt);

		if (stmt.getHandlers().isEmpty() && stmt.getFinalBody() == null) {
			String warning = String.format("'%s' has no except or finally clause left", stmt.getHeader());
			logger.warning(warning);
			warnings.add(warning);
		}
		return true;
	}

	/**
	 * Drops emptied handlers, else and finally clauses, each on its own. The trivia above a dropped clause
	 * moves to the next clause kept, or past the statement.
	 */
	private void deleteEmptyClauses(Stmt.TryStmt stmt) {
		var carried = new ArrayList<String>();

		var handlers = new ArrayList<ExceptHandler>(stmt.getHandlers().size());
		for (var handler : stmt.getHandlers()) {
			if (handler.getBody().isEmpty()) {
				carried.addAll(handler.getHeader().getLeadingTrivia());
			} else {
				handler.getHeader().prependTrivia(carried);
				carried.clear();
				handlers.add(handler);
			}
		}
		stmt.setHandlers(handlers);

		if (stmt.getOrElse() != null) {
			if (stmt.getOrElse().isEmpty()) {
				carried.addAll(stmt.getElseHeader().getLeadingTrivia());
				stmt.removeOrElse();
			} else {
				stmt.getElseHeader().prependTrivia(carried);
				carried.clear();
			}
		}

		if (stmt.getFinalBody() != null) {
			if (stmt.getFinalBody().isEmpty()) {
				carried.addAll(stmt.getFinallyHeader().getLeadingTrivia());
				stmt.removeFinalBody();
			} else {
				stmt.getFinallyHeader().prependTrivia(carried);
				carried.clear();
			}
		}
		pendingTrivia.addAll(0, carried);
	}

	/**
	 * Definitions and <code>with</code> blocks are never deleted; an emptied body gets a placeholder unless
	 * empty bodies are preserved.
	 */
	@Override
	public Boolean visitScopeStmt(Stmt.ScopeStmt stmt) {
		claimTrivia(stmt.getHeader());
		stmt.setBody(rewriteBlock(stmt.getBody()));
		if (stmt.getBody().isEmpty() && policy == EmptyBlockPolicy.Delete)
			stmt.getBody().add(newPlaceholder());
		return true;
	}

	private boolean rewriteWithElse(Stmt.WithElse stmt) {
		claimTrivia(stmt.getHeader());
		stmt.setBody(rewriteBlock(stmt.getBody()));
		rewriteElse(stmt);

		if (!reconcileBody(stmt))
			return false;

		if (policy == EmptyBlockPolicy.Delete && stmt.getOrElse() != null && stmt.getOrElse().isEmpty()) {
			releaseTrivia(stmt.getElseHeader());
			stmt.removeOrElse();
		}
		return true;
	}

	/**
	 * Only an else-clause present in the source is rewritten; an absent one stays absent. The else-clause
	 * holding an elif branch has no header and no placeholder of its own.
	 */
	private void rewriteElse(Stmt.WithElse stmt) {
		if (stmt.getOrElse() == null)
			return;

		if (stmt.getElseHeader() == null) {
			stmt.setOrElse(rewrite(stmt.getOrElse()));
		} else {
			claimTrivia(stmt.getElseHeader());
			stmt.setOrElse(rewriteBlock(stmt.getOrElse()));
		}
	}

	/**
	 * Under {@link EmptyBlockPolicy#Delete}, a statement with an emptied body goes as a whole. The trivia above it
	 * and that of calls removed inside it stay in the file.
	 *
	 * @return false if the whole statement has to go
	 */
	private boolean reconcileBody(Stmt.Compound stmt) {
		if (!stmt.getBody().isEmpty() || policy != EmptyBlockPolicy.Delete)
			return true;

		logger.fine(() -> "Deleted " + stmt.getKind() + " '" + stmt.getHeader() + "' with an empty body");
		releaseTrivia(stmt.getHeader());
		return false;
	}
}
