package codecleaner.checkers;

import codecleaner.tree.Expr;
import codecleaner.tree.Stmt;

import java.util.Set;

public class CallChecker {

	/**
	 * @param stmt  an expression statement
	 * @param names bare or dotted callee names, e.g. <code>print</code> or <code>logging.debug</code>
	 * @return true if the statement is a single call whose callee resolves to one of the names
	 */
	public static boolean isCallTo(Stmt.ExprStmt stmt, Set<String> names) {
		if (!(stmt.getValue() instanceof Expr.Call))
			return false;

		String callee = resolveDottedName(((Expr.Call) stmt.getValue()).getFunc());
		return callee != null && names.contains(callee);
	}

	/**
	 * <code>a</code> resolves to "a", <code>a.b.c</code> to "a.b.c".
	 *
	 * @return null if the expression is not a chain of attribute accesses on a name, e.g. <code>f().g</code>
	 */
	public static String resolveDottedName(Expr expr) {
		return expr.accept(DottedNameResolver.INSTANCE);
	}

	private static class DottedNameResolver implements Expr.Visitor<String> {
		static final DottedNameResolver INSTANCE = new DottedNameResolver();

		@Override
		public String visitName(Expr.Name expr) {
			return expr.getId();
		}

		@Override
		public String visitAttribute(Expr.Attribute expr) {
			String base = expr.getValue().accept(this);
			return base == null ? null : base + "." + expr.getAttr();
		}

		@Override
		public String visitCall(Expr.Call expr) {
			return null;
		}

		@Override
		public String visitOtherExpr(Expr.OtherExpr expr) {
			return null;
		}
	}
}
