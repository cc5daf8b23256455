package codecleaner.tree;

/**
 * Common root of the syntax tree. A parent owns its children exclusively; nothing is shared between trees.
 */
public abstract class Node {

	public abstract Kind getKind();

	public enum Kind {
		Module,
		ExpressionStatement,
		SimpleStatement,
		Placeholder,
		Conditional,
		ForLoop,
		WhileLoop,
		TryBlock,
		ExceptionHandler,
		Scope,
		Call,
		NameReference,
		AttributeAccess,
		OtherExpression,
	}
}
