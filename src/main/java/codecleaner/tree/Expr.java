package codecleaner.tree;

/**
 * Expressions are only modelled as far as call matching needs them: names, attribute accesses and calls.
 * Everything else is kept as opaque source text.
 */
public abstract class Expr extends Node {
	public interface Visitor<R> {
		R visitName(Name expr);

		R visitAttribute(Attribute expr);

		R visitCall(Call expr);

		R visitOtherExpr(OtherExpr expr);
	}

	public abstract <R> R accept(Visitor<R> visitor);

	public static class Name extends Expr {
		private final String id;

		public Name(String id) {
			this.id = id;
		}

		public String getId() {
			return id;
		}

		@Override
		public Kind getKind() {
			return Kind.NameReference;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitName(this);
		}
	}

	public static class Attribute extends Expr {
		private final Expr value;
		private final String attr;

		public Attribute(Expr value, String attr) {
			this.value = value;
			this.attr = attr;
		}

		public Expr getValue() {
			return value;
		}

		public String getAttr() {
			return attr;
		}

		@Override
		public Kind getKind() {
			return Kind.AttributeAccess;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAttribute(this);
		}
	}

	public static class Call extends Expr {
		private final Expr func;
		private final String arguments;

		/**
		 * @param func      the callee
		 * @param arguments argument list source text, without the parentheses
		 */
		public Call(Expr func, String arguments) {
			this.func = func;
			this.arguments = arguments;
		}

		public Expr getFunc() {
			return func;
		}

		public String getArguments() {
			return arguments;
		}

		@Override
		public Kind getKind() {
			return Kind.Call;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCall(this);
		}
	}

	public static class OtherExpr extends Expr {
		private final String text;

		public OtherExpr(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}

		@Override
		public Kind getKind() {
			return Kind.OtherExpression;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOtherExpr(this);
		}
	}
}
