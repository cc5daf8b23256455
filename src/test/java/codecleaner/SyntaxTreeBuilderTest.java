package codecleaner;

import codecleaner.tree.Expr;
import codecleaner.tree.Node;
import codecleaner.tree.Stmt;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SyntaxTreeBuilderTest {

	@Test
	void testUnchangedTreePrintsOriginal() throws PythonSyntaxException {
		String source = "import os\n" +
				"\n" +
				"# helper\n" +
				"@decorator(1)\n" +
				"def f(a, b=2, *args, **kwargs):  # trailing\n" +
				"    \"\"\"Doc.\"\"\"\n" +
				"    return [\n" +
				"        a,\n" +
				"        b,\n" +
				"    ]\n" +
				"\n" +
				"\n" +
				"class C(object):\n" +
				"    x = 1; y = 2\n" +
				"    def h(self): return self.x;  z = 3  # same line\n" +
				"\n" +
				"    async def g(self):\n" +
				"        async with lock:\n" +
				"            await self.h()\n" +
				"\n" +
				"    # last\n";

		var module = SyntaxTreeBuilder.build(source);
		Assertions.assertEquals(source, SourcePrinter.print(module));
	}

	@Test
	void testParenthesizedCallIsACall() throws PythonSyntaxException {
		var stmt = (Stmt.ExprStmt) SyntaxTreeBuilder.build("((a).b)(1)\n").getBody().get(0);

		var call = (Expr.Call) stmt.getValue();
		var attribute = (Expr.Attribute) call.getFunc();
		Assertions.assertEquals("b", attribute.getAttr());
		Assertions.assertEquals(Node.Kind.NameReference, attribute.getValue().getKind());
	}

	@Test
	void testMissingFinalLineBreak() throws PythonSyntaxException {
		String source = "if x:\n    y = 1\nelse:\n    y = 2";

		Assertions.assertEquals(source, SourcePrinter.print(SyntaxTreeBuilder.build(source)));
	}

	@Test
	void testEmptySource() throws PythonSyntaxException {
		var module = SyntaxTreeBuilder.build("");

		Assertions.assertTrue(module.getBody().isEmpty());
		Assertions.assertEquals("", SourcePrinter.print(module));
	}

	@Test
	void testCompoundShapes() throws PythonSyntaxException {
		String source = "try:\n" +
				"    a()\n" +
				"except E:\n" +
				"    b()\n" +
				"else:\n" +
				"    c()\n" +
				"finally:\n" +
				"    d()\n" +
				"if p:\n" +
				"    pass\n" +
				"elif q:\n" +
				"    pass\n";
		var body = SyntaxTreeBuilder.build(source).getBody();

		Assertions.assertEquals(Node.Kind.TryBlock, body.get(0).getKind());
		var tryStmt = (Stmt.TryStmt) body.get(0);
		Assertions.assertEquals(1, tryStmt.getHandlers().size());
		Assertions.assertEquals(1, tryStmt.getOrElse().size());
		Assertions.assertEquals(1, tryStmt.getFinalBody().size());

		var conditional = (Stmt.IfStmt) body.get(1);
		Assertions.assertNotNull(conditional.getElifBranch());
		Assertions.assertTrue(conditional.getElifBranch().isElif());
		Assertions.assertNull(conditional.getElifBranch().getOrElse());
	}

	@Test
	void testCallChain() throws PythonSyntaxException {
		var stmt = (Stmt.ExprStmt) SyntaxTreeBuilder.build("a.b.c(1, x=2)\n").getBody().get(0);

		var call = (Expr.Call) stmt.getValue();
		Assertions.assertEquals("1, x=2", call.getArguments());
		var attribute = (Expr.Attribute) call.getFunc();
		Assertions.assertEquals("c", attribute.getAttr());
		Assertions.assertEquals(Node.Kind.AttributeAccess, attribute.getValue().getKind());
	}

	@Test
	void testAssignmentIsNotAnExpressionStatement() throws PythonSyntaxException {
		var body = SyntaxTreeBuilder.build("x = f()\ny += 1\n").getBody();

		Assertions.assertEquals(Node.Kind.SimpleStatement, body.get(0).getKind());
		Assertions.assertEquals(Node.Kind.SimpleStatement, body.get(1).getKind());
	}

	@Test
	void testPython2PrintIsRejected() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> SyntaxTreeBuilder.build("print \"x\"\n"));
	}

	@Test
	void testBadIndentationIsRejected() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> SyntaxTreeBuilder.build("if x:\ny = 1\n"));
	}
}
