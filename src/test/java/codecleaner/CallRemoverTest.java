package codecleaner;

import codecleaner.tree.Stmt;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class CallRemoverTest {

	private static RewriteResult transform(String source, EmptyBlockPolicy policy, String... names) throws PythonSyntaxException {
		return CallRemover.transform(SyntaxTreeBuilder.build(source), Set.of(names), policy);
	}

	private static String print(RewriteResult result) {
		return SourcePrinter.print(result.getTree());
	}

	@Test
	void testIfElseSynthesize() throws PythonSyntaxException {
		var result = transform("if x:\n    print(\"a\")\nelse:\n    print(\"b\")", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals(2, result.getRemovedCount());
		Assertions.assertEquals("if x:\n    pass\nelse:\n    pass", print(result));
	}

	@Test
	void testIfElseDelete() throws PythonSyntaxException {
		var result = transform("a = 1\nif x:\n    print(\"a\")\nelse:\n    print(\"b\")\nb = 2\n", EmptyBlockPolicy.Delete, "print");

		Assertions.assertEquals(2, result.getRemovedCount());
		Assertions.assertEquals("a = 1\nb = 2\n", print(result));
		Assertions.assertEquals(2, result.getTree().getBody().size());
	}

	@Test
	void testForElseKeepsUnmatchedElse() throws PythonSyntaxException {
		var result = transform("for i in xs:\n    debug(i)\nelse:\n    done()", EmptyBlockPolicy.Synthesize, "debug");

		Assertions.assertEquals(1, result.getRemovedCount());
		Assertions.assertEquals("for i in xs:\n    pass\nelse:\n    done()", print(result));
	}

	@Test
	void testEmptiedElseIsDropped() throws PythonSyntaxException {
		var result = transform("while busy():\n    step()\nelse:\n    print(\"done\")\n", EmptyBlockPolicy.Delete, "print");

		var loop = (Stmt.WhileStmt) result.getTree().getBody().get(0);
		Assertions.assertNull(loop.getOrElse());
		Assertions.assertEquals("while busy():\n    step()\n", print(result));
	}

	@Test
	void testAbsentElseStaysAbsent() throws PythonSyntaxException {
		var result = transform("if x:\n    print(x)\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("if x:\n    pass\n", print(result));
	}

	@Test
	void testHandlerIndependence() throws PythonSyntaxException {
		String source = "try:\n" +
				"    work()\n" +
				"except ValueError:\n" +
				"    print(\"v\")\n" +
				"except KeyError:\n" +
				"    handle()\n" +
				"except OSError:\n" +
				"    print(\"o\")\n" +
				"except Exception:\n" +
				"    recover()\n";
		var result = transform(source, EmptyBlockPolicy.Delete, "print");

		var tryStmt = (Stmt.TryStmt) result.getTree().getBody().get(0);
		Assertions.assertEquals(2, tryStmt.getHandlers().size());
		Assertions.assertEquals("except KeyError:", tryStmt.getHandlers().get(0).getHeader().getText());
		Assertions.assertEquals("except Exception:", tryStmt.getHandlers().get(1).getHeader().getText());
		Assertions.assertEquals("try:\n    work()\nexcept KeyError:\n    handle()\nexcept Exception:\n    recover()\n", print(result));
		Assertions.assertTrue(result.getWarnings().isEmpty());
	}

	@Test
	void testHandlerSynthesize() throws PythonSyntaxException {
		var result = transform("try:\n    work()\nexcept ValueError as e:\n    print(e)\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("try:\n    work()\nexcept ValueError as e:\n    pass\n", print(result));
	}

	@Test
	void testTryWithoutClausesIsReported() throws PythonSyntaxException {
		var result = transform("try:\n    work()\nexcept ValueError:\n    print(\"v\")\n", EmptyBlockPolicy.Delete, "print");

		Assertions.assertEquals("try:\n    work()\n", print(result));
		Assertions.assertEquals(1, result.getWarnings().size());
	}

	@Test
	void testFinallySynthesize() throws PythonSyntaxException {
		var result = transform("try:\n    work()\nfinally:\n    print(\"cleanup\")\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("try:\n    work()\nfinally:\n    pass\n", print(result));
	}

	@Test
	void testEmptiedTryBodyDeletesTry() throws PythonSyntaxException {
		var result = transform("try:\n    print(1)\nexcept E:\n    fix()\nz = 0\n", EmptyBlockPolicy.Delete, "print");

		Assertions.assertEquals("z = 0\n", print(result));
	}

	@Test
	void testDottedNames() throws PythonSyntaxException {
		String source = "logging.debug(\"x\")\nlog.debug(\"y\")\nf().debug(\"z\")\nself.logger.debug(\"w\")\n";
		var result = transform(source, EmptyBlockPolicy.Synthesize, "logging.debug", "debug", "self.logger.debug");

		Assertions.assertEquals(2, result.getRemovedCount());
		Assertions.assertEquals("log.debug(\"y\")\nf().debug(\"z\")\n", print(result));
	}

	@Test
	void testOnlyStatementLevelCallsAreRemoved() throws PythonSyntaxException {
		String source = "x = print(1)\nprint(2) or f()\nreturn_value = [print(i) for i in xs]\n";
		var result = transform(source, EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals(0, result.getRemovedCount());
		Assertions.assertEquals(source, print(result));
	}

	@Test
	void testNestedCascadeDelete() throws PythonSyntaxException {
		String source = "def f():\n" +
				"    if a:\n" +
				"        while b:\n" +
				"            print(b)\n" +
				"    return 1\n";
		var result = transform(source, EmptyBlockPolicy.Delete, "print");

		Assertions.assertEquals(1, result.getRemovedCount());
		Assertions.assertEquals("def f():\n    return 1\n", print(result));
	}

	@Test
	void testDefinitionIsNeverDeleted() throws PythonSyntaxException {
		var result = transform("def f():\n  if a:\n    print(a)\n", EmptyBlockPolicy.Delete, "print");

		Assertions.assertEquals("def f():\n  pass\n", print(result));
	}

	@Test
	void testPreserve() throws PythonSyntaxException {
		var result = transform("def f():\n    print(1)\nif x:\n    print(2)\ny = 2\n", EmptyBlockPolicy.Preserve, "print");

		var function = (Stmt.ScopeStmt) result.getTree().getBody().get(0);
		var conditional = (Stmt.IfStmt) result.getTree().getBody().get(1);
		Assertions.assertTrue(function.getBody().isEmpty());
		Assertions.assertTrue(conditional.getBody().isEmpty());
		Assertions.assertEquals("def f():\nif x:\ny = 2\n", print(result));
	}

	@Test
	void testElifSynthesize() throws PythonSyntaxException {
		String source = "if a:\n    x = 1\nelif b:\n    print(b)\nelse:\n    print(c)\n";
		var result = transform(source, EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("if a:\n    x = 1\nelif b:\n    pass\nelse:\n    pass\n", print(result));
	}

	@Test
	void testDeletedElifEmptiesParentElse() throws PythonSyntaxException {
		String source = "if a:\n    x = 1\nelif b:\n    print(b)\nelse:\n    print(c)\n";
		var result = transform(source, EmptyBlockPolicy.Delete, "print");

		var conditional = (Stmt.IfStmt) result.getTree().getBody().get(0);
		Assertions.assertNull(conditional.getOrElse());
		Assertions.assertEquals("if a:\n    x = 1\n", print(result));
	}

	@Test
	void testIdempotence() throws PythonSyntaxException {
		String source = "import logging\n" +
				"\n" +
				"class Worker:\n" +
				"    def run(self):\n" +
				"        for job in self.jobs:\n" +
				"            logging.info(job)  # progress\n" +
				"            job()\n" +
				"        else:\n" +
				"            print(\"idle\")\n";
		var once = print(transform(source, EmptyBlockPolicy.Synthesize, "print", "logging.info"));
		var again = transform(once, EmptyBlockPolicy.Synthesize, "print", "logging.info");

		Assertions.assertEquals(0, again.getRemovedCount());
		Assertions.assertEquals(once, print(again));
	}

	@Test
	void testCommentsOfKeptStatementsSurvive() throws PythonSyntaxException {
		String source = "# setup\nx = 1  # one\n\n# about to print\nprint(x)  # gone\n\ny = 2\n";
		var result = transform(source, EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("# setup\nx = 1  # one\n\n# about to print\n\ny = 2\n", print(result));
	}

	@Test
	void testSynthesizedPassUsesFileIndentation() throws PythonSyntaxException {
		var result = transform("if x:\n\tprint(x)\nwhile y:\n\tprint(y)\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("if x:\n\tpass\nwhile y:\n\tpass\n", print(result));
	}

	@Test
	void testParenthesizedStatement() throws PythonSyntaxException {
		var result = transform("(print(\"a\"))\nx = 1\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals(1, result.getRemovedCount());
		Assertions.assertEquals("x = 1\n", print(result));
	}

	@Test
	void testParenthesizedCallee() throws PythonSyntaxException {
		var result = transform("(print)(\"a\")\n((logging).debug)(1)\nx = 1\n", EmptyBlockPolicy.Synthesize, "print", "logging.debug");

		Assertions.assertEquals(2, result.getRemovedCount());
		Assertions.assertEquals("x = 1\n", print(result));
	}

	@Test
	void testTupleIsNotACall() throws PythonSyntaxException {
		String source = "(print(1), 2)\n(print(i) for i in xs)\n(yield)\n";
		var result = transform(source, EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals(0, result.getRemovedCount());
		Assertions.assertEquals(source, print(result));
	}

	@Test
	void testCommentAboveRemovedCallMovesToPlaceholder() throws PythonSyntaxException {
		var result = transform("if x:\n    # c\n    print(1)\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("if x:\n    # c\n    pass\n", print(result));
	}

	@Test
	void testCommentAboveRemovedCallMovesToNextStatement() throws PythonSyntaxException {
		var result = transform("# start\nif x:\n    # c\n    print(1)\ny = 2\n", EmptyBlockPolicy.Delete, "print");

		Assertions.assertEquals("# start\n    # c\ny = 2\n", print(result));
	}

	@Test
	void testCommentAboveRemovedCallAtEndOfFile() throws PythonSyntaxException {
		var result = transform("x = 1\n# bye\nprint(x)\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("x = 1\n# bye\n", print(result));
	}

	@Test
	void testCommentAboveDroppedHandlerMovesToNextHandler() throws PythonSyntaxException {
		String source = "try:\n" +
				"    work()\n" +
				"# value errors\n" +
				"except ValueError:\n" +
				"    print(\"v\")\n" +
				"# key errors\n" +
				"except KeyError:\n" +
				"    handle()\n";
		var result = transform(source, EmptyBlockPolicy.Delete, "print");

		Assertions.assertEquals("try:\n    work()\n# value errors\n# key errors\nexcept KeyError:\n    handle()\n", print(result));
	}

	@Test
	void testBodiesOnHeaderLineStayThere() throws PythonSyntaxException {
		String source = "def _(s): return s\nprint(1)\nfor i in r: a[i] = None\nif x: y = 1; print(2)\n";
		var result = transform(source, EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals(2, result.getRemovedCount());
		Assertions.assertEquals("def _(s): return s\nfor i in r: a[i] = None\nif x: y = 1\n", print(result));
	}

	@Test
	void testStatementAfterRemovedCallMovesToItsOwnLine() throws PythonSyntaxException {
		var result = transform("if x: print(1); y = 2\nwhile z: print(z)\n", EmptyBlockPolicy.Synthesize, "print");

		Assertions.assertEquals("if x:\n    y = 2\nwhile z:\n    pass\n", print(result));
	}
}
