package codecleaner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class CommentStripperTest {

	@Test
	void testStripTrailingComment() {
		var result = CommentStripper.strip("x = 1  # note");

		Assertions.assertTrue(result.isChanged());
		Assertions.assertEquals("x = 1  ", result.getText());
	}

	@Test
	void testStripKeepsLineBreaks() {
		var result = CommentStripper.strip("# header\r\ny = 2\r\n    # indented\r\n");

		Assertions.assertEquals("\r\ny = 2\r\n    \r\n", result.getText());
	}

	@Test
	void testHashAfterQuoteIsKept() {
		var result = CommentStripper.strip("color = \"#fff\"\n");

		Assertions.assertFalse(result.isChanged());
		Assertions.assertEquals("color = \"#fff\"\n", result.getText());
	}

	@Test
	void testNoComment() {
		var result = CommentStripper.strip("x = 1\n");

		Assertions.assertFalse(result.isChanged());
		Assertions.assertEquals("x = 1\n", result.getText());
	}
}
