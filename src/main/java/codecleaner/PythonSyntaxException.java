package codecleaner;

/**
 * The source could not be parsed, so no syntax tree exists for it.
 */
public class PythonSyntaxException extends Exception {
	public PythonSyntaxException(String message, Throwable cause) {
		super(message, cause);
	}
}
