package works.vigil.report;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.vigil.spec.IgnorableNode;
import works.vigil.spec.SpecNode;

import static java.util.stream.Collectors.joining;

/**
 * Describes the first place where a value fails to conform to a specification.
 *
 * @param path from the root of the value to the offending part; empty for the root itself
 * @param expected the specification the offending part fails
 * @param actual the offending part
 * @param reason why {@code actual} fails {@code expected}
 */
public record Diagnostic(
	List<PathStep> path,
	SpecNode expected,
	@Nullable Object actual,
	String reason
) {
	/**
	 * Indicates there is no violation.
	 */
	public static final Diagnostic NONE = new Diagnostic(List.of(), IgnorableNode.INSTANCE, null, "no violation");

	public Diagnostic {
		path = List.copyOf(path);
	}

	public boolean isViolation() {
		return this != NONE;
	}

	/**
	 * @return the path in the form {@code $[1]["key"].get()}
	 */
	public String renderedPath() {
		return path.stream()
			.map(PathStep::render)
			.collect(joining("", "$", ""));
	}

	public String message() {
		if (!isViolation()) {
			return reason;
		}
		return renderedPath() + ": expected " + expected + " but got " + describe(actual) + " (" + reason + ")";
	}

	static String describe(Object value) {
		if (value == null) {
			return "null";
		} else if (value instanceof String s) {
			return "String \"" + s + "\"";
		} else {
			String text = String.valueOf(value);
			if (text.length() > 60) {
				text = text.substring(0, 57) + "...";
			}
			return value.getClass().getSimpleName() + " " + text;
		}
	}

	@Override
	public String toString() {
		return message();
	}
}
