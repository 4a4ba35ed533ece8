package org.javai.pimlico.pattern;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A matchable expression bound to a terminal rule.
 * <p>
 * Expressions are immutable trees. {@link #render()} produces source text that parses
 * back to an equal expression, with parentheses inserted only where operator precedence
 * requires them.
 */
public sealed interface PatternExpression {

	int CHOICE = 0;
	int SEQUENCE = 1;
	int LOOKAHEAD = 2;
	int REPETITION = 3;
	int ATOM = 4;

	/**
	 * Renders the expression in grammar source syntax.
	 */
	String render();

	/**
	 * Binding strength of the expression's outermost operator.
	 */
	int precedence();

	private static String wrap(PatternExpression expression, int minimum) {
		String text = expression.render();
		return expression.precedence() < minimum ? "(" + text + ")" : text;
	}

	/**
	 * A quoted string matched literally.
	 */
	record Literal(String value) implements PatternExpression {

		public Literal {
			if (value == null) {
				throw new IllegalArgumentException("Literal value cannot be null");
			}
		}

		@Override
		public String render() {
			StringBuilder sb = new StringBuilder("'");
			for (char c : value.toCharArray()) {
				sb.append(switch (c) {
					case '\'' -> "\\'";
					case '\\' -> "\\\\";
					case '\n' -> "\\n";
					case '\t' -> "\\t";
					case '\r' -> "\\r";
					default -> String.valueOf(c);
				});
			}
			return sb.append('\'').toString();
		}

		@Override
		public int precedence() {
			return ATOM;
		}
	}

	/**
	 * A bracketed set of characters, e.g. {@code [a-z_]} or {@code [^0-9]}.
	 */
	record CharacterClass(List<Range> ranges, boolean negated) implements PatternExpression {

		public CharacterClass {
			if (ranges == null || ranges.isEmpty()) {
				throw new IllegalArgumentException("Character class must contain at least one range");
			}
			ranges = List.copyOf(ranges);
		}

		@Override
		public String render() {
			StringBuilder sb = new StringBuilder("[");
			if (negated) {
				sb.append('^');
			}
			for (Range range : ranges) {
				sb.append(escape(range.from()));
				if (range.from() != range.to()) {
					sb.append('-').append(escape(range.to()));
				}
			}
			return sb.append(']').toString();
		}

		@Override
		public int precedence() {
			return ATOM;
		}

		private static String escape(char c) {
			return switch (c) {
				case ']', '\\', '-', '^' -> "\\" + c;
				case '\n' -> "\\n";
				case '\t' -> "\\t";
				case '\r' -> "\\r";
				default -> String.valueOf(c);
			};
		}

		/**
		 * An inclusive character range; a single character has {@code from == to}.
		 */
		public record Range(char from, char to) {

			public Range {
				if (from > to) {
					throw new IllegalArgumentException("Invalid range: " + from + "-" + to);
				}
			}

			public static Range of(char c) {
				return new Range(c, c);
			}
		}
	}

	/**
	 * {@code .}, any single character.
	 */
	record AnyCharacter() implements PatternExpression {

		@Override
		public String render() {
			return ".";
		}

		@Override
		public int precedence() {
			return ATOM;
		}
	}

	/**
	 * A reference to another rule by its dotted path, e.g. {@code expression.atom}.
	 */
	record Reference(List<String> path) implements PatternExpression {

		public Reference {
			if (path == null || path.isEmpty()) {
				throw new IllegalArgumentException("Reference path cannot be empty");
			}
			path = List.copyOf(path);
		}

		@Override
		public String render() {
			return String.join(".", path);
		}

		@Override
		public int precedence() {
			return ATOM;
		}
	}

	/**
	 * Elements matched one after the other.
	 */
	record Sequence(List<PatternExpression> elements) implements PatternExpression {

		public Sequence {
			if (elements == null || elements.size() < 2) {
				throw new IllegalArgumentException("Sequence needs at least two elements");
			}
			elements = List.copyOf(elements);
		}

		@Override
		public String render() {
			return elements.stream()
				.map(element -> wrap(element, LOOKAHEAD))
				.collect(Collectors.joining(" "));
		}

		@Override
		public int precedence() {
			return SEQUENCE;
		}
	}

	/**
	 * Ordered alternatives, separated by {@code |}.
	 */
	record Choice(List<PatternExpression> alternatives) implements PatternExpression {

		public Choice {
			if (alternatives == null || alternatives.size() < 2) {
				throw new IllegalArgumentException("Choice needs at least two alternatives");
			}
			alternatives = List.copyOf(alternatives);
		}

		@Override
		public String render() {
			return alternatives.stream()
				.map(alternative -> wrap(alternative, SEQUENCE))
				.collect(Collectors.joining(" | "));
		}

		@Override
		public int precedence() {
			return CHOICE;
		}
	}

	/**
	 * An operand followed by {@code ?}, {@code *} or {@code +}.
	 */
	record Repetition(PatternExpression operand, Quantifier quantifier) implements PatternExpression {

		public Repetition {
			if (operand == null || quantifier == null) {
				throw new IllegalArgumentException("Repetition needs an operand and a quantifier");
			}
		}

		@Override
		public String render() {
			return wrap(operand, ATOM) + quantifier.symbol();
		}

		@Override
		public int precedence() {
			return REPETITION;
		}

		public enum Quantifier {
			OPTIONAL('?'),
			ZERO_OR_MORE('*'),
			ONE_OR_MORE('+');

			private final char symbol;

			Quantifier(char symbol) {
				this.symbol = symbol;
			}

			public char symbol() {
				return symbol;
			}

			public static Quantifier of(char symbol) {
				for (Quantifier quantifier : values()) {
					if (quantifier.symbol == symbol) {
						return quantifier;
					}
				}
				return null;
			}
		}
	}

	/**
	 * A predicate that checks its operand without consuming input: {@code &} succeeds when
	 * the operand matches, {@code !} when it does not.
	 */
	record Lookahead(PatternExpression operand, boolean negative) implements PatternExpression {

		public Lookahead {
			if (operand == null) {
				throw new IllegalArgumentException("Lookahead needs an operand");
			}
		}

		@Override
		public String render() {
			return (negative ? "!" : "&") + wrap(operand, REPETITION);
		}

		@Override
		public int precedence() {
			return LOOKAHEAD;
		}
	}
}
