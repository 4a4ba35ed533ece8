package org.javai.pimlico.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.pimlico.pattern.PatternExpression.AnyCharacter;
import org.javai.pimlico.pattern.PatternExpression.CharacterClass;
import org.javai.pimlico.pattern.PatternExpression.Choice;
import org.javai.pimlico.pattern.PatternExpression.Literal;
import org.javai.pimlico.pattern.PatternExpression.Lookahead;
import org.javai.pimlico.pattern.PatternExpression.Reference;
import org.javai.pimlico.pattern.PatternExpression.Repetition;
import org.javai.pimlico.pattern.PatternExpression.Sequence;
import org.javai.pimlico.text.Position;
import org.javai.pimlico.text.SyntaxError;
import org.javai.pimlico.text.TextBuffer;

/**
 * Recursive-descent parser for the pattern expressions of terminal rules.
 * <p>
 * An expression occupies the rest of its line; only inside parentheses may it continue
 * on following lines. Problems are reported by appending to the error list, and every
 * empty result except the optional "nothing here" case is paired with a new error.
 *
 * <pre>
 * choice    := sequence ( '|' sequence )*
 * sequence  := prefixed prefixed*
 * prefixed  := ( '&amp;' | '!' )? suffixed
 * suffixed  := primary ( '?' | '*' | '+' )?
 * primary   := string | class | '.' | reference | '(' choice ')'
 * </pre>
 */
public class PatternParser {

	/**
	 * Parses an expression that must extend to the end of the current line.
	 *
	 * @param buffer cursor positioned at the first character of the expression
	 * @param errors list receiving diagnostics
	 * @param required whether a missing expression is an error; when {@code false} and
	 *        nothing that could start an expression follows, an empty result is returned
	 *        without a diagnostic
	 * @return the expression, or empty if none could be parsed
	 */
	public Optional<PatternExpression> parse(TextBuffer buffer, List<SyntaxError> errors, boolean required) {
		Objects.requireNonNull(buffer, "buffer must not be null");
		Objects.requireNonNull(errors, "errors must not be null");

		if (!required && !startsPrefixed(buffer.peek())) {
			return Optional.empty();
		}

		PatternExpression expression = parseChoice(buffer, errors, false);
		if (expression == null) {
			return Optional.empty();
		}

		buffer.skipSpace();
		if (!buffer.atLineEnd()) {
			errors.add(SyntaxError.at("unexpected character '" + buffer.peek() + "' in pattern expression", buffer));
			return Optional.empty();
		}
		return Optional.of(expression);
	}

	private PatternExpression parseChoice(TextBuffer buffer, List<SyntaxError> errors, boolean nested) {
		PatternExpression first = parseSequence(buffer, errors, nested);
		if (first == null) {
			return null;
		}

		List<PatternExpression> alternatives = new ArrayList<>();
		alternatives.add(first);
		while (true) {
			buffer.skipSpace(nested);
			if (!buffer.read('|')) {
				break;
			}
			buffer.skipSpace(nested);
			PatternExpression alternative = parseSequence(buffer, errors, nested);
			if (alternative == null) {
				return null;
			}
			alternatives.add(alternative);
		}
		return alternatives.size() == 1 ? first : new Choice(alternatives);
	}

	private PatternExpression parseSequence(TextBuffer buffer, List<SyntaxError> errors, boolean nested) {
		PatternExpression first = parsePrefixed(buffer, errors);
		if (first == null) {
			return null;
		}

		List<PatternExpression> elements = new ArrayList<>();
		elements.add(first);
		while (true) {
			buffer.skipSpace(nested);
			if (!startsPrefixed(buffer.peek())) {
				break;
			}
			PatternExpression element = parsePrefixed(buffer, errors);
			if (element == null) {
				return null;
			}
			elements.add(element);
		}
		return elements.size() == 1 ? first : new Sequence(elements);
	}

	private PatternExpression parsePrefixed(TextBuffer buffer, List<SyntaxError> errors) {
		if (buffer.read('&')) {
			PatternExpression operand = parseSuffixed(buffer, errors);
			return operand != null ? new Lookahead(operand, false) : null;
		}
		if (buffer.read('!')) {
			PatternExpression operand = parseSuffixed(buffer, errors);
			return operand != null ? new Lookahead(operand, true) : null;
		}
		return parseSuffixed(buffer, errors);
	}

	private PatternExpression parseSuffixed(TextBuffer buffer, List<SyntaxError> errors) {
		PatternExpression primary = parsePrimary(buffer, errors);
		if (primary == null) {
			return null;
		}
		Repetition.Quantifier quantifier = Repetition.Quantifier.of(buffer.peek());
		if (quantifier != null) {
			buffer.read();
			return new Repetition(primary, quantifier);
		}
		return primary;
	}

	private PatternExpression parsePrimary(TextBuffer buffer, List<SyntaxError> errors) {
		char c = buffer.peek();
		return switch (c) {
			case '\'', '"' -> parseString(buffer, errors);
			case '[' -> parseClass(buffer, errors);
			case '(' -> parseGroup(buffer, errors);
			case '.' -> {
				buffer.read();
				yield new AnyCharacter();
			}
			default -> {
				if (TextBuffer.isIdentifierChar(c)) {
					yield parseReference(buffer, errors);
				}
				errors.add(SyntaxError.at("expected pattern expression", buffer));
				yield null;
			}
		};
	}

	private PatternExpression parseString(TextBuffer buffer, List<SyntaxError> errors) {
		Position start = buffer.position();
		char quote = buffer.read();

		StringBuilder sb = new StringBuilder();
		while (!buffer.atLineEnd() && !buffer.peek(quote)) {
			char c = buffer.read();
			if (c == '\\' && !buffer.atLineEnd()) {
				sb.append(unescape(buffer.read()));
			} else {
				sb.append(c);
			}
		}

		if (!buffer.read(quote)) {
			errors.add(SyntaxError.at("unterminated string literal", start, buffer));
			return null;
		}
		return new Literal(sb.toString());
	}

	private PatternExpression parseClass(TextBuffer buffer, List<SyntaxError> errors) {
		Position start = buffer.position();
		buffer.read();
		boolean negated = buffer.read('^');

		List<CharacterClass.Range> ranges = new ArrayList<>();
		while (!buffer.atLineEnd() && !buffer.peek(']')) {
			char from = readClassCharacter(buffer);
			if (!buffer.read('-')) {
				ranges.add(CharacterClass.Range.of(from));
			} else if (buffer.atLineEnd() || buffer.peek(']')) {
				// a trailing '-' is literal
				ranges.add(CharacterClass.Range.of(from));
				ranges.add(CharacterClass.Range.of('-'));
			} else {
				char to = readClassCharacter(buffer);
				if (to < from) {
					errors.add(SyntaxError.at("invalid character range '" + from + "-" + to + "'", start, buffer));
					return null;
				}
				ranges.add(new CharacterClass.Range(from, to));
			}
		}

		if (!buffer.read(']')) {
			errors.add(SyntaxError.at("unterminated character class", start, buffer));
			return null;
		}
		if (ranges.isEmpty()) {
			errors.add(SyntaxError.at("empty character class", start, buffer));
			return null;
		}
		return new CharacterClass(ranges, negated);
	}

	private PatternExpression parseGroup(TextBuffer buffer, List<SyntaxError> errors) {
		buffer.read();
		buffer.skipSpace(true);
		PatternExpression inner = parseChoice(buffer, errors, true);
		if (inner == null) {
			return null;
		}
		buffer.skipSpace(true);
		if (!buffer.read(')')) {
			errors.add(SyntaxError.at("expected ')'", buffer));
			return null;
		}
		return inner;
	}

	private PatternExpression parseReference(TextBuffer buffer, List<SyntaxError> errors) {
		List<String> path = new ArrayList<>();
		path.add(buffer.readIdentifier());
		while (buffer.read('.')) {
			String segment = buffer.readIdentifier();
			if (segment.isEmpty()) {
				errors.add(SyntaxError.at("expected identifier after '.'", buffer));
				return null;
			}
			path.add(segment);
		}
		return new Reference(path);
	}

	private char readClassCharacter(TextBuffer buffer) {
		char c = buffer.read();
		if (c == '\\' && !buffer.atLineEnd()) {
			return unescape(buffer.read());
		}
		return c;
	}

	private static char unescape(char c) {
		return switch (c) {
			case 'n' -> '\n';
			case 't' -> '\t';
			case 'r' -> '\r';
			default -> c;
		};
	}

	private static boolean startsPrefixed(char c) {
		return c == '&' || c == '!' || c == '\'' || c == '"' || c == '[' || c == '(' || c == '.'
			|| TextBuffer.isIdentifierChar(c);
	}
}
