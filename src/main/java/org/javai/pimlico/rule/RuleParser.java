package org.javai.pimlico.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.pimlico.pattern.PatternExpression;
import org.javai.pimlico.pattern.PatternParser;
import org.javai.pimlico.text.GrammarLogicException;
import org.javai.pimlico.text.Position;
import org.javai.pimlico.text.SyntaxError;
import org.javai.pimlico.text.TextBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for one rule and its subtree.
 * <p>
 * Malformed input does not stop the parse: problems are appended to the error list and
 * the parser skips the broken block so that later siblings still get checked. A rule
 * whose header or subtree had any problem is not returned, even if some of its children
 * parsed cleanly. An empty result is always accompanied by at least one new error.
 * <p>
 * Conditions that cannot arise from any input, such as a header without a name after
 * the indentation check passed, raise {@link GrammarLogicException} instead.
 */
public class RuleParser {

	private static final Logger logger = LoggerFactory.getLogger(RuleParser.class);

	/**
	 * Spaces per nesting level.
	 */
	public static final int INDENT_STEP = 4;

	private final PatternParser patternParser;

	public RuleParser() {
		this(new PatternParser());
	}

	public RuleParser(PatternParser patternParser) {
		this.patternParser = Objects.requireNonNull(patternParser, "patternParser must not be null");
	}

	/**
	 * Parses a root rule.
	 *
	 * @see #parse(TextBuffer, List, int)
	 */
	public Optional<Rule> parse(TextBuffer buffer, List<SyntaxError> errors) {
		return parse(buffer, errors, 0);
	}

	/**
	 * Parses the rule whose header starts at the cursor.
	 *
	 * @param buffer cursor on the first character of the rule name
	 * @param errors list receiving diagnostics, in discovery order
	 * @param depth nesting level the header is expected at; its indentation must be
	 *        exactly {@code 4 * depth} spaces
	 * @return the rule, or empty when it or anything below it was malformed
	 * @throws GrammarLogicException on an internal invariant violation
	 */
	public Optional<Rule> parse(TextBuffer buffer, List<SyntaxError> errors, int depth) {
		Objects.requireNonNull(buffer, "buffer must not be null");
		Objects.requireNonNull(errors, "errors must not be null");
		if (depth < 0) {
			throw new IllegalArgumentException("depth must not be negative: " + depth);
		}

		Position position = buffer.position();

		int indentation = buffer.indentation();
		if (indentation % INDENT_STEP != 0) {
			errors.add(SyntaxError.at("invalid indentation level", buffer));
			return Optional.empty();
		}
		if (indentation != depth * INDENT_STEP) {
			errors.add(SyntaxError.at("unexpected indentation increase", buffer));
			return Optional.empty();
		}

		String name = buffer.readIdentifier();
		if (name.isEmpty()) {
			throw new GrammarLogicException("no rule found", buffer);
		}

		buffer.skipSpace();
		if (buffer.read(':')) {
			return parseTerminal(buffer, errors, depth, name, position);
		}
		if (buffer.read("...")) {
			return parseNonTerminal(buffer, errors, depth, name, position);
		}

		errors.add(SyntaxError.at("expected ':' or '...'", buffer));
		recover(buffer, depth);
		return Optional.empty();
	}

	private Optional<Rule> parseTerminal(TextBuffer buffer, List<SyntaxError> errors, int depth,
			String name, Position position) {
		buffer.skipSpace(true);
		Optional<PatternExpression> expression = patternParser.parse(buffer, errors, true);
		if (expression.isEmpty()) {
			recover(buffer, depth);
			return Optional.empty();
		}
		return Optional.of(new TerminalRule(name, position, expression.get()));
	}

	private Optional<Rule> parseNonTerminal(TextBuffer buffer, List<SyntaxError> errors, int depth,
			String name, Position position) {
		boolean failed = false;

		buffer.skipSpace();
		if (!buffer.atLineEnd()) {
			errors.add(SyntaxError.at("trailing characters after '...'", buffer));
			failed = true;
			buffer.skipLine();
		}

		List<Rule> children = new ArrayList<>();
		while (true) {
			int delta = buffer.indentationDelta(position.line());
			if (delta <= 0) {
				break;
			}
			buffer.skipSpace(true);

			// a deeper jump abandons the whole block, unlike a failed child
			if (delta != INDENT_STEP) {
				errors.add(SyntaxError.at("unexpected indentation increase", buffer));
				recover(buffer, depth);
				return Optional.empty();
			}
			if (!TextBuffer.isIdentifierChar(buffer.peek())) {
				errors.add(SyntaxError.at("expected rule name", buffer));
				recover(buffer, depth + 1);
				failed = true;
				continue;
			}

			Optional<Rule> child = parse(buffer, errors, depth + 1);
			if (child.isEmpty()) {
				recover(buffer, depth + 1);
				failed = true;
			} else if (!buffer.atLineEnd()) {
				throw new GrammarLogicException("incomplete rule parse", buffer);
			} else {
				ScopePropagator.attach(name, child.get());
				children.add(child.get());
			}
		}

		if (failed) {
			return Optional.empty();
		}
		if (children.isEmpty()) {
			buffer.restore(position);
			errors.add(SyntaxError.at("no children found for name-extended rule '" + name + "'", buffer));
			return Optional.empty();
		}
		return Optional.of(new NonTerminalRule(name, position, children));
	}

	private void recover(TextBuffer buffer, int depth) {
		logger.trace("Skipping malformed block at {} (depth {})", buffer.position(), depth);
		buffer.skipBlock(depth * INDENT_STEP);
	}
}
