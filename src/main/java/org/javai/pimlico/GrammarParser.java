package org.javai.pimlico;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.pimlico.rule.Rule;
import org.javai.pimlico.rule.RuleParser;
import org.javai.pimlico.text.GrammarLogicException;
import org.javai.pimlico.text.SyntaxError;
import org.javai.pimlico.text.TextBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a whole grammar: a sequence of top-level rules separated by any number of blank
 * lines. A malformed top-level rule is reported and skipped, and parsing resumes with the
 * next rule that starts at column one.
 */
public class GrammarParser {

	private static final Logger logger = LoggerFactory.getLogger(GrammarParser.class);

	private final RuleParser ruleParser;

	public GrammarParser() {
		this(new RuleParser());
	}

	public GrammarParser(RuleParser ruleParser) {
		this.ruleParser = Objects.requireNonNull(ruleParser, "ruleParser must not be null");
	}

	/**
	 * Parses grammar source text.
	 *
	 * @throws GrammarLogicException on an internal invariant violation
	 */
	public GrammarParseResult parse(String source) {
		TextBuffer buffer = new TextBuffer(source);
		List<SyntaxError> errors = new ArrayList<>();
		List<Rule> rules = new ArrayList<>();

		while (true) {
			buffer.skipSpace(true);
			if (buffer.endReached()) {
				break;
			}

			if (!TextBuffer.isIdentifierChar(buffer.peek())) {
				errors.add(SyntaxError.at("expected rule name", buffer));
				buffer.skipBlock(0);
				continue;
			}

			Optional<Rule> rule = ruleParser.parse(buffer, errors);
			if (rule.isEmpty()) {
				logger.debug("Top-level rule at line {} failed; resuming at next rule", buffer.position().line());
				buffer.skipBlock(0);
			} else if (!buffer.atLineEnd()) {
				throw new GrammarLogicException("incomplete rule parse", buffer);
			} else {
				rules.add(rule.get());
			}
		}

		return new GrammarParseResult(rules, errors);
	}
}
