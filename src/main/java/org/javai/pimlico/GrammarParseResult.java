package org.javai.pimlico;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.javai.pimlico.rule.Rule;
import org.javai.pimlico.rule.RulePrinter;
import org.javai.pimlico.rule.RuleWalker;
import org.javai.pimlico.text.SyntaxError;

/**
 * Outcome of parsing a grammar file: the top-level rules that parsed cleanly and every
 * syntax error found, in the order they were discovered.
 *
 * @param indentWidth spaces per nesting level used by {@link #print()}
 */
public record GrammarParseResult(List<Rule> rules, List<SyntaxError> errors, int indentWidth) {

	public GrammarParseResult {
		rules = List.copyOf(rules);
		errors = List.copyOf(errors);
		if (indentWidth <= 0) {
			throw new IllegalArgumentException("indentWidth must be positive: " + indentWidth);
		}
	}

	public GrammarParseResult(List<Rule> rules, List<SyntaxError> errors) {
		this(rules, errors, GrammarOptions.DEFAULT_INDENT_WIDTH);
	}

	public GrammarParseResult withIndentWidth(int indentWidth) {
		return new GrammarParseResult(rules, errors, indentWidth);
	}

	/**
	 * True when the grammar had no syntax errors.
	 */
	public boolean isSuccessful() {
		return errors.isEmpty();
	}

	/**
	 * Looks up a rule by its dotted path, e.g. {@code expression.atom}.
	 */
	public Optional<Rule> find(String qualifiedName) {
		return rules.stream()
			.flatMap(rule -> RuleWalker.flatten(rule).stream())
			.filter(rule -> rule.qualifiedName().equals(qualifiedName))
			.findFirst();
	}

	/**
	 * Number of rules in all trees, top-level and nested.
	 */
	public int ruleCount() {
		return rules.stream().mapToInt(rule -> RuleWalker.flatten(rule).size()).sum();
	}

	public String print() {
		return print(indentWidth);
	}

	/**
	 * Renders every top-level rule, one after the other.
	 */
	public String print(int indentWidth) {
		return rules.stream()
			.map(rule -> {
				String text = RulePrinter.print(rule, indentWidth);
				return rule.isTerminal() ? text + "\n" : text;
			})
			.collect(Collectors.joining());
	}
}
