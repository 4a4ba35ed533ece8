package org.javai.pimlico.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for walking rule trees with visitors.
 */
public final class RuleWalker {

	private static final RuleVisitor<List<Rule>> CHILDREN = new RuleVisitor<>() {

		@Override
		public List<Rule> visitTerminal(TerminalRule rule) {
			return List.of();
		}

		@Override
		public List<Rule> visitNonTerminal(NonTerminalRule rule) {
			return rule.children();
		}
	};

	private RuleWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits a rule before its children, depth-first.
	 *
	 * @return the result of visiting the root rule
	 */
	public static <R> R walkPreOrder(Rule rule, RuleVisitor<R> visitor) {
		if (rule == null) {
			return null;
		}

		R result = rule.accept(visitor);
		for (Rule child : rule.accept(CHILDREN)) {
			walkPreOrder(child, visitor);
		}
		return result;
	}

	/**
	 * Visits a rule after its children, depth-first.
	 *
	 * @return the result of visiting the root rule
	 */
	public static <R> R walkPostOrder(Rule rule, RuleVisitor<R> visitor) {
		if (rule == null) {
			return null;
		}

		for (Rule child : rule.accept(CHILDREN)) {
			walkPostOrder(child, visitor);
		}
		return rule.accept(visitor);
	}

	/**
	 * Collects a rule and all its descendants in pre-order.
	 */
	public static List<Rule> flatten(Rule rule) {
		List<Rule> rules = new ArrayList<>();
		walkPreOrder(rule, new RuleVisitor<Void>() {

			@Override
			public Void visitTerminal(TerminalRule terminal) {
				rules.add(terminal);
				return null;
			}

			@Override
			public Void visitNonTerminal(NonTerminalRule nonTerminal) {
				rules.add(nonTerminal);
				return null;
			}
		});
		return rules;
	}
}
