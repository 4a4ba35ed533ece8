package org.javai.pimlico.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import org.javai.pimlico.text.Position;

/**
 * A named production in a grammar tree.
 * <p>
 * A rule is either a {@link TerminalRule}, binding its name to one pattern expression, or
 * a {@link NonTerminalRule}, grouping child rules indented one level deeper. Use
 * {@link #accept(RuleVisitor)} to handle the two shapes exhaustively.
 * <p>
 * Rules are built by {@link RuleParser} and are immutable once returned, except for the
 * scope chain, which each enclosing rule extends with its own name after accepting the
 * subtree.
 */
public abstract sealed class Rule permits TerminalRule, NonTerminalRule {

	private static final Pattern NAME = Pattern.compile("[a-z_]+");

	private final String name;
	private final Position position;
	private final List<String> scope = new ArrayList<>();

	Rule(String name, Position position) {
		if (name == null || !NAME.matcher(name).matches()) {
			throw new IllegalArgumentException("Invalid rule name: '" + name + "'");
		}
		if (position == null) {
			throw new IllegalArgumentException("Rule position cannot be null");
		}
		this.name = name;
		this.position = position;
	}

	public String name() {
		return name;
	}

	/**
	 * Location of the rule's header.
	 */
	public Position position() {
		return position;
	}

	/**
	 * Names of the enclosing rules, nearest first. Empty for the root of a parse.
	 */
	public List<String> scope() {
		return Collections.unmodifiableList(scope);
	}

	/**
	 * Nesting depth below the root of the parse that produced this rule.
	 */
	public int depth() {
		return scope.size();
	}

	/**
	 * Dotted path from the outermost enclosing rule down to this one, e.g. {@code expr.atom}.
	 */
	public String qualifiedName() {
		StringBuilder sb = new StringBuilder();
		for (int index = scope.size() - 1; index >= 0; index--) {
			sb.append(scope.get(index)).append('.');
		}
		return sb.append(name).toString();
	}

	public abstract boolean isTerminal();

	public abstract <R> R accept(RuleVisitor<R> visitor);

	void addScope(String ancestor) {
		scope.add(ancestor);
	}

	@Override
	public String toString() {
		return RulePrinter.print(this);
	}
}
