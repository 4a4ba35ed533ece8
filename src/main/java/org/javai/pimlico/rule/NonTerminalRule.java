package org.javai.pimlico.rule;

import java.util.List;
import org.javai.pimlico.text.Position;

/**
 * A rule written as {@code name...}, followed by its children on the lines below,
 * each indented four spaces deeper.
 */
public final class NonTerminalRule extends Rule {

	private final List<Rule> children;

	NonTerminalRule(String name, Position position, List<Rule> children) {
		super(name, position);
		if (children == null || children.isEmpty()) {
			throw new IllegalArgumentException("Name-extended rule '" + name + "' needs at least one child");
		}
		this.children = List.copyOf(children);
	}

	/**
	 * Child rules in source order; never empty.
	 */
	public List<Rule> children() {
		return children;
	}

	@Override
	public boolean isTerminal() {
		return false;
	}

	@Override
	public <R> R accept(RuleVisitor<R> visitor) {
		return visitor.visitNonTerminal(this);
	}
}
