package org.javai.pimlico.rule;

import org.javai.pimlico.pattern.PatternExpression;
import org.javai.pimlico.text.Position;

/**
 * A rule written as {@code name: expression}.
 */
public final class TerminalRule extends Rule {

	private final PatternExpression expression;

	TerminalRule(String name, Position position, PatternExpression expression) {
		super(name, position);
		if (expression == null) {
			throw new IllegalArgumentException("Terminal rule '" + name + "' needs an expression");
		}
		this.expression = expression;
	}

	public PatternExpression expression() {
		return expression;
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	@Override
	public <R> R accept(RuleVisitor<R> visitor) {
		return visitor.visitTerminal(this);
	}
}
