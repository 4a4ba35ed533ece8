package org.javai.pimlico.rule;

/**
 * Renders a rule tree back to grammar source form for inspection.
 * <p>
 * Each rule is indented by one unit per entry in its scope. A terminal rule is written as
 * {@code name: expression} without a line break of its own; its parent ends the line.
 * A name-extended rule is written as {@code name...} followed by its children.
 */
public class RulePrinter implements RuleVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private final String indentUnit;

	public RulePrinter() {
		this(RuleParser.INDENT_STEP);
	}

	public RulePrinter(int indentWidth) {
		if (indentWidth <= 0) {
			throw new IllegalArgumentException("indentWidth must be positive: " + indentWidth);
		}
		this.indentUnit = " ".repeat(indentWidth);
	}

	@Override
	public Void visitTerminal(TerminalRule rule) {
		indent(rule);
		output.append(rule.name()).append(": ").append(rule.expression().render());
		return null;
	}

	@Override
	public Void visitNonTerminal(NonTerminalRule rule) {
		indent(rule);
		output.append(rule.name()).append("...\n");
		for (Rule child : rule.children()) {
			child.accept(this);
			if (child.isTerminal()) {
				output.append('\n');
			}
		}
		return null;
	}

	private void indent(Rule rule) {
		output.append(indentUnit.repeat(rule.scope().size()));
	}

	/**
	 * Returns the rendered output.
	 */
	public String toString() {
		return output.toString();
	}

	/**
	 * Static convenience method to render a rule with the default indent unit.
	 */
	public static String print(Rule rule) {
		return print(rule, RuleParser.INDENT_STEP);
	}

	public static String print(Rule rule, int indentWidth) {
		RulePrinter printer = new RulePrinter(indentWidth);
		rule.accept(printer);
		return printer.toString();
	}
}
