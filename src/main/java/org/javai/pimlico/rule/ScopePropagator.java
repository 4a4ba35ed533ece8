package org.javai.pimlico.rule;

/**
 * Appends an enclosing rule's name to the scope of a finished subtree.
 * <p>
 * The parser applies this to each child as soon as it is accepted, so the immediate
 * parent's name lands in the scope before the names of outer rules, which are appended
 * later as their own parses complete.
 */
final class ScopePropagator implements RuleVisitor<Void> {

	private final String ancestor;

	private ScopePropagator(String ancestor) {
		this.ancestor = ancestor;
	}

	static void attach(String ancestor, Rule rule) {
		rule.accept(new ScopePropagator(ancestor));
	}

	@Override
	public Void visitTerminal(TerminalRule rule) {
		rule.addScope(ancestor);
		return null;
	}

	@Override
	public Void visitNonTerminal(NonTerminalRule rule) {
		rule.addScope(ancestor);
		for (Rule child : rule.children()) {
			child.accept(this);
		}
		return null;
	}
}
