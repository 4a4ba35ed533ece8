package org.javai.pimlico.rule;

/**
 * Visitor over the two rule shapes.
 *
 * @param <R> the return type of the visitor operations
 */
public interface RuleVisitor<R> {

	R visitTerminal(TerminalRule rule);

	R visitNonTerminal(NonTerminalRule rule);
}
