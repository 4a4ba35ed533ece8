package org.javai.pimlico.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.javai.pimlico.pattern.PatternExpression.AnyCharacter;
import org.javai.pimlico.text.Position;
import org.junit.jupiter.api.Test;

class RuleTest {

	private static final Position START = new Position(0, 1, 1);

	@Test
	void namesAreLowercaseLettersAndUnderscores() {
		assertThat(new TerminalRule("snake_case", START, new AnyCharacter()).name()).isEqualTo("snake_case");

		assertThatThrownBy(() -> new TerminalRule("Camel", START, new AnyCharacter()))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new TerminalRule("", START, new AnyCharacter()))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new TerminalRule("digit2", START, new AnyCharacter()))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void terminalRuleNeedsAnExpression() {
		assertThatThrownBy(() -> new TerminalRule("x", START, null))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void nameExtendedRuleNeedsChildren() {
		assertThatThrownBy(() -> new NonTerminalRule("x", START, List.of()))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("at least one child");
	}

	@Test
	void visitorDispatchesOnShape() {
		TerminalRule leaf = new TerminalRule("leaf", START, new AnyCharacter());
		NonTerminalRule group = new NonTerminalRule("group", START, List.of(leaf));
		RuleVisitor<String> shape = new RuleVisitor<>() {

			@Override
			public String visitTerminal(TerminalRule rule) {
				return "terminal";
			}

			@Override
			public String visitNonTerminal(NonTerminalRule rule) {
				return "non-terminal";
			}
		};

		assertThat(leaf.accept(shape)).isEqualTo("terminal");
		assertThat(group.accept(shape)).isEqualTo("non-terminal");
		assertThat(leaf.isTerminal()).isTrue();
		assertThat(group.isTerminal()).isFalse();
	}

	@Test
	void scopeIsReadOnlyFromOutside() {
		TerminalRule leaf = new TerminalRule("leaf", START, new AnyCharacter());

		assertThatThrownBy(() -> leaf.scope().add("intruder"))
			.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void childrenAreCopiedAndUnmodifiable() {
		TerminalRule leaf = new TerminalRule("leaf", START, new AnyCharacter());
		NonTerminalRule group = new NonTerminalRule("group", START, new ArrayList<>(List.of(leaf)));

		assertThatThrownBy(() -> group.children().clear())
			.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void scopePropagatorReachesEveryDescendant() {
		TerminalRule leaf = new TerminalRule("leaf", START, new AnyCharacter());
		TerminalRule other = new TerminalRule("other", START, new AnyCharacter());
		ScopePropagator.attach("mid", leaf);
		ScopePropagator.attach("mid", other);
		NonTerminalRule mid = new NonTerminalRule("mid", START, List.of(leaf, other));

		ScopePropagator.attach("top", mid);

		assertThat(mid.scope()).containsExactly("top");
		assertThat(leaf.scope()).containsExactly("mid", "top");
		assertThat(other.scope()).containsExactly("mid", "top");
		assertThat(leaf.depth()).isEqualTo(2);
		assertThat(leaf.qualifiedName()).isEqualTo("top.mid.leaf");
	}
}
