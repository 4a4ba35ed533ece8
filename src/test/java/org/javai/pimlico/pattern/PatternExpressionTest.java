package org.javai.pimlico.pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.javai.pimlico.pattern.PatternExpression.CharacterClass;
import org.javai.pimlico.pattern.PatternExpression.CharacterClass.Range;
import org.javai.pimlico.pattern.PatternExpression.Literal;
import org.javai.pimlico.pattern.PatternExpression.Sequence;
import org.javai.pimlico.text.SyntaxError;
import org.javai.pimlico.text.TextBuffer;
import org.junit.jupiter.api.Test;

class PatternExpressionTest {

	private static PatternExpression parse(String input) {
		List<SyntaxError> errors = new ArrayList<>();
		PatternExpression expression = new PatternParser().parse(new TextBuffer(input), errors, true).orElseThrow();
		assertThat(errors).isEmpty();
		return expression;
	}

	@Test
	void renderKeepsCanonicalSourceUnchanged() {
		String source = "'a' ('b' | c.d)* !'e' &[^0-9]+ .?";

		assertThat(parse(source).render()).isEqualTo(source);
	}

	@Test
	void renderDropsRedundantParentheses() {
		assertThat(parse("(('a') (b))").render()).isEqualTo("'a' b");
	}

	@Test
	void renderParenthesisesNestedLookahead() {
		assertThat(parse("!(&'a')").render()).isEqualTo("!(&'a')");
	}

	@Test
	void renderedTextParsesBackToAnEqualExpression() {
		PatternExpression expression = parse("\"it's\" ([\\]\\-] | ('x' | 'y') 'z')+");

		assertThat(parse(expression.render())).isEqualTo(expression);
	}

	@Test
	void literalRenderingEscapesQuotesAndControlCharacters() {
		assertThat(new Literal("it's\n\\").render()).isEqualTo("'it\\'s\\n\\\\'");
	}

	@Test
	void characterClassRenderingEscapesSpecialCharacters() {
		CharacterClass characterClass = new CharacterClass(
			List.of(Range.of(']'), Range.of('^'), new Range('a', 'f')), true);

		assertThat(characterClass.render()).isEqualTo("[^\\]\\^a-f]");
	}

	@Test
	void compositeExpressionsRejectDegenerateShapes() {
		assertThatThrownBy(() -> new Sequence(List.of(new Literal("a"))))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new CharacterClass(List.of(), false))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new Range('z', 'a'))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
