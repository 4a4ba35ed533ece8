package org.javai.pimlico.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SyntaxErrorTest {

	@Test
	void capturesPositionAndLineFromBuffer() {
		TextBuffer buffer = new TextBuffer("first\nroot... junk\n");
		buffer.read("first\nroot... ");

		SyntaxError error = SyntaxError.at("trailing characters after '...'", buffer);

		assertThat(error.position()).isEqualTo(new Position(14, 2, 9));
		assertThat(error.line()).isEqualTo("root... junk");
		assertThat(error).hasToString("[2:9] trailing characters after '...'");
	}

	@Test
	void formatPointsAtTheColumn() {
		SyntaxError error = new SyntaxError("trailing characters after '...'", new Position(8, 1, 9), "root... junk");

		assertThat(error.format()).isEqualTo(
			"1:9: trailing characters after '...'\n"
				+ "root... junk\n"
				+ "        ^");
	}
}
