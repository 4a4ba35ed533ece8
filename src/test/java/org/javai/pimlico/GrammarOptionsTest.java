package org.javai.pimlico;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class GrammarOptionsTest {

	private static InputStream yaml(String content) {
		return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void defaults() {
		GrammarOptions options = GrammarOptions.defaults();

		assertThat(options.indentWidth()).isEqualTo(4);
		assertThat(options.charset()).isEqualTo(StandardCharsets.UTF_8);
		assertThat(options.logDiagnostics()).isTrue();
	}

	@Test
	void loadFromYamlResource() throws IOException {
		try (InputStream stream = getClass().getClassLoader().getResourceAsStream("pimlico-options.yml")) {
			GrammarOptions options = GrammarOptions.load(stream);

			assertThat(options.indentWidth()).isEqualTo(2);
			assertThat(options.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
			assertThat(options.logDiagnostics()).isFalse();
		}
	}

	@Test
	void absentKeysKeepTheirDefaults() {
		GrammarOptions options = GrammarOptions.load(yaml("indent_width: 8\n"));

		assertThat(options).isEqualTo(GrammarOptions.defaults().withIndentWidth(8));
	}

	@Test
	void emptyDocumentYieldsDefaults() {
		assertThat(GrammarOptions.load(yaml(""))).isEqualTo(GrammarOptions.defaults());
	}

	@Test
	void invalidValuesAreRejected() {
		assertThatThrownBy(() -> GrammarOptions.load(yaml("indent_width: zero\n")))
			.isInstanceOf(GrammarSourceException.class);
		assertThatThrownBy(() -> GrammarOptions.load(yaml("indent_width: 0\n")))
			.isInstanceOf(GrammarSourceException.class)
			.hasRootCauseInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> GrammarOptions.load(yaml("charset: no-such-charset\n")))
			.isInstanceOf(GrammarSourceException.class);
	}

	@Test
	void malformedYamlIsRejected() {
		assertThatThrownBy(() -> GrammarOptions.load(yaml("indent_width: [\n")))
			.isInstanceOf(GrammarSourceException.class)
			.hasMessage("Failed to parse grammar options");
	}

	@Test
	void optionsPrintGrammarsWithTheirIndentWidth() {
		GrammarOptions options = GrammarOptions.defaults().withIndentWidth(2);

		GrammarParseResult result = new GrammarLoader(options).loadString("a...\n    b: 'x'\n");

		assertThat(result.print()).isEqualTo("a...\n  b: 'x'\n");
	}

	@Test
	void constructorRejectsNonPositiveIndentWidth() {
		assertThatThrownBy(() -> new GrammarOptions(0, StandardCharsets.UTF_8, true))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
