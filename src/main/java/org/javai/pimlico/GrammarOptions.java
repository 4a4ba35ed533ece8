package org.javai.pimlico;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;

/**
 * Settings for loading and printing grammars.
 * <p>
 * Options can be read from a YAML document:
 *
 * <pre>
 * indent_width: 2
 * charset: ISO-8859-1
 * log_diagnostics: false
 * </pre>
 *
 * Keys that are absent keep their default. The four-space indentation step of the
 * grammar language itself is fixed and not part of these options.
 *
 * @param indentWidth spaces per nesting level when printing rules
 * @param charset encoding used to read grammar files and streams
 * @param logDiagnostics whether the loader logs every syntax error at WARN level
 */
public record GrammarOptions(int indentWidth, Charset charset, boolean logDiagnostics) {

	public static final int DEFAULT_INDENT_WIDTH = 4;

	public GrammarOptions {
		if (indentWidth <= 0) {
			throw new IllegalArgumentException("indentWidth must be positive: " + indentWidth);
		}
		Objects.requireNonNull(charset, "charset must not be null");
	}

	public static GrammarOptions defaults() {
		return new GrammarOptions(DEFAULT_INDENT_WIDTH, StandardCharsets.UTF_8, true);
	}

	public GrammarOptions withIndentWidth(int indentWidth) {
		return new GrammarOptions(indentWidth, charset, logDiagnostics);
	}

	public GrammarOptions withCharset(Charset charset) {
		return new GrammarOptions(indentWidth, charset, logDiagnostics);
	}

	public GrammarOptions withLogDiagnostics(boolean logDiagnostics) {
		return new GrammarOptions(indentWidth, charset, logDiagnostics);
	}

	/**
	 * Reads options from a YAML document.
	 *
	 * @throws GrammarSourceException if the document is not valid YAML or holds invalid values
	 */
	public static GrammarOptions load(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		Map<String, Object> data;
		try {
			data = new Yaml().load(inputStream);
		} catch (Exception e) {
			throw new GrammarSourceException("Failed to parse grammar options", e);
		}
		return fromMap(data);
	}

	static GrammarOptions fromMap(Map<String, Object> data) {
		GrammarOptions options = defaults();
		if (data == null) {
			return options;
		}
		try {
			Object indentWidth = data.get("indent_width");
			if (indentWidth != null) {
				options = options.withIndentWidth((Integer) indentWidth);
			}
			Object charset = data.get("charset");
			if (charset != null) {
				options = options.withCharset(Charset.forName((String) charset));
			}
			Object logDiagnostics = data.get("log_diagnostics");
			if (logDiagnostics != null) {
				options = options.withLogDiagnostics((Boolean) logDiagnostics);
			}
		} catch (RuntimeException e) {
			throw new GrammarSourceException("Invalid grammar options: " + data, e);
		}
		return options;
	}
}
