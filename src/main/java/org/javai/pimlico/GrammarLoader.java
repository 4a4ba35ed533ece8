package org.javai.pimlico;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.javai.pimlico.text.SyntaxError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads grammar sources from files, streams and the classpath and parses them.
 * <p>
 * Syntax errors do not raise exceptions: they are returned in the
 * {@link GrammarParseResult} and, unless disabled in the options, logged. Only failures
 * to read the source raise {@link GrammarSourceException}.
 */
public class GrammarLoader {

	private static final Logger logger = LoggerFactory.getLogger(GrammarLoader.class);

	private final GrammarParser parser;
	private final GrammarOptions options;

	public GrammarLoader() {
		this(GrammarOptions.defaults());
	}

	public GrammarLoader(GrammarOptions options) {
		this(new GrammarParser(), options);
	}

	public GrammarLoader(GrammarParser parser, GrammarOptions options) {
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public GrammarOptions options() {
		return options;
	}

	/**
	 * Load a grammar file.
	 */
	public GrammarParseResult load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path, options.charset())) {
			return parse(readFully(reader), path.toString());
		} catch (IOException e) {
			throw new GrammarSourceException("Failed to read grammar from path: " + path, e);
		}
	}

	/**
	 * Load a grammar from an input stream using the configured charset. The stream is not closed.
	 */
	public GrammarParseResult load(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		try {
			return parse(readFully(decoding(inputStream)), "input stream");
		} catch (IOException e) {
			throw new GrammarSourceException("Failed to read grammar from input stream", e);
		}
	}

	/**
	 * Load a grammar from a reader. The reader is not closed.
	 */
	public GrammarParseResult load(Reader reader) {
		Objects.requireNonNull(reader, "reader must not be null");
		try {
			return parse(readFully(reader), "reader");
		} catch (IOException e) {
			throw new GrammarSourceException("Failed to read grammar from reader", e);
		}
	}

	/**
	 * Load a grammar from a classpath resource using this class' loader.
	 */
	public GrammarParseResult loadResource(String resourcePath) {
		return loadResource(resourcePath, GrammarLoader.class.getClassLoader());
	}

	/**
	 * Load a grammar from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 */
	public GrammarParseResult loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return parse(readFully(decoding(is)), resourcePath);
		} catch (IOException e) {
			throw new GrammarSourceException("Failed to read grammar resource: " + resourcePath, e);
		}
	}

	/**
	 * Parse grammar text held in memory.
	 */
	public GrammarParseResult loadString(String source) {
		Objects.requireNonNull(source, "source must not be null");
		return parse(source, "string");
	}

	private GrammarParseResult parse(String source, String origin) {
		GrammarParseResult result = parser.parse(source).withIndentWidth(options.indentWidth());
		if (result.isSuccessful()) {
			logger.debug("Parsed {} rules ({} top-level) from {}", result.ruleCount(), result.rules().size(), origin);
			return result;
		}

		logger.debug("Grammar from {} has {} syntax errors", origin, result.errors().size());
		if (options.logDiagnostics()) {
			for (SyntaxError error : result.errors()) {
				logger.warn("{}: {}", origin, error);
			}
		}
		return result;
	}

	// malformed input raises CharacterCodingException instead of decoding to U+FFFD
	private Reader decoding(InputStream inputStream) {
		CharsetDecoder decoder = options.charset().newDecoder()
			.onMalformedInput(CodingErrorAction.REPORT)
			.onUnmappableCharacter(CodingErrorAction.REPORT);
		return new InputStreamReader(inputStream, decoder);
	}

	private static String readFully(Reader reader) throws IOException {
		StringWriter writer = new StringWriter();
		reader.transferTo(writer);
		return writer.toString();
	}
}
