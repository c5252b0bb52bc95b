package org.metricshub.jbasic.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JBasic
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import org.metricshub.jbasic.util.BasicLogger;
import org.slf4j.Logger;

/**
 * {@link InputSource} reading one entry per line from a
 * {@link BufferedReader}, optionally writing a prompt before each request.
 * <p>
 * The same reader also serves the lines of an interactive session (see
 * {@link #readLine()}), so that program input and session commands are
 * read from one buffer.
 */
public class ReaderInputSource implements InputSource {

	private static final Logger LOGGER = BasicLogger.getLogger(ReaderInputSource.class);

	/** Decimal integer with an optional sign, ASCII digits only. */
	private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

	private final BufferedReader reader;
	private final OutputSink promptSink;
	private final String prompt;

	/**
	 * @param reader where entries are read from
	 * @param promptSink where the prompt is written, {@code null} for no prompt
	 * @param prompt the prompt text, e.g. <code>"? "</code>
	 */
	public ReaderInputSource(BufferedReader reader, OutputSink promptSink, String prompt) {
		this.reader = reader;
		this.promptSink = promptSink;
		this.prompt = prompt;
	}

	@Override
	public OptionalInt readInteger(char variable) {
		if (promptSink != null && prompt != null) {
			promptSink.print(prompt);
		}
		String line;
		try {
			line = reader.readLine();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read a value for " + variable, e);
		}
		if (line == null) {
			throw new BasicRuntimeException(RuntimeError.END_OF_INPUT, "No input left for " + variable);
		}
		String text = line.trim();
		if (!INTEGER.matcher(text).matches()) {
			LOGGER.debug("Rejected input '{}' for {}", line, variable);
			return OptionalInt.empty();
		}
		try {
			return OptionalInt.of(Integer.parseInt(text));
		} catch (NumberFormatException e) {
			LOGGER.debug("Rejected input '{}' for {}", line, variable);
			return OptionalInt.empty();
		}
	}

	/**
	 * Reads one raw line from the underlying reader.
	 *
	 * @return the line, or {@code null} at the end of the input
	 * @throws IOException on read failure
	 */
	public String readLine() throws IOException {
		return reader.readLine();
	}
}
