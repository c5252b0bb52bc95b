package org.metricshub.jbasic.frontend;

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
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jbasic.frontend.ast.ParserException;
import org.metricshub.jbasic.intermediate.ProgramStore;
import org.metricshub.jbasic.util.BasicLogger;
import org.metricshub.jbasic.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Loads a program from text made of <code>&lt;line number&gt; &lt;statement&gt;</code>
 * records, one per line.
 * <p>
 * Every record is parsed on its own: a record that fails is reported as a
 * {@link LoadFailure} and does not prevent the following records from
 * loading. Blank records are skipped. A record with a line number and no
 * statement deletes that line, the same as when typed interactively.
 */
public class ProgramLoader {

	private static final Logger LOGGER = BasicLogger.getLogger(ProgramLoader.class);

	private final BasicParser parser = new BasicParser();

	/**
	 * Loads the program text of a {@link ScriptSource}, closing its reader.
	 *
	 * @param source where the program text comes from
	 * @return the loaded program and the failures
	 * @throws IOException upon an IO error
	 */
	public LoadResult load(ScriptSource source) throws IOException {
		try (Reader reader = source.getReader()) {
			LoadResult result = load(reader);
			LOGGER.debug(
					"Loaded {} lines from {} ({} failures)",
					result.getProgram().size(),
					source.getDescription(),
					result.getFailures().size());
			return result;
		}
	}

	/**
	 * Loads program text into a fresh {@link ProgramStore}.
	 *
	 * @param reader the program text; not closed
	 * @return the loaded program and the failures
	 * @throws IOException upon an IO error
	 */
	public LoadResult load(Reader reader) throws IOException {
		ProgramStore program = new ProgramStore();
		List<LoadFailure> failures = new ArrayList<LoadFailure>();
		BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		String text;
		int sourceLine = 0;
		while ((text = lines.readLine()) != null) {
			sourceLine++;
			if (text.trim().isEmpty()) {
				continue;
			}
			try {
				ParsedLine parsed = parser.parseLine(text);
				if (!parsed.isNumbered()) {
					throw new ParserException("Missing line number", ParserException.NO_LINE);
				}
				if (parsed.isEmpty()) {
					program.remove(parsed.getLineNumber());
				} else {
					program.insertOrReplace(parsed.getLineNumber(), parsed.getStatement());
				}
			} catch (ParserException e) {
				LoadFailure failure = new LoadFailure(sourceLine, text, e);
				LOGGER.warn("Skipping record {}: {}", sourceLine, failure);
				failures.add(failure);
			}
		}
		return new LoadResult(program, failures);
	}
}
