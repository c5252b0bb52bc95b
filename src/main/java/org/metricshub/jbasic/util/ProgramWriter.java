package org.metricshub.jbasic.util;

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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import org.metricshub.jbasic.intermediate.ProgramLine;
import org.metricshub.jbasic.intermediate.ProgramStore;

/**
 * Saves a program as text: one <code>&lt;line number&gt; &lt;statement&gt;</code>
 * record per line, in ascending order, in the syntax the parser accepts.
 * Loading the text back produces an equivalent program.
 */
public final class ProgramWriter {

	private ProgramWriter() {}

	/**
	 * Writes every line of the program.
	 *
	 * @param program the program to save
	 * @param writer the destination; it is flushed but not closed
	 * @throws IOException on write failure
	 */
	public static void write(ProgramStore program, Writer writer) throws IOException {
		for (ProgramLine line : program) {
			writer.write(line.toString());
			writer.write('\n');
		}
		writer.flush();
	}

	/**
	 * @param program the program to render
	 * @return the saved form of the program
	 */
	public static String toText(ProgramStore program) {
		StringWriter writer = new StringWriter();
		try {
			write(program, writer);
		} catch (IOException e) {
			// StringWriter does not fail
			throw new UncheckedIOException(e);
		}
		return writer.toString();
	}
}
