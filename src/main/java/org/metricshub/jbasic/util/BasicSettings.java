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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a BASIC session.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when running programs from within Java code.
 */
@SuppressFBWarnings({ "EI_EXPOSE_REP", "EI_EXPOSE_REP2" })
public class BasicSettings {

	/**
	 * Where program input (and interactive lines) is read from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Text written before each value requested by <code>INPUT</code>.
	 */
	private String inputPrompt = "? ";

	/**
	 * Whether <code>INPUT</code> writes {@link #inputPrompt};
	 * <code>true</code> by default.
	 */
	private boolean promptForInput = true;

	/**
	 * Banner written when an interactive session starts.
	 */
	private String readyMessage = "Ready.";

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("inputPrompt = ").append(getInputPrompt()).append(newLine);
		desc.append("promptForInput = ").append(isPromptForInput()).append(newLine);
		desc.append("readyMessage = ").append(getReadyMessage()).append(newLine);

		return desc.toString();
	}

	public InputStream getInput() {
		return input;
	}

	public void setInput(InputStream input) {
		this.input = input;
	}

	public PrintStream getOutputStream() {
		return outputStream;
	}

	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public String getInputPrompt() {
		return inputPrompt;
	}

	public void setInputPrompt(String inputPrompt) {
		this.inputPrompt = inputPrompt;
	}

	public boolean isPromptForInput() {
		return promptForInput;
	}

	public void setPromptForInput(boolean promptForInput) {
		this.promptForInput = promptForInput;
	}

	public String getReadyMessage() {
		return readyMessage;
	}

	public void setReadyMessage(String readyMessage) {
		this.readyMessage = readyMessage;
	}
}
