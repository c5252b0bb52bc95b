package org.metricshub.jbasic.jsr223;

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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jbasic.Basic;
import org.metricshub.jbasic.backend.ExecutionResult;
import org.metricshub.jbasic.frontend.LoadFailure;
import org.metricshub.jbasic.frontend.LoadResult;
import org.metricshub.jbasic.util.BasicSettings;
import org.metricshub.jbasic.util.ScriptSource;

/**
 * Simple JSR-223 script engine for JBasic. The script is a whole program;
 * <code>INPUT</code> reads from the <code>input</code> attribute of the
 * context (a {@link String} or an {@link InputStream}).
 */
public class BasicScriptEngine extends AbstractScriptEngine {

	private final ScriptEngineFactory factory;

	public BasicScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		BasicSettings settings = new BasicSettings();
		Object inObj = context.getAttribute("input");
		if (inObj instanceof InputStream) {
			settings.setInput((InputStream) inObj);
		} else if (inObj instanceof String) {
			settings.setInput(new ByteArrayInputStream(((String) inObj).getBytes(StandardCharsets.UTF_8)));
		} else {
			settings.setInput(new ByteArrayInputStream(new byte[0]));
		}
		settings.setPromptForInput(false);
		ByteArrayOutputStream result = new ByteArrayOutputStream();
		settings.setOutputStream(new PrintStream(result, true, StandardCharsets.UTF_8));

		Basic basic = new Basic(settings);
		ExecutionResult executionResult;
		try {
			LoadResult loaded = basic.load(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, scriptReader));
			if (loaded.hasFailures()) {
				LoadFailure first = loaded.getFailures().get(0);
				throw new ScriptException(first.toString(), ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, first.getLineNumber());
			}
			executionResult = basic.run();
		} catch (IOException e) {
			throw new ScriptException(e);
		}

		String out = result.toString(StandardCharsets.UTF_8);
		if (executionResult.isAborted()) {
			ScriptException e = new ScriptException(
					executionResult.getError().getMessage(),
					ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT,
					executionResult.getLineNumber());
			e.initCause(executionResult.getError());
			throw e;
		}
		try {
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
		} catch (IOException e) {
			throw new ScriptException(e);
		}
		return out;
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
