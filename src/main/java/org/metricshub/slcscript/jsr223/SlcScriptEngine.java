package org.metricshub.slcscript.jsr223;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * SLC Script
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
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Collection;
import java.util.Objects;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.slcscript.ScriptResult;
import org.metricshub.slcscript.SlcScript;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.CommandRegistry;
import org.metricshub.slcscript.commands.CommandSender;
import org.metricshub.slcscript.commands.PrintCommand;
import org.metricshub.slcscript.commands.SimpleCommandSender;
import org.metricshub.slcscript.iterables.IterableRegistry;
import org.metricshub.slcscript.util.ScriptSettings;
import org.metricshub.slcscript.util.ScriptSource;

/**
 * Simple JSR-223 script engine for SLC Script.
 * <p>
 * Recognized attributes: <code>arguments</code> (<code>String[]</code> or a
 * collection), <code>sender</code>, <code>commands</code> and
 * <code>iterables</code>. Without <code>commands</code>, scripts can use
 * <code>print</code>, which writes to the context writer; the printed text is
 * also the value of {@link #eval(Reader, ScriptContext)}. Delayed expressions
 * run immediately.
 * </p>
 */
public class SlcScriptEngine extends AbstractScriptEngine {

	public static final String ARGUMENTS = "arguments";
	public static final String SENDER = "sender";
	public static final String COMMANDS = "commands";
	public static final String ITERABLES = "iterables";

	static final String SENDER_NAME = "script";

	private final ScriptEngineFactory factory;

	public SlcScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		String source;
		try {
			source = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, scriptReader).readText();
		} catch (IOException e) {
			throw new ScriptException(e);
		}

		StringWriter printed = new StringWriter();
		CommandRegistry commands = getAttribute(context, COMMANDS, CommandRegistry.class);
		if (commands == null) {
			commands = new CommandRegistry();
			commands.register(new PrintCommand(printed));
		}
		IterableRegistry iterables = getAttribute(context, ITERABLES, IterableRegistry.class);
		if (iterables == null) {
			iterables = new IterableRegistry();
		}
		CommandSender sender = getAttribute(context, SENDER, CommandSender.class);
		if (sender == null) {
			sender = new SimpleCommandSender(SENDER_NAME, SimpleCommandSender.ALL_PERMISSIONS);
		}

		ScriptSettings settings = new ScriptSettings();
		settings.setDelayThreads(0);
		ScriptResult result;
		try (SlcScript engine = new SlcScript(settings, commands, iterables)) {
			result = engine.execute(source, getArguments(context), sender);
		}

		String out = printed.toString();
		try {
			Writer writer = context.getWriter();
			if (writer != null && !out.isEmpty()) {
				writer.write(out);
				writer.flush();
			}
		} catch (IOException e) {
			throw new ScriptException(e);
		}

		if (!result.isSuccess()) {
			String fileName = Objects.toString(context.getAttribute(FILENAME), null);
			throw new ScriptException(result.getErrorMessage(), fileName, result.getLine());
		}
		return out;
	}

	private static <T> T getAttribute(ScriptContext context, String name, Class<T> type) throws ScriptException {
		Object value = context.getAttribute(name);
		if (value == null) {
			return null;
		}
		if (!type.isInstance(value)) {
			throw new ScriptException(
					"Attribute '" + name + "' must be a " + type.getName() + ", not " + value.getClass().getName());
		}
		return type.cast(value);
	}

	private static ArgumentSegment getArguments(ScriptContext context) throws ScriptException {
		Object value = context.getAttribute(ARGUMENTS);
		String[] arguments;
		if (value == null) {
			arguments = new String[0];
		} else if (value instanceof String[]) {
			arguments = (String[]) value;
		} else if (value instanceof Collection) {
			Collection<?> collection = (Collection<?>) value;
			arguments = new String[collection.size()];
			int i = 0;
			for (Object element : collection) {
				arguments[i++] = element == null ? null : element.toString();
			}
		} else {
			throw new ScriptException("Attribute '" + ARGUMENTS + "' must be a String[] or a collection");
		}
		return ArgumentSegment.ofInvocation(SlcScriptEngineFactory.NAME, arguments);
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
