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

import java.util.Arrays;
import java.util.List;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;

/** ScriptEngineFactory for SLC Script. */
public class SlcScriptEngineFactory implements ScriptEngineFactory {

	/** Short name of the engine, also <code>$(0)</code> of evaluated scripts */
	public static final String NAME = "slcscript";

	@Override
	public String getEngineName() {
		return "SLC Script";
	}

	@Override
	public String getEngineVersion() {
		return "1.0.0-SNAPSHOT";
	}

	@Override
	public List<String> getExtensions() {
		return Arrays.asList("slcs");
	}

	@Override
	public List<String> getMimeTypes() {
		return Arrays.asList("text/x-slcscript");
	}

	@Override
	public List<String> getNames() {
		return Arrays.asList(NAME, "SLCScript");
	}

	@Override
	public String getLanguageName() {
		return "slcscript";
	}

	@Override
	public String getLanguageVersion() {
		return "1";
	}

	@Override
	public Object getParameter(String key) {
		if (ScriptEngine.NAME.equals(key) || ScriptEngine.ENGINE.equals(key)) {
			return getEngineName();
		}
		if (ScriptEngine.ENGINE_VERSION.equals(key)) {
			return getEngineVersion();
		}
		if (ScriptEngine.LANGUAGE.equals(key)) {
			return getLanguageName();
		}
		if (ScriptEngine.LANGUAGE_VERSION.equals(key)) {
			return getLanguageVersion();
		}
		return null;
	}

	/**
	 * SLC Script has no objects; the method becomes a command and the object its
	 * first argument.
	 */
	@Override
	public String getMethodCallSyntax(String obj, String m, String... args) {
		StringBuilder sb = new StringBuilder();
		sb.append(m).append(' ').append(obj);
		for (String arg : args) {
			sb.append(' ').append(arg);
		}
		return sb.toString();
	}

	@Override
	public String getOutputStatement(String toDisplay) {
		return "print " + toDisplay.replace("\n", " ");
	}

	@Override
	public String getProgram(String... statements) {
		StringBuilder sb = new StringBuilder();
		for (String s : statements) {
			sb.append(s).append('\n');
		}
		return sb.toString();
	}

	@Override
	public ScriptEngine getScriptEngine() {
		return new SlcScriptEngine(this);
	}
}
