package org.metricshub.slcscript.backend;

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

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.CommandResult;
import org.metricshub.slcscript.commands.CommandSender;
import org.metricshub.slcscript.frontend.CommandExpr;
import org.metricshub.slcscript.frontend.DelayExpr;
import org.metricshub.slcscript.frontend.ExprVisitor;
import org.metricshub.slcscript.frontend.ForeachExpr;
import org.metricshub.slcscript.frontend.IfExpr;
import org.metricshub.slcscript.iterables.ScriptIterable;
import org.metricshub.slcscript.util.ScriptLogger;
import org.slf4j.Logger;

/**
 * Executes a syntax tree. Each visit returns whether the expression
 * succeeded; on failure {@link #getErrorMessage()} tells why.
 * <p>
 * Loop variables live in a single case-insensitive map shared by nested
 * loops. <code>delayby</code> bodies are handed to the scheduler, if any,
 * together with a copy of that map.
 * </p>
 */
public class Interpreter implements ExprVisitor<Boolean> {

	private static final Logger LOG = ScriptLogger.getLogger(Interpreter.class);

	private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\$\\(([a-zA-Z]+)\\)");

	private CommandSender sender;
	private final ScheduledExecutorService scheduler;
	private final Map<String, String> variables = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
	private String errorMessage;

	/**
	 * <p>
	 * Constructor for Interpreter.
	 * </p>
	 *
	 * @param sender sender commands are executed for
	 * @param scheduler runs delayed bodies; <code>null</code> runs them
	 *        immediately
	 */
	public Interpreter(CommandSender sender, ScheduledExecutorService scheduler) {
		this.sender = sender;
		this.scheduler = scheduler;
	}

	private Interpreter(Interpreter source) {
		this(source.sender, source.scheduler);
		variables.putAll(source.variables);
	}

	public CommandSender getSender() {
		return sender;
	}

	/**
	 * @return the error of the last failed visit, <code>null</code> if none
	 */
	public String getErrorMessage() {
		return errorMessage;
	}

	/**
	 * Prepares the interpreter for another script.
	 *
	 * @param newSender sender commands are executed for
	 */
	public void reset(CommandSender newSender) {
		sender = newSender;
		errorMessage = null;
		variables.clear();
	}

	@Override
	public Boolean visitCommandExpr(CommandExpr expr) {
		if (expr == null) {
			errorMessage = "Provided command expression is null";
			return false;
		}

		if (expr.getCommand() == null) {
			errorMessage = "Cannot execute a null command";
			return false;
		}

		String[] arguments = expr.getArguments();

		if (arguments == null) {
			errorMessage = "Provided command arguments array is null";
			return false;
		}

		if (arguments.length < 1) {
			errorMessage = "Provided command arguments array is empty";
			return false;
		}

		String[] args = prepareArguments(arguments, expr.hasVariables());
		CommandResult result = expr.getCommand().execute(new ArgumentSegment(args, 1, args.length - 1), sender);

		if (result == null || !result.isSuccess()) {
			errorMessage = result == null ? "Command '" + args[0] + "' returned no result" : result.getMessage();
			return false;
		}

		return true;
	}

	private String[] prepareArguments(String[] arguments, boolean hasVariables) {
		String[] args = new String[arguments.length];

		for (int i = 0; i < arguments.length; i++) {
			String argument = arguments[i] == null ? "" : arguments[i];
			args[i] = hasVariables && i > 0 ? injectVariables(argument) : argument;
		}

		return args;
	}

	/**
	 * Replaces <code>$(name)</code> placeholders with loop variables. Unknown
	 * names are left as they are.
	 */
	private String injectVariables(String argument) {
		Matcher matcher = VARIABLE_PATTERN.matcher(argument);
		StringBuilder result = new StringBuilder(argument.length());

		while (matcher.find()) {
			String value = variables.get(matcher.group(1));
			matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? matcher.group() : value));
		}

		matcher.appendTail(result);
		return result.toString();
	}

	@Override
	public Boolean visitForeachExpr(ForeachExpr expr) {
		if (expr == null) {
			errorMessage = "Provided foreach expression is null";
			return false;
		}

		if (expr.getBody() == null) {
			errorMessage = "Foreach expression body is null";
			return false;
		}

		ScriptIterable iterable = expr.getIterable();

		if (iterable == null) {
			errorMessage = "Foreach expression iterable object is null";
			return false;
		}

		try {
			while (iterable.loadNext(variables)) {
				if (!expr.getBody().accept(this)) {
					return false;
				}
			}

			return true;
		} finally {
			variables.clear();
			iterable.reset();
		}
	}

	@Override
	public Boolean visitIfExpr(IfExpr expr) {
		if (expr == null) {
			errorMessage = "Provided if expression is null";
			return false;
		}

		if (expr.getThen() == null) {
			errorMessage = "If expression then branch is null";
			return false;
		}

		if (expr.getCondition() == null) {
			errorMessage = "If expression condition is null";
			return false;
		}

		boolean condition = expr.getCondition().accept(this);
		errorMessage = null;

		if (condition) {
			return expr.getThen().accept(this);
		}

		return expr.getOtherwise() == null || expr.getOtherwise().accept(this);
	}

	@Override
	public Boolean visitDelayExpr(DelayExpr expr) {
		if (expr == null) {
			errorMessage = "Provided delay expression is null";
			return false;
		}

		if (expr.getBody() == null) {
			errorMessage = "Delay expression body is null";
			return false;
		}

		if (expr.getDuration() < 1 || scheduler == null) {
			return expr.getBody().accept(this);
		}

		Interpreter delayed = new Interpreter(this);
		try {
			scheduler.schedule(() -> delayed.runDelayed(expr), expr.getDuration(), TimeUnit.MILLISECONDS);
		} catch (RejectedExecutionException e) {
			errorMessage = "Cannot schedule delayed expression, the script runtime was closed";
			return false;
		}
		return true;
	}

	private void runDelayed(DelayExpr expr) {
		try {
			if (!expr.getBody().accept(this)) {
				LOG.error(expr.getName() == null ? errorMessage : "[" + expr.getName() + "] " + errorMessage);
			}
		} catch (RuntimeException e) {
			LOG.error("Delayed expression {} failed", expr.getName() == null ? "" : expr.getName(), e);
		}
	}
}
