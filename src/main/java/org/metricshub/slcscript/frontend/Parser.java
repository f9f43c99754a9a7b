package org.metricshub.slcscript.frontend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.metricshub.slcscript.commands.Command;
import org.metricshub.slcscript.commands.CommandRegistry;
import org.metricshub.slcscript.commands.CommandType;
import org.metricshub.slcscript.iterables.IterableRegistry;
import org.metricshub.slcscript.iterables.ScriptIterable;

/**
 * Builds the syntax tree of one script line.
 *
 * <pre>
 * script     := expr guard? EOF
 * expr       := '[' directive | command
 * directive  := expr (IF ifTail | FOREACH iterTail | DELAY_BY delayTail) ']'
 * ifTail     := expr (ELSE expr)?
 * iterTail   := NAME
 * delayTail  := DIGITS NAME?
 * </pre>
 * <p>
 * Commands are resolved while parsing, within the current scope. A trailing
 * <code>#?</code> guard changes the scope for the lines parsed next, so a
 * parser must not be shared between scripts.
 * </p>
 * Errors are reported through {@link #getErrorMessage()}; nested errors are
 * suffixed with the construct they occurred in.
 */
public class Parser {

	/** Every command surface */
	public static final Set<CommandType> ALL_SCOPES = Collections.unmodifiableSet(EnumSet.allOf(CommandType.class));

	private final CommandRegistry commandRegistry;
	private final IterableRegistry iterableRegistry;

	private String errorMessage;
	private EnumSet<CommandType> scope = EnumSet.allOf(CommandType.class);
	private List<Token> tokens;
	private int current;

	/**
	 * <p>
	 * Constructor for Parser.
	 * </p>
	 *
	 * @param commandRegistry commands scripts may invoke
	 * @param iterableRegistry iterables <code>foreach</code> may use
	 */
	public Parser(CommandRegistry commandRegistry, IterableRegistry iterableRegistry) {
		this.commandRegistry = Objects.requireNonNull(commandRegistry, "Command registry must not be null");
		this.iterableRegistry = Objects.requireNonNull(iterableRegistry, "Iterable registry must not be null");
	}

	/**
	 * @return the error of the last {@link #parse(List)} call, <code>null</code>
	 *         if none
	 */
	public String getErrorMessage() {
		return errorMessage;
	}

	/**
	 * @return copy of the surfaces commands are currently resolved in
	 */
	public Set<CommandType> getScope() {
		return EnumSet.copyOf(scope);
	}

	/**
	 * @param newScope surfaces to resolve commands in; all of them when
	 *        <code>null</code> or empty
	 */
	public void setScope(Set<CommandType> newScope) {
		scope = newScope == null || newScope.isEmpty() ? EnumSet.allOf(CommandType.class) : EnumSet.copyOf(newScope);
	}

	/**
	 * Parses the tokens of one line.
	 *
	 * @param lineTokens tokens to parse
	 * @return the expression, <code>null</code> when the line holds no
	 *         expression or on error
	 */
	public Expr parse(List<Token> lineTokens) {
		if (lineTokens == null) {
			errorMessage = "Provided tokens list to parse was null";
			return null;
		}

		errorMessage = null;
		tokens = lineTokens;
		current = 0;

		try {
			Expr expr = parseExpr(false);

			if (errorMessage != null) {
				return null;
			}

			parseGuard();

			if (errorMessage != null) {
				return null;
			}

			if (!isAtEnd()) {
				errorMessage = "An unexpected token remained after parsing (TokenType: " + tokens.get(current).getType() + ")";
				return null;
			}

			return expr;
		} finally {
			tokens = null;
		}
	}

	private boolean isAtEnd() {
		return current >= tokens.size();
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			++current;
			return true;
		}

		return false;
	}

	private boolean check(TokenType type) {
		return !isAtEnd() && tokens.get(current).getType() == type;
	}

	private boolean checkNot(TokenType type) {
		return !isAtEnd() && tokens.get(current).getType() != type;
	}

	private Token advance() {
		if (!isAtEnd()) {
			++current;
		}

		return tokens.get(current - 1);
	}

	private void appendError(String context) {
		errorMessage = errorMessage == null ? context : errorMessage + context;
	}

	private Expr parseExpr(boolean isInner) {
		if (match(TokenType.LEFT_SQUARE)) {
			return directive();
		}

		if (checkNot(TokenType.SCOPE_GUARD)) {
			return command(isInner);
		}

		return null;
	}

	private void parseGuard() {
		if (match(TokenType.SCOPE_GUARD)) {
			scopeGuard();
		}
	}

	private Expr directive() {
		Expr expr = parseExpr(true);
		Token keyword = advance();
		Expr body;

		switch (keyword.getType()) {
		case IF:
			body = ifExpr(expr);
			break;
		case FOREACH:
			body = foreachExpr(expr);
			break;
		case DELAY_BY:
			body = delayExpr(expr);
			break;
		default:
			body = null;
			break;
		}

		if (body == null) {
			if (errorMessage == null) {
				errorMessage = "No directive keywords were used";
			}
			return null;
		}

		if (!match(TokenType.RIGHT_SQUARE)) {
			errorMessage = "Missing closing square bracket for directive";
			return null;
		}

		return body;
	}

	private CommandExpr command(boolean isInner) {
		String name = tokens.get(current).getValue();
		Command command = commandRegistry.getCommand(scope, name);

		if (command == null) {
			errorMessage = "Command '" + name + "' was not found";
			return null;
		}

		List<String> arguments = new ArrayList<String>();
		boolean hasVariables = false;
		arguments.add(name);
		++current;

		while (checkNot(TokenType.SCOPE_GUARD) && (!isInner || isInnerArgument(tokens.get(current).getType()))) {
			Token token = tokens.get(current);
			hasVariables = hasVariables || (isInner && token.getType() == TokenType.VARIABLE);
			arguments.add(token.getValue());
			++current;
		}

		return new CommandExpr(command, arguments.toArray(new String[0]), hasVariables);
	}

	private static boolean isInnerArgument(TokenType type) {
		return type != TokenType.RIGHT_SQUARE && !type.isKeyword();
	}

	private void scopeGuard() {
		EnumSet<CommandType> newScope = EnumSet.noneOf(CommandType.class);

		while (check(TokenType.TEXT)) {
			String name = tokens.get(current).getValue();
			CommandType type = CommandType.fromScopeName(name);

			if (type == null) {
				errorMessage = "'" + name + "' is not a valid scope name";
				return;
			}

			newScope.add(type);
			++current;
		}

		setScope(newScope);
	}

	private IfExpr ifExpr(Expr then) {
		if (then == null) {
			appendError("\nin if branch expression");
			return null;
		}

		Expr condition = parseExpr(true);

		if (condition == null) {
			errorMessage = errorMessage == null ? "If condition expression is missing"
					: errorMessage + "\nin if condition expression";
			return null;
		}

		Expr otherwise = null;

		if (match(TokenType.ELSE)) {
			otherwise = parseExpr(true);

			if (otherwise == null) {
				errorMessage = errorMessage == null ? "Else branch expression is missing"
						: errorMessage + "\nin else branch expression";
				return null;
			}
		}

		return new IfExpr(then, condition, otherwise);
	}

	private ForeachExpr foreachExpr(Expr body) {
		if (body == null) {
			appendError("\nin foreach loop body expression");
			return null;
		}

		ScriptIterable iterable = getIterable();

		if (iterable == null) {
			return null;
		}

		++current;
		return new ForeachExpr(body, iterable);
	}

	private ScriptIterable getIterable() {
		if (isAtEnd() || !isIterableName(tokens.get(current).getType())) {
			errorMessage = "Iterable object name is missing";
			return null;
		}

		String name = tokens.get(current).getValue();

		if (!iterableRegistry.contains(name)) {
			errorMessage = "'" + name + "' is not a valid iterable object name";
			return null;
		}

		Supplier<ScriptIterable> provider = iterableRegistry.getProvider(name);

		if (provider == null) {
			errorMessage = "Provider for '" + name + "' iterable object is null";
			return null;
		}

		ScriptIterable iterable = provider.get();

		if (iterable == null) {
			errorMessage = "Provider for '" + name + "' iterable object returned null";
		}

		return iterable;
	}

	private static boolean isIterableName(TokenType type) {
		return type.isWord();
	}

	private DelayExpr delayExpr(Expr body) {
		if (body == null) {
			appendError("\nin delay body expression");
			return null;
		}

		if (!check(TokenType.TEXT) && !check(TokenType.VARIABLE)) {
			errorMessage = "Delay duration is missing";
			return null;
		}

		String value = tokens.get(current).getValue();
		int duration = parseDuration(value);

		if (duration < 0) {
			errorMessage = "'" + value + "' is not a valid delay duration";
			return null;
		}

		++current;
		String name = null;

		if (check(TokenType.TEXT) || check(TokenType.VARIABLE)) {
			name = tokens.get(current).getValue();
			++current;
		}

		return new DelayExpr(body, duration, name);
	}

	/**
	 * @return the duration, <code>-1</code> when it is not a non-negative
	 *         <code>int</code> written with digits only
	 */
	private static int parseDuration(String value) {
		if (value.isEmpty()) {
			return -1;
		}

		long result = 0;

		for (int i = 0; i < value.length(); i++) {
			char ch = value.charAt(i);

			if (!Lexer.isDigit(ch)) {
				return -1;
			}

			result = result * 10 + (ch - '0');

			if (result > Integer.MAX_VALUE) {
				return -1;
			}
		}

		return (int) result;
	}
}
