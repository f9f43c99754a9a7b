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
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.CommandSender;
import org.metricshub.slcscript.permissions.DefaultPermissionsResolver;
import org.metricshub.slcscript.permissions.PermissionException;
import org.metricshub.slcscript.permissions.PermissionsResolver;

/**
 * Splits SLC Script source into tokens, one logical line per
 * {@link #scanNextLine()} call.
 * <p>
 * A logical line ends at a newline that is not preceded by a backslash. While
 * scanning, the lexer evaluates <code>#!</code> permission guards (denied
 * sections are dropped), emits <code>#?</code> scope guards for the parser,
 * skips comments and replaces <code>$(N)</code> references with the tokens of
 * the N-th script argument.
 * </p>
 * <p>
 * Errors are not thrown: once {@link #getErrorMessage()} is set, scanning
 * stops and further calls return empty lists.
 * </p>
 * A lexer is not thread-safe. See {@link LexerPool} for sharing instances.
 */
public class Lexer {

	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<String, TokenType>();
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("foreach", TokenType.FOREACH);
		keywords.put("delayby", TokenType.DELAY_BY);
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	/**
	 * What a guard does with the words that follow its marker.
	 */
	private enum GuardState {
		/** <code>#</code>: words are skipped */
		COMMENT,
		/** <code>#!</code>: words are permission names to check */
		PERMISSION,
		/** <code>#?</code>: words are scope names for the parser */
		SCOPE
	}

	/**
	 * Tokens produced by the sub-lexer for one argument.
	 */
	private static final class ArgumentResult {
		private final String source;
		private final List<Token> tokens;

		private ArgumentResult(String source, List<Token> tokens) {
			this.source = source;
			this.tokens = tokens;
		}
	}

	/**
	 * @param ch character to check
	 * @return whether the character separates tokens
	 */
	public static boolean isWhiteSpace(char ch) {
		return ch == ' ' || ch == '\n' || ch == '\t' || ch == '\r' || ch == '\0';
	}

	/**
	 * @param ch character to check
	 * @return whether the character is an ASCII digit
	 */
	public static boolean isDigit(char ch) {
		return ch >= '0' && ch <= '9';
	}

	/**
	 * @param ch character to check
	 * @return whether the character is one of <code>[ ] #</code>
	 */
	public static boolean isSpecialCharacter(char ch) {
		return ch == '[' || ch == ']' || ch == '#';
	}

	/**
	 * @param str word to check
	 * @return whether the word is a keyword, ignoring case
	 */
	public static boolean isKeyword(String str) {
		return str != null && KEYWORDS.containsKey(str.toLowerCase(Locale.ROOT));
	}

	private static boolean isAtomic(TokenType type) {
		return type == TokenType.LEFT_SQUARE || type == TokenType.RIGHT_SQUARE;
	}

	private static TokenType mergeTypes(TokenType type, TokenType nextType) {
		return type == TokenType.VARIABLE || nextType == TokenType.VARIABLE ? TokenType.VARIABLE : TokenType.TEXT;
	}

	private static boolean startsWithWhiteSpace(String str) {
		return isWhiteSpace(str.charAt(0));
	}

	private static boolean endsWithWhiteSpace(String str) {
		return isWhiteSpace(str.charAt(str.length() - 1));
	}

	private String source;
	private ArgumentSegment arguments;
	private CommandSender sender;
	private PermissionsResolver permissionsResolver;
	private int line;
	private String errorMessage;

	private boolean hasMissingPermissions;
	private final List<Token> tokens = new ArrayList<Token>();

	/** Argument tokenization cache, <code>null</code> for sub-lexers */
	private final Map<Integer, ArgumentResult> argumentResults;
	private Lexer argumentLexer;

	private int start;
	private int current;
	private String prefix;

	/**
	 * Creates a top-level lexer.
	 *
	 * @param source script source, <code>null</code> is an empty script
	 * @param arguments script invocation arguments
	 * @param sender sender the permission guards are evaluated for
	 * @param permissionsResolver resolver used by permission guards; a
	 *        {@link DefaultPermissionsResolver} when <code>null</code>
	 */
	public Lexer(String source, ArgumentSegment arguments, CommandSender sender, PermissionsResolver permissionsResolver) {
		this.argumentResults = new HashMap<Integer, ArgumentResult>();
		reset(source, arguments, sender, permissionsResolver);
	}

	/**
	 * Creates a sub-lexer, used to tokenize script arguments.
	 */
	private Lexer() {
		this.argumentResults = null;
		this.source = "";
		this.arguments = ArgumentSegment.NONE;
		reset();
	}

	/**
	 * Tokenizes the next logical line.
	 *
	 * @return the tokens of the line, possibly none
	 */
	public List<Token> scanNextLine() {
		tokens.clear();

		if (errorMessage != null || isAtEnd()) {
			return new ArrayList<Token>();
		}

		++line;
		boolean canRead = true;

		while (!isAtEnd() && canRead && errorMessage == null) {
			start = current;
			canRead = scanToken();
		}

		return new ArrayList<Token>(tokens);
	}

	/**
	 * Rewinds the lexer to the beginning of its source.
	 */
	public void reset() {
		line = 0;
		hasMissingPermissions = false;
		start = 0;
		current = 0;
		errorMessage = null;
		prefix = "";
		tokens.clear();
		if (argumentResults != null) {
			argumentResults.clear();
		}
	}

	/**
	 * Replaces the source and rewinds.
	 *
	 * @param newSource new source, <code>null</code> is an empty script
	 */
	public void reset(String newSource) {
		source = newSource == null ? "" : newSource;
		reset();
	}

	/**
	 * Replaces the whole input and rewinds.
	 *
	 * @param newSource new source, <code>null</code> is an empty script
	 * @param newArguments new invocation arguments
	 * @param newSender new sender
	 * @param newResolver new permissions resolver; a
	 *        {@link DefaultPermissionsResolver} when <code>null</code>
	 */
	public void reset(String newSource, ArgumentSegment newArguments, CommandSender newSender, PermissionsResolver newResolver) {
		source = newSource == null ? "" : newSource;
		arguments = newArguments == null ? ArgumentSegment.NONE : newArguments;
		sender = newSender;
		permissionsResolver = newResolver == null ? new DefaultPermissionsResolver() : newResolver;
		reset();
	}

	public ArgumentSegment getArguments() {
		return arguments;
	}

	public CommandSender getSender() {
		return sender;
	}

	public PermissionsResolver getPermissionsResolver() {
		return permissionsResolver;
	}

	/**
	 * @return number of the last line read, starting at 1
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return the error that stopped scanning, <code>null</code> if none
	 */
	public String getErrorMessage() {
		return errorMessage;
	}

	/**
	 * @return whether the whole source was read
	 */
	public boolean isAtEnd() {
		return current >= source.length();
	}

	private boolean isTopLevel() {
		return argumentResults != null;
	}

	/**
	 * @return the current character, <code>'\0'</code> past the end
	 */
	private char peek() {
		return isAtEnd() ? '\0' : source.charAt(current);
	}

	/**
	 * A newline ends a guard unless it is escaped by a backslash, directly or
	 * through <code>\r\n</code>.
	 */
	private boolean canRead() {
		return source.charAt(current) != '\n'
				|| source.charAt(current - 1) == '\\'
				|| (source.charAt(current - 1) == '\r' && current > 1 && source.charAt(current - 2) == '\\');
	}

	/**
	 * @return whether the current character is not a backslash ending the
	 *         physical line; a backslash at the end of the source counts as one
	 */
	private boolean isNotLineExtend() {
		return source.charAt(current) != '\\'
				|| (current + 1 < source.length()
						&& source.charAt(current + 1) != '\n'
						&& source.charAt(current + 1) != '\r');
	}

	private boolean isWordEnd() {
		return isWhiteSpace(peek()) || !isNotLineExtend();
	}

	private char advance() {
		return source.charAt(current++);
	}

	private boolean match(char expected) {
		if (isAtEnd() || source.charAt(current) != expected) {
			return false;
		}

		++current;
		return true;
	}

	private void addToken(TokenType type, String text) {
		tokens.add(new Token(type, text, line));
	}

	private String getTextWithPrefix(int end) {
		String text;

		if (prefix.length() > 0) {
			text = prefix + source.substring(start, end);
			prefix = "";
		} else {
			text = source.substring(start, end);
		}

		return text;
	}

	private boolean hasPrecedingText(int startedAt) {
		return start != startedAt || prefix.length() > 0;
	}

	/**
	 * @return <code>false</code> when the logical line ended
	 */
	private boolean scanToken() {
		char ch = advance();

		switch (ch) {
		case '[':
			directive(TokenType.LEFT_SQUARE);
			break;
		case ']':
			directive(TokenType.RIGHT_SQUARE);
			break;
		case '#':
			guard();
			break;
		case '\\':
			lineExtend();
			break;
		case ' ':
		case '\r':
		case '\t':
		case '\0':
			break;
		case '\n':
			return !isTopLevel();
		default:
			text(true);
			break;
		}

		return true;
	}

	/**
	 * Brackets are directive delimiters only when they stand alone.
	 */
	private void directive(TokenType type) {
		if (!isWordEnd()) {
			text(true);
			return;
		}

		if (hasMissingPermissions) {
			skipWord();
		} else {
			addToken(type, source.substring(start, current));
		}
	}

	private void guard() {
		if (!isTopLevel()) {
			text(false);
			return;
		}

		GuardState state = GuardState.COMMENT;

		if (match('!')) {
			hasMissingPermissions = false;
			state = GuardState.PERMISSION;
		} else if (match('?')) {
			addToken(TokenType.SCOPE_GUARD, "");
			state = GuardState.SCOPE;
		}

		while (!isAtEnd() && canRead()) {
			if (!isWhiteSpace(source.charAt(current)) && isNotLineExtend()) {
				guardWord(state);

				if (errorMessage != null) {
					return;
				}
			} else {
				if (source.charAt(current) == '\n') {
					++line;
				}

				++current;
			}
		}
	}

	private void guardWord(GuardState state) {
		start = current;
		skipWord();

		switch (state) {
		case PERMISSION:
			checkPermission(source.substring(start, current));
			break;
		case SCOPE:
			addToken(TokenType.TEXT, source.substring(start, current));
			break;
		default:
			break;
		}
	}

	private void checkPermission(String permission) {
		if (hasMissingPermissions) {
			return;
		}

		try {
			hasMissingPermissions = !permissionsResolver.checkPermission(sender, permission);
		} catch (PermissionException e) {
			errorMessage = e.getMessage();
		}
	}

	/**
	 * A backslash either continues the line or escapes the next character.
	 */
	private void lineExtend() {
		if (!isWhiteSpace(peek())) {
			if (isSpecialCharacter(source.charAt(current))) {
				++current;
			}

			++start;
			text(false);
			return;
		}

		if (isTopLevel()) {
			match('\r');

			if (match('\n')) {
				++line;
			}
		}
	}

	/**
	 * Reads a word. The first character was already consumed.
	 *
	 * @param enableKeywords whether the word may be a keyword
	 */
	private void text(boolean enableKeywords) {
		if (hasMissingPermissions) {
			skipWord();
			return;
		}

		if (enableKeywords) {
			--current;
		}

		TokenType type = TokenType.TEXT;

		while (!isWordEnd()) {
			type = processText(type);

			if (errorMessage != null || type == TokenType.NONE) {
				return;
			}
		}

		String text = getTextWithPrefix(current);

		if (text.isEmpty()) {
			return;
		}

		if (enableKeywords && type == TokenType.TEXT) {
			type = KEYWORDS.getOrDefault(text.toLowerCase(Locale.ROOT), TokenType.TEXT);
		}

		addToken(type, text);
	}

	private void skipWord() {
		while (!isWordEnd()) {
			++current;
		}
	}

	private TokenType processText(TokenType type) {
		char ch = advance();

		if (ch == '$') {
			if (match('(') && !match(')')) {
				return argument(current - 2, type);
			}
		} else if (ch == '\\' && isSpecialCharacter(peek())) {
			prefix = getTextWithPrefix(current - 1);
			start = current++;
		}

		return type;
	}

	/**
	 * Handles <code>$(</code>, already consumed.
	 *
	 * @param startedAt index of the <code>$</code>
	 * @param type type of the text read so far
	 * @return type of the current word, {@link TokenType#NONE} when the word
	 *         was fully emitted
	 */
	private TokenType argument(int startedAt, TokenType type) {
		if (isTopLevel()) {
			long argNum = 0;

			while (isDigit(peek())) {
				argNum = Math.min(argNum * 10 + (source.charAt(current) - '0'), Integer.MAX_VALUE);
				++current;
			}

			if (match(')')) {
				return processArgument((int) argNum, startedAt, type);
			}
		}

		while (!isWhiteSpace(peek()) && source.charAt(current) != ')') {
			++current;
		}

		if (match(')')) {
			return TokenType.VARIABLE;
		}

		return type == TokenType.VARIABLE ? TokenType.VARIABLE : TokenType.TEXT;
	}

	private TokenType processArgument(int argNum, int startedAt, TokenType type) {
		validateArguments(argNum);

		if (errorMessage != null) {
			return TokenType.NONE;
		}

		ArgumentResult result = argumentResults.get(argNum);

		if (result != null) {
			return injectArgument(result, startedAt, type);
		}

		if (argumentLexer == null) {
			argumentLexer = new Lexer();
		}

		argumentLexer.reset(arguments.get(argNum - 1));
		List<Token> argumentTokens = argumentLexer.scanNextLine();
		result = new ArgumentResult(argumentLexer.source, argumentTokens);
		argumentResults.put(argNum, result);

		if (argumentLexer.errorMessage != null) {
			errorMessage = argumentLexer.errorMessage + "\nat $(" + argNum + ")";
			return TokenType.NONE;
		}

		return injectArgument(result, startedAt, type);
	}

	private void validateArguments(int argNum) {
		if (arguments.getArray() == null) {
			errorMessage = "Invalid argument $(" + argNum + "), provided arguments array is null";
			return;
		}

		if (arguments.getOffset() < 1) {
			errorMessage = "Invalid argument $(" + argNum + "), provided arguments array has incorrect offset ("
					+ arguments.getOffset() + ")";
			return;
		}

		if (argNum > arguments.size()) {
			errorMessage = "Missing argument $(" + argNum + "), sender provided only " + arguments.size() + " arguments";
		}
	}

	private TokenType injectArgument(ArgumentResult result, int startedAt, TokenType type) {
		switch (result.tokens.size()) {
		case 0:
			return injectNoTokens(result.source.isEmpty(), startedAt, type);
		case 1:
			return injectOneToken(result, startedAt, type);
		case 2:
			return injectTwoTokens(result, startedAt, type);
		default:
			return injectTokens(result, startedAt, type);
		}
	}

	private TokenType injectNoTokens(boolean isEmpty, int startedAt, TokenType type) {
		if (!hasPrecedingText(startedAt)) {
			return TokenType.NONE;
		}

		if (isEmpty && !isWhiteSpace(peek())) {
			prefix = getTextWithPrefix(startedAt);
			start = current;
			return type;
		}

		addToken(type, getTextWithPrefix(startedAt));
		return TokenType.NONE;
	}

	private TokenType injectOneToken(ArgumentResult result, int startedAt, TokenType type) {
		Token token = result.tokens.get(0);
		boolean isEnd = isWhiteSpace(peek()) || isAtomic(token.getType()) || endsWithWhiteSpace(result.source);

		if (hasPrecedingText(startedAt)) {
			if (startsWithWhiteSpace(result.source) || isAtomic(token.getType())) {
				addToken(type, getTextWithPrefix(startedAt));
			} else if (isEnd) {
				addToken(mergeTypes(type, token.getType()), getTextWithPrefix(startedAt) + token.getValue());
				return TokenType.NONE;
			} else {
				TokenType newType = mergeTypes(type, token.getType());
				prefix = getTextWithPrefix(startedAt) + token.getValue();
				start = current;
				return newType;
			}
		}

		if (isEnd) {
			addToken(token.getType(), token.getValue());
			return TokenType.NONE;
		}

		prefix = token.getValue();
		start = current;
		return token.getType();
	}

	private TokenType injectTwoTokens(ArgumentResult result, int startedAt, TokenType type) {
		Token token = result.tokens.get(0);

		if (hasPrecedingText(startedAt)) {
			if (startsWithWhiteSpace(result.source) || isAtomic(token.getType())) {
				addToken(type, getTextWithPrefix(startedAt));
				addToken(token.getType(), token.getValue());
			} else {
				addToken(mergeTypes(type, token.getType()), getTextWithPrefix(startedAt) + token.getValue());
			}
		} else {
			addToken(token.getType(), token.getValue());
		}

		return injectLastToken(result);
	}

	private TokenType injectTokens(ArgumentResult result, int startedAt, TokenType type) {
		List<Token> injected = result.tokens;
		int last = injected.size() - 1;
		int from = 0;

		if (hasPrecedingText(startedAt)) {
			Token token = injected.get(0);

			if (startsWithWhiteSpace(result.source) || isAtomic(token.getType())) {
				addToken(type, getTextWithPrefix(startedAt));
			} else {
				addToken(mergeTypes(type, token.getType()), getTextWithPrefix(startedAt) + token.getValue());
				from = 1;
			}
		}

		for (int i = from; i < last; i++) {
			addToken(injected.get(i).getType(), injected.get(i).getValue());
		}

		return injectLastToken(result);
	}

	/**
	 * The last injected token stands alone when the word ends here, otherwise
	 * it prefixes the rest of the word.
	 */
	private TokenType injectLastToken(ArgumentResult result) {
		Token lastToken = result.tokens.get(result.tokens.size() - 1);

		if (isWhiteSpace(peek()) || isAtomic(lastToken.getType()) || endsWithWhiteSpace(result.source)) {
			addToken(lastToken.getType(), lastToken.getValue());
			return TokenType.NONE;
		}

		prefix = lastToken.getValue();
		start = current;
		return lastToken.getType();
	}
}
