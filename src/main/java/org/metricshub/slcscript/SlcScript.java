package org.metricshub.slcscript;

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
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.metricshub.slcscript.backend.Interpreter;
import org.metricshub.slcscript.backend.Resolver;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.CommandRegistry;
import org.metricshub.slcscript.commands.CommandSender;
import org.metricshub.slcscript.frontend.Expr;
import org.metricshub.slcscript.frontend.Lexer;
import org.metricshub.slcscript.frontend.LexerPool;
import org.metricshub.slcscript.frontend.Parser;
import org.metricshub.slcscript.frontend.Token;
import org.metricshub.slcscript.iterables.IterableRegistry;
import org.metricshub.slcscript.permissions.PermissionsResolver;
import org.metricshub.slcscript.permissions.PermissionsResolvers;
import org.metricshub.slcscript.util.ScriptLogger;
import org.metricshub.slcscript.util.ScriptSettings;
import org.metricshub.slcscript.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the execution of SLC Scripts.
 * <p>
 * A script runs line by line: each logical line is tokenized by a
 * {@link Lexer}, parsed into a syntax tree by a {@link Parser}, checked by the
 * {@link Resolver} and executed by an {@link Interpreter}. The first failing
 * line stops the script.
 * </p>
 * <p>
 * An instance is thread-safe and may run several scripts at once. It owns the
 * scheduler running <code>delayby</code> bodies, so it must be closed.
 * </p>
 */
public class SlcScript implements AutoCloseable {

	private static final Logger LOG = ScriptLogger.getLogger(SlcScript.class);

	private final ScriptSettings settings;
	private final CommandRegistry commandRegistry;
	private final IterableRegistry iterableRegistry;
	private final PermissionsResolver permissionsResolver;
	private final LexerPool lexerPool = new LexerPool();
	private final ScheduledExecutorService scheduler;

	/**
	 * Creates an instance with default settings and empty registries.
	 */
	public SlcScript() {
		this(new ScriptSettings(), new CommandRegistry(), new IterableRegistry());
	}

	/**
	 * <p>
	 * Constructor for SlcScript.
	 * </p>
	 *
	 * @param settings runtime settings
	 * @param commandRegistry commands scripts may invoke
	 * @param iterableRegistry iterables <code>foreach</code> may use
	 */
	public SlcScript(ScriptSettings settings, CommandRegistry commandRegistry, IterableRegistry iterableRegistry) {
		this.settings = Objects.requireNonNull(settings, "Settings must not be null");
		this.commandRegistry = Objects.requireNonNull(commandRegistry, "Command registry must not be null");
		this.iterableRegistry = Objects.requireNonNull(iterableRegistry, "Iterable registry must not be null");
		this.permissionsResolver = PermissionsResolvers.create(settings);
		this.scheduler = settings.getDelayThreads() > 0
				? Executors.newScheduledThreadPool(settings.getDelayThreads(), new DelayThreadFactory())
				: null;

		if (LOG.isDebugEnabled()) {
			LOG.debug("Runtime settings:\n{}", settings.toDescriptionString());
		}
	}

	public ScriptSettings getSettings() {
		return settings;
	}

	public CommandRegistry getCommandRegistry() {
		return commandRegistry;
	}

	public IterableRegistry getIterableRegistry() {
		return iterableRegistry;
	}

	public PermissionsResolver getPermissionsResolver() {
		return permissionsResolver;
	}

	/**
	 * Executes a script.
	 *
	 * @param source script text
	 * @param arguments arguments of the invocation, <code>$(1)</code> being the
	 *        first element of the segment
	 * @param sender sender the script runs for
	 * @return the outcome of the script
	 */
	public ScriptResult execute(String source, ArgumentSegment arguments, CommandSender sender) {
		LOG.debug("Executing script for {} with arguments {}", sender == null ? null : sender.getName(), arguments);
		Lexer lexer = lexerPool.rent(source, arguments, sender, permissionsResolver);

		try {
			Parser parser = new Parser(commandRegistry, iterableRegistry);
			Resolver resolver = new Resolver();
			Interpreter interpreter = new Interpreter(sender, scheduler);

			while (!lexer.isAtEnd()) {
				List<Token> tokens = lexer.scanNextLine();

				if (lexer.getErrorMessage() != null) {
					return failure(lexer.getErrorMessage(), lexer.getLine());
				}

				if (tokens.isEmpty()) {
					continue;
				}

				Expr expr = parser.parse(tokens);

				if (parser.getErrorMessage() != null) {
					return failure(parser.getErrorMessage(), lexer.getLine());
				}

				if (expr == null) {
					continue;
				}

				resolver.resolve(expr);

				if (!expr.accept(interpreter)) {
					return failure(interpreter.getErrorMessage(), lexer.getLine());
				}
			}

			return ScriptResult.success();
		} finally {
			lexerPool.release(lexer);
		}
	}

	/**
	 * Reads and executes a script.
	 *
	 * @param source where to read the script from
	 * @param arguments arguments of the invocation
	 * @param sender sender the script runs for
	 * @return the outcome of the script
	 * @throws IOException when the script cannot be read
	 */
	public ScriptResult execute(ScriptSource source, ArgumentSegment arguments, CommandSender sender)
			throws IOException {
		return execute(source.readText(), arguments, sender);
	}

	private static ScriptResult failure(String message, int line) {
		LOG.debug("Script failed at line {}: {}", line, message);
		return ScriptResult.failure(message, line);
	}

	/**
	 * Stops the delay scheduler, waiting for pending delayed bodies up to
	 * {@link ScriptSettings#getShutdownTimeoutMillis()}.
	 */
	@Override
	public void close() {
		if (scheduler == null) {
			return;
		}

		scheduler.shutdown();

		try {
			if (!scheduler.awaitTermination(settings.getShutdownTimeoutMillis(), TimeUnit.MILLISECONDS)) {
				LOG.warn("Delayed expressions still pending after {} ms, cancelling them", settings.getShutdownTimeoutMillis());
				scheduler.shutdownNow();
			}
		} catch (InterruptedException e) {
			scheduler.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * Daemon threads, so that pending delays never keep the JVM alive.
	 */
	private static final class DelayThreadFactory implements ThreadFactory {

		private static final AtomicInteger POOL_NUMBER = new AtomicInteger();

		private final int poolNumber = POOL_NUMBER.incrementAndGet();
		private final AtomicInteger threadNumber = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "slcscript-delay-" + poolNumber + "-" + threadNumber.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
