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

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.CommandSender;
import org.metricshub.slcscript.permissions.PermissionsResolver;
import org.metricshub.slcscript.util.ScriptLogger;
import org.slf4j.Logger;

/**
 * Thread-safe pool of {@link Lexer} instances.
 * <p>
 * A rented lexer belongs to the caller until it is handed back with
 * {@link #release(Lexer)}.
 * </p>
 */
public class LexerPool {

	private static final Logger LOG = ScriptLogger.getLogger(LexerPool.class);

	private final Queue<Lexer> pool = new ConcurrentLinkedQueue<Lexer>();

	/**
	 * Takes an idle lexer, or creates one, and resets it to the given input.
	 *
	 * @param source script source
	 * @param arguments script invocation arguments
	 * @param sender sender the permission guards are evaluated for
	 * @param resolver permissions resolver, <code>null</code> for the default one
	 * @return a lexer ready to scan the first line
	 */
	public Lexer rent(String source, ArgumentSegment arguments, CommandSender sender, PermissionsResolver resolver) {
		Lexer lexer = pool.poll();

		if (lexer == null) {
			LOG.trace("Allocating a new lexer");
			return new Lexer(source, arguments, sender, resolver);
		}

		lexer.reset(source, arguments, sender, resolver);
		return lexer;
	}

	/**
	 * Returns a lexer to the pool. The lexer drops its input so that sources
	 * and senders are not retained.
	 *
	 * @param lexer lexer to give back, ignored when <code>null</code>
	 */
	public void release(Lexer lexer) {
		if (lexer == null) {
			return;
		}

		lexer.reset(null, ArgumentSegment.NONE, null, lexer.getPermissionsResolver());
		pool.offer(lexer);
	}

	/**
	 * @return number of idle lexers
	 */
	public int size() {
		return pool.size();
	}
}
