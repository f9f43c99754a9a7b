package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.SimpleCommandSender;
import org.metricshub.slcscript.frontend.Lexer;
import org.metricshub.slcscript.frontend.LexerPool;
import org.metricshub.slcscript.frontend.Token;
import org.metricshub.slcscript.frontend.TokenType;
import org.metricshub.slcscript.permissions.DefaultPermissionsResolver;

public class LexerPoolTest {

	@Test
	public void testRentAndRelease() {
		LexerPool pool = new LexerPool();
		DefaultPermissionsResolver resolver = new DefaultPermissionsResolver();
		Lexer first = pool.rent("print $(1)", ArgumentSegment.ofInvocation("x", "a"), new SimpleCommandSender("s"), resolver);
		assertEquals(0, pool.size());
		assertEquals(
				Arrays.asList(new Token(TokenType.TEXT, "print", 1), new Token(TokenType.TEXT, "a", 1)),
				first.scanNextLine());

		pool.release(first);
		assertEquals(1, pool.size());
		assertTrue(first.isAtEnd());
		assertNull(first.getSender());
		assertSame(ArgumentSegment.NONE, first.getArguments());

		Lexer second = pool.rent("echo $(1)", ArgumentSegment.ofInvocation("y", "b"), null, null);
		assertSame(first, second);
		assertEquals(0, pool.size());
		assertEquals(0, second.getLine());
		assertEquals(
				Arrays.asList(new Token(TokenType.TEXT, "echo", 1), new Token(TokenType.TEXT, "b", 1)),
				second.scanNextLine());
		assertTrue(second.getPermissionsResolver() instanceof DefaultPermissionsResolver);

		pool.release(null);
		assertEquals(0, pool.size());
	}
}
