package org.metricshub.slcscript;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.slcscript.backend.Resolver;
import org.metricshub.slcscript.frontend.CommandExpr;
import org.metricshub.slcscript.frontend.DelayExpr;
import org.metricshub.slcscript.frontend.ForeachExpr;
import org.metricshub.slcscript.frontend.IfExpr;
import org.metricshub.slcscript.iterables.EmptyIterable;

public class ResolverTest {

	private static final TestCommand COMMAND = new TestCommand("cmd");

	private static CommandExpr command(boolean hasVariables) {
		return new CommandExpr(COMMAND, new String[] { "cmd", "$(i)" }, hasVariables);
	}

	@Test
	public void testVariablesOutsideLoopsAreDropped() {
		CommandExpr expr = command(true);
		new Resolver().resolve(expr);
		assertFalse(expr.hasVariables());
	}

	@Test
	public void testVariablesInsideLoopsAreKept() {
		CommandExpr then = command(true);
		CommandExpr condition = command(true);
		CommandExpr otherwise = command(false);
		IfExpr ifExpr = new IfExpr(then, condition, otherwise);
		new Resolver().resolve(new ForeachExpr(new DelayExpr(ifExpr, 10, null), EmptyIterable.INSTANCE));
		assertTrue(then.hasVariables());
		assertTrue(condition.hasVariables());
		assertFalse(otherwise.hasVariables());
	}

	@Test
	public void testDepthIsRestoredAfterLoops() {
		CommandExpr inLoop = command(true);
		CommandExpr afterLoop = command(true);
		new Resolver().resolve(new IfExpr(new ForeachExpr(inLoop, EmptyIterable.INSTANCE), afterLoop, null));
		assertTrue(inLoop.hasVariables());
		assertFalse(afterLoop.hasVariables());
	}

	@Test
	public void testDelayOutsideLoop() {
		CommandExpr body = command(true);
		new Resolver().resolve(new DelayExpr(body, 100, "named"));
		assertFalse(body.hasVariables());
	}

	@Test
	public void testNullTree() {
		new Resolver().resolve(null);
	}
}
