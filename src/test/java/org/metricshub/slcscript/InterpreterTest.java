package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.metricshub.slcscript.backend.Interpreter;
import org.metricshub.slcscript.commands.SimpleCommandSender;
import org.metricshub.slcscript.frontend.CommandExpr;
import org.metricshub.slcscript.frontend.DelayExpr;
import org.metricshub.slcscript.frontend.Expr;
import org.metricshub.slcscript.frontend.ForeachExpr;
import org.metricshub.slcscript.frontend.IfExpr;
import org.metricshub.slcscript.iterables.PredefinedIterable;
import org.metricshub.slcscript.iterables.ScriptIterable;

public class InterpreterTest {

	private final TestCommand command = new TestCommand("cmd");
	private final TestCommand failing = new TestCommand("fail").failing("failed on purpose");
	private final Interpreter interpreter = new Interpreter(new SimpleCommandSender("tester"), null);

	private static ScriptIterable values(String name, String... values) {
		return new PredefinedIterable<String>(Arrays.asList(values), (Map<String, String> vars, String v) -> vars.put(name, v));
	}

	private CommandExpr call(String... arguments) {
		String[] all = new String[arguments.length + 1];
		all[0] = "cmd";
		System.arraycopy(arguments, 0, all, 1, arguments.length);
		return new CommandExpr(command, all, true);
	}

	private CommandExpr fail() {
		return new CommandExpr(failing, new String[] { "fail" }, false);
	}

	@Test
	public void testCommand() {
		assertTrue(new CommandExpr(command, new String[] { "cmd", "a", null }, false).accept(interpreter));
		assertEquals(Arrays.asList(Arrays.asList("a", "")), command.getCalls());
		assertNull(interpreter.getErrorMessage());
	}

	@Test
	public void testFailingCommand() {
		assertFalse(fail().accept(interpreter));
		assertEquals("failed on purpose", interpreter.getErrorMessage());
	}

	@Test
	public void testInvalidCommands() {
		assertFalse(interpreter.visitCommandExpr(null));
		assertEquals("Provided command expression is null", interpreter.getErrorMessage());
		assertFalse(new CommandExpr(null, new String[] { "x" }, false).accept(interpreter));
		assertEquals("Cannot execute a null command", interpreter.getErrorMessage());
		assertFalse(new CommandExpr(command, null, false).accept(interpreter));
		assertEquals("Provided command arguments array is null", interpreter.getErrorMessage());
		assertFalse(new CommandExpr(command, new String[0], false).accept(interpreter));
		assertEquals("Provided command arguments array is empty", interpreter.getErrorMessage());
	}

	@Test
	public void testForeachSubstitutesVariables() {
		ForeachExpr expr = new ForeachExpr(call("<$(I)>", "$(unknown)", "$(i)$(i)"), values("i", "1", "2"));
		assertTrue(expr.accept(interpreter));
		assertEquals(
				Arrays.asList(Arrays.asList("<1>", "$(unknown)", "11"), Arrays.asList("<2>", "$(unknown)", "22")),
				command.getCalls());
	}

	@Test
	public void testVariablesAreNotSubstitutedWithoutFlag() {
		CommandExpr body = new CommandExpr(command, new String[] { "cmd", "$(i)" }, false);
		assertTrue(new ForeachExpr(body, values("i", "1")).accept(interpreter));
		assertEquals(Arrays.asList(Arrays.asList("$(i)")), command.getCalls());
	}

	@Test
	public void testReplacementIsLiteral() {
		assertTrue(new ForeachExpr(call("$(i)"), values("i", "$1\\x")).accept(interpreter));
		assertEquals(Arrays.asList(Arrays.asList("$1\\x")), command.getCalls());
	}

	@Test
	public void testNestedLoops() {
		ForeachExpr inner = new ForeachExpr(call("$(i)", "$(j)"), values("j", "a", "b"));
		ForeachExpr outer = new ForeachExpr(inner, values("i", "1", "2"));
		assertTrue(outer.accept(interpreter));
		assertEquals(
				Arrays
						.asList(
								Arrays.asList("1", "a"),
								Arrays.asList("1", "b"),
								Arrays.asList("2", "a"),
								Arrays.asList("2", "b")),
				command.getCalls());
	}

	@Test
	public void testForeachStopsOnFailure() {
		ScriptIterable iterable = values("i", "1", "2", "3");
		assertFalse(new ForeachExpr(fail(), iterable).accept(interpreter));
		assertEquals("failed on purpose", interpreter.getErrorMessage());
		assertEquals(1, failing.getCallCount());
		assertFalse("iterable is rewound", iterable.isAtEnd());
	}

	@Test
	public void testForeachFailureClearsVariables() {
		TestCommand second = new TestCommand("second").failingAfter(1, "stopped");
		ScriptIterable iterable = values("v", "a", "b", "c");
		ForeachExpr expr = new ForeachExpr(new CommandExpr(second, new String[] { "second", "$(v)" }, true), iterable);
		assertFalse(expr.accept(interpreter));
		assertEquals("stopped", interpreter.getErrorMessage());
		assertEquals(Arrays.asList(Arrays.asList("a"), Arrays.asList("b")), second.getCalls());
		assertFalse("iterable is rewound", iterable.isAtEnd());

		assertTrue(new ForeachExpr(call("$(v)"), values("other", "x")).accept(interpreter));
		assertEquals(Arrays.asList(Arrays.asList("$(v)")), command.getCalls());
	}

	@Test
	public void testInvalidForeach() {
		assertFalse(interpreter.visitForeachExpr(null));
		assertEquals("Provided foreach expression is null", interpreter.getErrorMessage());
		assertFalse(new ForeachExpr(null, values("i")).accept(interpreter));
		assertEquals("Foreach expression body is null", interpreter.getErrorMessage());
		assertFalse(new ForeachExpr(call(), null).accept(interpreter));
		assertEquals("Foreach expression iterable object is null", interpreter.getErrorMessage());
	}

	@Test
	public void testIf() {
		assertTrue(new IfExpr(call("then"), call("condition"), call("else")).accept(interpreter));
		assertEquals(Arrays.asList(Arrays.asList("condition"), Arrays.asList("then")), command.getCalls());
	}

	@Test
	public void testIfFailingCondition() {
		assertTrue(new IfExpr(call("then"), fail(), call("else")).accept(interpreter));
		assertEquals(Arrays.asList(Arrays.asList("else")), command.getCalls());
		assertNull(interpreter.getErrorMessage());

		assertTrue(new IfExpr(call("then"), fail(), null).accept(interpreter));
		assertEquals(1, command.getCallCount());
	}

	@Test
	public void testIfFailingBranch() {
		assertFalse(new IfExpr(fail(), call("condition"), null).accept(interpreter));
		assertEquals("failed on purpose", interpreter.getErrorMessage());
	}

	@Test
	public void testInvalidIf() {
		assertFalse(interpreter.visitIfExpr(null));
		assertEquals("Provided if expression is null", interpreter.getErrorMessage());
		assertFalse(new IfExpr(null, call(), null).accept(interpreter));
		assertEquals("If expression then branch is null", interpreter.getErrorMessage());
		assertFalse(new IfExpr(call(), null, null).accept(interpreter));
		assertEquals("If expression condition is null", interpreter.getErrorMessage());
	}

	@Test
	public void testDelayWithoutSchedulerRunsImmediately() {
		assertTrue(new DelayExpr(call("later"), 1000, null).accept(interpreter));
		assertEquals(1, command.getCallCount());
		assertFalse(new DelayExpr(fail(), 1000, null).accept(interpreter));
	}

	@Test
	public void testInvalidDelay() {
		assertFalse(interpreter.visitDelayExpr(null));
		assertEquals("Provided delay expression is null", interpreter.getErrorMessage());
		assertFalse(new DelayExpr(null, 10, null).accept(interpreter));
		assertEquals("Delay expression body is null", interpreter.getErrorMessage());
	}

	@Test
	public void testDelayedBodiesKeepLoopVariables() throws Exception {
		ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
		try {
			Interpreter delaying = new Interpreter(new SimpleCommandSender("tester"), scheduler);
			Expr expr = new ForeachExpr(new DelayExpr(call("$(i)"), 20, "delayed"), values("i", "1", "2"));
			assertTrue(expr.accept(delaying));
			assertEquals(0, command.getCallCount());
		} finally {
			scheduler.shutdown();
			assertTrue(scheduler.awaitTermination(5, TimeUnit.SECONDS));
		}
		List<List<String>> calls = command.getCalls();
		assertEquals(new HashSet<List<String>>(Arrays.asList(Arrays.asList("1"), Arrays.asList("2"))), new HashSet<List<String>>(calls));
	}

	@Test
	public void testDelayedFailureDoesNotFailScript() throws Exception {
		ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
		try {
			Interpreter delaying = new Interpreter(new SimpleCommandSender("tester"), scheduler);
			assertTrue(new DelayExpr(fail(), 10, "broken").accept(delaying));
			assertNull(delaying.getErrorMessage());
		} finally {
			scheduler.shutdown();
			assertTrue(scheduler.awaitTermination(5, TimeUnit.SECONDS));
		}
		assertEquals(1, failing.getCallCount());
	}

	@Test
	public void testShutDownScheduler() {
		ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
		scheduler.shutdown();
		Interpreter delaying = new Interpreter(new SimpleCommandSender("tester"), scheduler);
		assertFalse(new DelayExpr(call("late"), 10, null).accept(delaying));
		assertEquals("Cannot schedule delayed expression, the script runtime was closed", delaying.getErrorMessage());
	}
}
