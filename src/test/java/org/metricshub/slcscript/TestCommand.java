package org.metricshub.slcscript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.Command;
import org.metricshub.slcscript.commands.CommandResult;
import org.metricshub.slcscript.commands.CommandSender;

/**
 * Command recording its invocations, succeeding or failing on demand.
 */
public class TestCommand implements Command {

	private final String name;
	private final String[] aliases;
	private final List<List<String>> calls = Collections.synchronizedList(new ArrayList<List<String>>());
	private volatile int successfulCalls = Integer.MAX_VALUE;
	private volatile String failureMessage;

	public TestCommand(String name, String... aliases) {
		this.name = name;
		this.aliases = aliases;
	}

	/**
	 * Makes the next executions fail with the given message.
	 *
	 * @param failureMessage message returned to the script
	 * @return this command
	 */
	public TestCommand failing(String failureMessage) {
		return failingAfter(0, failureMessage);
	}

	/**
	 * Lets the given number of executions succeed, then fails the following
	 * ones.
	 *
	 * @param successes executions succeeding first
	 * @param failureMessage message returned to the script once failing
	 * @return this command
	 */
	public TestCommand failingAfter(int successes, String failureMessage) {
		this.successfulCalls = successes;
		this.failureMessage = failureMessage;
		return this;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public String[] getAliases() {
		return aliases.clone();
	}

	@Override
	public CommandResult execute(ArgumentSegment arguments, CommandSender sender) {
		int count;
		synchronized (calls) {
			calls.add(arguments.toList());
			count = calls.size();
		}
		return count <= successfulCalls ? CommandResult.success("done") : CommandResult.failure(failureMessage);
	}

	/**
	 * @return the arguments of each invocation, in order
	 */
	public List<List<String>> getCalls() {
		synchronized (calls) {
			return new ArrayList<List<String>>(calls);
		}
	}

	public int getCallCount() {
		return calls.size();
	}
}
