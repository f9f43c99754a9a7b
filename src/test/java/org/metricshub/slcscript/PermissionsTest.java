package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeSet;
import org.junit.Test;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.CommandRegistry;
import org.metricshub.slcscript.commands.CommandSender;
import org.metricshub.slcscript.commands.PrintCommand;
import org.metricshub.slcscript.commands.SimpleCommandSender;
import org.metricshub.slcscript.iterables.IterableRegistry;
import org.metricshub.slcscript.permissions.DefaultPermissionsResolver;
import org.metricshub.slcscript.permissions.PermissionException;
import org.metricshub.slcscript.permissions.PermissionsResolver;
import org.metricshub.slcscript.permissions.PermissionsResolvers;
import org.metricshub.slcscript.util.ScriptSettings;

public class PermissionsTest {

	/**
	 * Grants permissions starting with <code>allowed.</code>.
	 */
	public static class PrefixResolver implements PermissionsResolver {
		@Override
		public boolean checkPermission(CommandSender sender, String permission) {
			return permission.startsWith("allowed.");
		}
	}

	public static class FailingResolver implements PermissionsResolver {
		public FailingResolver() {
			throw new IllegalStateException("not available");
		}

		@Override
		public boolean checkPermission(CommandSender sender, String permission) {
			return false;
		}
	}

	private static void assertDenied(PermissionsResolver resolver, CommandSender sender, String permission, String message) {
		try {
			resolver.checkPermission(sender, permission);
			fail("Expected a PermissionException for " + permission);
		} catch (PermissionException e) {
			assertEquals(message, e.getMessage());
		}
	}

	@Test
	public void testDefaultResolver() {
		PermissionsResolver resolver = new DefaultPermissionsResolver();
		CommandSender sender = new SimpleCommandSender("user", "Reports.Read");
		assertTrue(resolver.checkPermission(sender, "reports.read"));
		assertFalse(resolver.checkPermission(sender, "reports.write"));
		assertTrue(resolver.checkPermission(new SimpleCommandSender("admin", "*"), "anything"));
		assertDenied(resolver, null, "reports.read", "Cannot verify permission 'reports.read', command sender is null");
		assertDenied(resolver, sender, " ", "Permission name ' ' is invalid");
		assertDenied(resolver, sender, null, "Permission name 'null' is invalid");
	}

	@Test
	public void testKnownPermissions() {
		PermissionsResolver resolver = new DefaultPermissionsResolver(Arrays.asList("reports.read", "reports.write"));
		CommandSender sender = new SimpleCommandSender("user", "reports.read");
		assertTrue(resolver.checkPermission(sender, "REPORTS.READ"));
		assertFalse(resolver.checkPermission(sender, "reports.write"));
		assertDenied(resolver, sender, "reports.delete", "Permission 'reports.delete' does not exist");
		assertTrue(new DefaultPermissionsResolver(null).checkPermission(sender, "reports.read"));
	}

	@Test
	public void testCreateDefault() {
		ScriptSettings settings = new ScriptSettings();
		settings.setKnownPermissions(new TreeSet<String>(Collections.singleton("known")));
		PermissionsResolver resolver = PermissionsResolvers.create(settings);
		assertTrue(resolver instanceof DefaultPermissionsResolver);
		assertDenied(resolver, new SimpleCommandSender("user"), "unknown", "Permission 'unknown' does not exist");
	}

	@Test
	public void testCustomResolver() {
		ScriptSettings settings = new ScriptSettings();
		settings.setDelayThreads(0);
		settings.setPermissionsResolverClass(" " + PrefixResolver.class.getName() + " ");
		assertTrue(PermissionsResolvers.create(settings) instanceof PrefixResolver);

		CommandRegistry commands = new CommandRegistry();
		StringBuilder printed = new StringBuilder();
		commands.register(new PrintCommand(printed::append));
		try (SlcScript engine = new SlcScript(settings, commands, new IterableRegistry())) {
			ScriptResult result = engine
					.execute(
							"#! allowed.one\nprint a\n#! denied\nprint b\n#! allowed.two\nprint c",
							ArgumentSegment.NONE,
							new SimpleCommandSender("nobody"));
			assertTrue(result.isSuccess());
		}
		assertEquals("ac", printed.toString());
	}

	@Test
	public void testInvalidResolverClasses() {
		try {
			PermissionsResolvers.instantiateByClassName("com.example.Missing");
			fail("Expected an IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			assertEquals("Unknown permissions resolver 'com.example.Missing'", e.getMessage());
		}
		try {
			PermissionsResolvers.instantiateByClassName(String.class.getName());
			fail("Expected an IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().endsWith("does not implement " + PermissionsResolver.class.getName()));
		}
		try {
			PermissionsResolvers.instantiateByClassName(PermissionsResolver.class.getName());
			fail("Expected an IllegalStateException");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().startsWith("Cannot instantiate permissions resolver"));
		}
		try {
			PermissionsResolvers.instantiateByClassName(FailingResolver.class.getName());
			fail("Expected an IllegalStateException");
		} catch (IllegalStateException e) {
			assertEquals("not available", e.getMessage());
		}
	}
}
