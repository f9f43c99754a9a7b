package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import org.junit.Test;
import org.metricshub.slcscript.commands.CommandType;
import org.metricshub.slcscript.util.ScriptSettings;

public class ScriptSettingsTest {

	@Test
	public void testDefaults() {
		ScriptSettings settings = new ScriptSettings();
		assertNull(settings.getPermissionsResolverClass());
		assertNull(settings.getKnownPermissions());
		assertEquals(EnumSet.allOf(CommandType.class), settings.getAllowedScopes());
		assertEquals(10, settings.getScriptExecutionsLimit());
		assertEquals(1, settings.getDelayThreads());
		assertEquals(5000L, settings.getShutdownTimeoutMillis());
		assertEquals(".slcs", settings.getScriptFileExtension());
	}

	@Test
	public void testNormalization() {
		ScriptSettings settings = new ScriptSettings();
		settings.setAllowedScopes(EnumSet.noneOf(CommandType.class));
		assertEquals(EnumSet.allOf(CommandType.class), settings.getAllowedScopes());
		settings.setAllowedScopes(EnumSet.of(CommandType.CONSOLE));
		assertEquals(EnumSet.of(CommandType.CONSOLE), settings.getAllowedScopes());

		settings.setScriptFileExtension("");
		assertEquals(ScriptSettings.DEFAULT_SCRIPT_FILE_EXTENSION, settings.getScriptFileExtension());

		settings.setKnownPermissions(new HashSet<String>(Arrays.asList("Admin")));
		assertTrue(settings.getKnownPermissions().contains("admin"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeDelayThreads() {
		new ScriptSettings().setDelayThreads(-1);
	}

	@Test
	public void testDescription() {
		ScriptSettings settings = new ScriptSettings();
		settings.setScriptExecutionsLimit(4);
		String description = settings.toDescriptionString();
		assertTrue(description, description.contains("scriptExecutionsLimit = 4\n"));
		assertTrue(description, description.contains("delayThreads = 1\n"));
		assertTrue(description, description.contains("scriptFileExtension = .slcs\n"));
	}
}
