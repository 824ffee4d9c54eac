package org.hxlens.history.conf;

/*
 * This file is part of HxLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * HxLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * HxLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with HxLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void bundled_resource_carries_the_documented_defaults() {
		ConfigLoader loader = new ConfigLoader();

		assertEquals("---", loader.getRecordSeparator());
		assertEquals(ConfigLoader.DEFAULT_DATE_FORMATS, loader.getDateFormats());
		assertEquals(30, loader.getDefaultAge());
		assertTrue(loader.isDefaultEmergencyMode());
		assertEquals("rules/term_patterns.txt", loader.getTermRules());
		assertEquals("", loader.getNerModelPath());
		assertEquals(0.5, loader.getNerMinConfidence(), 1e-9);
		assertEquals(ZoneId.of("UTC"), loader.getTimeZone());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void empty_properties_fall_back_to_defaults() {
		ConfigLoader loader = new ConfigLoader(new Properties());

		assertEquals(ConfigLoader.DEFAULT_RECORD_SEPARATOR, loader.getRecordSeparator());
		assertEquals(ConfigLoader.DEFAULT_AGE, loader.getDefaultAge());
		assertTrue(loader.isDefaultEmergencyMode());
		assertEquals(ConfigLoader.DEFAULT_TERM_RULES, loader.getTermRules());
	}

	@Test
	void loads_from_file_and_splits_date_formats() throws Exception {
		Properties p = new Properties();
		p.setProperty("RECORD_SEPARATOR", "===");
		p.setProperty("DATE_FORMATS", " uuuu-MM-dd | dd.MM.uuuu |");
		p.setProperty("DEFAULT_AGE", "42");
		p.setProperty("DEFAULT_EMERGENCY_MODE", "FALSE");
		p.setProperty("TIME_ZONE", "Europe/London");
		Path f = writePropsFile(p, "conf1.properties");

		ConfigLoader loader = new ConfigLoader(f);

		assertEquals("===", loader.getRecordSeparator());
		assertEquals(List.of("uuuu-MM-dd", "dd.MM.uuuu"), loader.getDateFormats());
		assertEquals(42, loader.getDefaultAge());
		assertFalse(loader.isDefaultEmergencyMode());
		assertEquals(ZoneId.of("Europe/London"), loader.getTimeZone());
	}

	@Test
	void bad_values_are_reported_and_getters_use_defaults() {
		Properties p = new Properties();
		p.setProperty("DEFAULT_AGE", "forty");
		p.setProperty("NER_MIN_CONFIDENCE", "1.5");
		p.setProperty("TIME_ZONE", "Mars/Olympus");
		p.setProperty("DEFAULT_EMERGENCY_MODE", "maybe");
		p.setProperty("RECORD_SEPARATOR", "   ");

		ConfigLoader loader = new ConfigLoader(p);
		List<String> issues = loader.validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("DEFAULT_AGE")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("NER_MIN_CONFIDENCE")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("TIME_ZONE")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("DEFAULT_EMERGENCY_MODE")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("RECORD_SEPARATOR")));

		assertEquals(ConfigLoader.DEFAULT_AGE, loader.getDefaultAge());
		assertEquals(ConfigLoader.DEFAULT_NER_MIN_CONFIDENCE, loader.getNerMinConfidence(), 1e-9);
		assertEquals(ZoneId.of("UTC"), loader.getTimeZone());
		assertEquals(ConfigLoader.DEFAULT_RECORD_SEPARATOR, loader.getRecordSeparator());
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = new Properties();
		p.setProperty("DEFAULT_AGE", "65");
		Path f = writePropsFile(p, "override.properties");

		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		ConfigLoader loader = new ConfigLoader();

		assertEquals(65, loader.getDefaultAge());
	}

	@Test
	void unreadable_file_is_rejected() {
		Path missing = tmp.resolve("does-not-exist.properties");
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(missing));
	}
}
