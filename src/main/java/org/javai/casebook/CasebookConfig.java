package org.javai.casebook;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves library settings from system properties, falling back to environment variables.
 *
 * <ul>
 *   <li>{@code casebook.notebook} / {@code CASEBOOK_NOTEBOOK} - default case-file path</li>
 *   <li>{@code casebook.unmatched} / {@code CASEBOOK_UNMATCHED} - {@code PASS_THROUGH} or {@code UNEXPECTED}</li>
 * </ul>
 */
public final class CasebookConfig {

	public static final String NOTEBOOK_PROPERTY = "casebook.notebook";
	public static final String NOTEBOOK_ENV = "CASEBOOK_NOTEBOOK";
	public static final String UNMATCHED_PROPERTY = "casebook.unmatched";
	public static final String UNMATCHED_ENV = "CASEBOOK_UNMATCHED";

	private CasebookConfig() {
		// Utility class
	}

	/**
	 * Resolves an optional setting.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the value, or empty if neither is set
	 */
	public static Optional<String> resolve(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * Resolves a required setting.
	 *
	 * @throws IllegalStateException if neither is set
	 */
	public static String require(String sysProp, String envVar) {
		return resolve(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	/**
	 * The configured notebook path, if any.
	 */
	public static Optional<Path> notebook() {
		return resolve(NOTEBOOK_PROPERTY, NOTEBOOK_ENV).map(Path::of);
	}

	/**
	 * The configured unmatched-fault policy name, if any.
	 */
	public static Optional<String> unmatchedPolicy() {
		return resolve(UNMATCHED_PROPERTY, UNMATCHED_ENV);
	}
}
