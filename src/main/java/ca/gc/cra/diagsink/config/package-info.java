/**
 * Configuration loading and wiring.
 * <p><strong>Role:</strong> Merges defaults, YAML and CLI values ({@link ca.gc.cra.diagsink.config.ConfigMerger}),
 * validates them into {@link ca.gc.cra.diagsink.config.SinkConfig}, and builds the component graph in
 * {@link ca.gc.cra.diagsink.config.CompositionRoot}.</p>
 * <p><strong>Precedence:</strong> CLI &gt; YAML &gt; embedded defaults.</p>
 */
package ca.gc.cra.diagsink.config;
