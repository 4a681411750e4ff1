/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.instrumentation.diagnostics.DiagnosticsRegistry;
import org.opensearch.query.instrumentation.execstats.LocalityResolver;
import org.opensearch.query.instrumentation.sampling.SamplingPolicy;
import org.opensearch.query.tracing.Tracer;

/** Process-wide collaborators shared by every {@link InstrumentationController}. */
@Getter
@AllArgsConstructor
public class InstrumentationConfig {
  private final InstrumentationSettings settings;
  private final Tracer tracer;
  private final DiagnosticsRegistry diagnosticsRegistry;
  private final LocalityResolver localityResolver;
  private final SamplingPolicy samplingPolicy;
  private final TestingKnobs testingKnobs;

  public InstrumentationConfig(
      InstrumentationSettings settings,
      Tracer tracer,
      DiagnosticsRegistry diagnosticsRegistry,
      LocalityResolver localityResolver) {
    this(
        settings,
        tracer,
        diagnosticsRegistry,
        localityResolver,
        new SamplingPolicy(settings, diagnosticsRegistry),
        TestingKnobs.none());
  }
}
