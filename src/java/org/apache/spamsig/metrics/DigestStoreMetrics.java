/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.spamsig.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;

import static org.apache.spamsig.metrics.SpamsigMetricsRegistry.Metrics;

/**
 * Metrics for a {@link org.apache.spamsig.db.DigestStore}, scoped by the store's name.
 */
public class DigestStoreMetrics
{
    private static final String TYPE = "DigestStore";

    public final Meter reports;

    public final Meter whitelists;

    public final Meter decodeFailures;

    public final Meter backendErrors;

    public final Counter sweepEvictions;

    public final Meter sweepItemErrors;

    public final Meter sweepsSkipped;

    public final Meter flushErrors;

    public final Timer sweepLatency;

    public final Timer readLatency;

    public final Timer writeLatency;

    public DigestStoreMetrics(String scope)
    {
        reports = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, scope, "reports"));
        whitelists = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, scope, "whitelists"));
        decodeFailures = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, scope, "decodeFailures"));
        backendErrors = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, scope, "backendErrors"));
        sweepEvictions = Metrics.counter(SpamsigMetricsRegistry.metricName(TYPE, scope, "sweepEvictions"));
        sweepItemErrors = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, scope, "sweepItemErrors"));
        sweepsSkipped = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, scope, "sweepsSkipped"));
        flushErrors = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, scope, "flushErrors"));
        sweepLatency = Metrics.timer(SpamsigMetricsRegistry.metricName(TYPE, scope, "sweepLatency"));
        readLatency = Metrics.timer(SpamsigMetricsRegistry.metricName(TYPE, scope, "readLatency"));
        writeLatency = Metrics.timer(SpamsigMetricsRegistry.metricName(TYPE, scope, "writeLatency"));
    }
}
