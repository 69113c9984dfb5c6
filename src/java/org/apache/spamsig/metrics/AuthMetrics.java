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

import com.codahale.metrics.Meter;

import static org.apache.spamsig.metrics.SpamsigMetricsRegistry.Metrics;

/**
 * Metrics about authentication and command authorization.
 */
public class AuthMetrics
{
    private static final String TYPE = "Auth";

    public static final AuthMetrics instance = new AuthMetrics();

    /** Number and rate of requests from a known account */
    private final Meter authSuccess;

    /** Number and rate of requests naming an account the server does not know */
    private final Meter authFailure;

    /** Number and rate of commands rejected by the access policy */
    private final Meter commandDenied;

    /** Number of times the accounts or access files were reloaded */
    private final Meter reloads;

    private AuthMetrics()
    {
        authSuccess = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, null, "AuthSuccess"));
        authFailure = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, null, "AuthFailure"));
        commandDenied = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, null, "CommandDenied"));
        reloads = Metrics.meter(SpamsigMetricsRegistry.metricName(TYPE, null, "Reloads"));
    }

    public void markSuccess()
    {
        authSuccess.mark();
    }

    public void markFailure()
    {
        authFailure.mark();
    }

    public void markDenied()
    {
        commandDenied.mark();
    }

    public void markReload()
    {
        reloads.mark();
    }

    public long deniedCount()
    {
        return commandDenied.getCount();
    }
}
