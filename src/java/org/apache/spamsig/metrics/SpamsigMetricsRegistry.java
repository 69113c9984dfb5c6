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

import com.codahale.metrics.MetricRegistry;

/**
 * Process wide registry which all server metrics are created in. Metric names
 * follow the pattern {@code org.apache.spamsig.metrics.<type>.<scope>.<name>}.
 */
public class SpamsigMetricsRegistry extends MetricRegistry
{
    public static final SpamsigMetricsRegistry Metrics = new SpamsigMetricsRegistry();

    private static final String GROUP_NAME = "org.apache.spamsig.metrics";

    private SpamsigMetricsRegistry()
    {
        super();
    }

    public static String metricName(String type, String scope, String name)
    {
        return scope == null
               ? MetricRegistry.name(GROUP_NAME, type, name)
               : MetricRegistry.name(GROUP_NAME, type, scope, name);
    }
}
