/*
 Licensed to Diennea S.r.l. under one
 or more contributor license agreements. See the NOTICE file
 distributed with this work for additional information
 regarding copyright ownership. Diennea S.r.l. licenses this file
 to you under the Apache License, Version 2.0 (the
 "License"); you may not use this file except in compliance
 with the License.  You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing,
 software distributed under the License is distributed on an
 "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 KIND, either express or implied.  See the License for the
 specific language governing permissions and limitations
 under the License.

 */
package org.certkeeper.utils;

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Metrics are registered to the default registry under the {@value #NAMESPACE} namespace.
 */
public final class PrometheusUtils {

    public static final String NAMESPACE = "certkeeper";

    private PrometheusUtils() {
    }

    /**
     * Creates and registers a new Counter.
     *
     * @param subsystem component owning the metric, e.g. {@code certificates}
     * @param name metric name, without namespace and subsystem
     * @param help description
     * @param labels label names, if any
     * @return the registered Counter
     */
    public static Counter registerCounter(String subsystem, String name, String help, String... labels) {
        Counter.Builder builder = Counter.build()
                .namespace(NAMESPACE)
                .subsystem(subsystem)
                .name(name)
                .help(help);
        if (labels != null && labels.length > 0) {
            builder.labelNames(labels);
        }
        return builder.register();
    }

    /**
     * Creates and registers a new Gauge.
     *
     * @param subsystem component owning the metric
     * @param name metric name, without namespace and subsystem
     * @param help description
     * @param labels label names, if any
     * @return the registered Gauge
     */
    public static Gauge registerGauge(String subsystem, String name, String help, String... labels) {
        Gauge.Builder builder = Gauge.build()
                .namespace(NAMESPACE)
                .subsystem(subsystem)
                .name(name)
                .help(help);
        if (labels != null && labels.length > 0) {
            builder.labelNames(labels);
        }
        return builder.register();
    }
}
