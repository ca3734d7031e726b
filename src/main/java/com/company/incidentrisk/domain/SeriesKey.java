package com.company.incidentrisk.domain;

import lombok.Value;

/**
 * Identity of one monitored telemetry series: a route served by a service.
 */
@Value
public class SeriesKey implements Comparable<SeriesKey> {
    String service;
    String route;

    public static SeriesKey of(String service, String route) {
        return new SeriesKey(service, route);
    }

    @Override
    public int compareTo(SeriesKey other) {
        int byService = service.compareTo(other.service);
        return byService != 0 ? byService : route.compareTo(other.route);
    }

    @Override
    public String toString() {
        return service + "|" + route;
    }
}
