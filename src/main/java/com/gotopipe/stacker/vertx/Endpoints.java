package com.gotopipe.stacker.vertx;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public enum Endpoints {
    OPS_HEALTHCHECK("/ops/healthcheck"),
    STACKING_RUN("/stacking/run"),
    STACKING_RUN_STATUS("/stacking/run/status");
    private final String path;

    Endpoints(final String path) {
        this.path = path;
    }

    public static Set<String> pathSet() {
        return Stream.of(Endpoints.values()).map(Endpoints::toString).collect(Collectors.toSet());
    }

    @Override
    public String toString() {
        return path;
    }
}
