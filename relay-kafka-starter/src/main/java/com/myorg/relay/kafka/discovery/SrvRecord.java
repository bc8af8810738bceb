package com.myorg.relay.kafka.discovery;

import java.util.Comparator;

public record SrvRecord(int priority, int weight, int port, String target) {

    //Lowest priority first, heavier weight first within a priority.
    public static final Comparator<SrvRecord> PREFERRED_FIRST = Comparator
            .comparingInt(SrvRecord::priority)
            .thenComparing(Comparator.comparingInt(SrvRecord::weight).reversed());

    /**
     * Target host without the trailing root dot DNS hands back.
     */
    public String host() {
        return target.endsWith(".") ? target.substring(0, target.length() - 1) : target;
    }
}
