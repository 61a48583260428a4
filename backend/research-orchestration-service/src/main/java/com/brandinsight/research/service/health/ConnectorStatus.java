package com.brandinsight.research.service.health;

public enum ConnectorStatus {
    OK("ok"),
    DEGRADED("degraded");

    private final String value;

    ConnectorStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
