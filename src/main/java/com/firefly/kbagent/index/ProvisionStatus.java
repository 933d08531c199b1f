package com.firefly.kbagent.index;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProvisionStatus {

    CREATED("Created"),
    ALREADY_EXISTS("AlreadyExists"),
    /** 维度迁移：删除后重建 */
    RECREATED("Recreated");

    private final String label;

    ProvisionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
