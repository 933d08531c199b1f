package com.firefly.kbagent.index;

public enum ProvisionStep {

    RESOLVE("Resolve"),
    CHECK_EXISTING("CheckExisting"),
    DELETE("Delete"),
    CREATE("Create"),
    VERIFY("Verify");

    private final String label;

    ProvisionStep(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
