package com.firefly.kbagent.index;

import java.util.Map;

public record IndexLifecycleResult(String physicalResourceId, Map<String, String> data) {
}
