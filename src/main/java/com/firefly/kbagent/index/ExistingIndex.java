package com.firefly.kbagent.index;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 远端已存在索引的观测结果
 *
 * @param dimension  向量字段维度，无法读取时为null
 * @param definition 索引定义原文（mappings/settings）
 */
public record ExistingIndex(Integer dimension, JsonNode definition) {
}
