package com.firefly.kbagent.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.kbagent.KbAgentApplication;
import com.firefly.kbagent.index.IndexLifecycleEvent;
import com.firefly.kbagent.index.IndexLifecycleResult;
import com.firefly.kbagent.index.VectorIndexResourceHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.HashMap;
import java.util.Map;

/**
 * 命令行工具：创建/校验/迁移向量索引。
 * 不启动Web服务，仅加载Spring上下文。成功退出码0，任何前置条件不满足或失败退出码1。
 *
 * 用法示例：
 * mvn -q -DskipTests -Dexec.mainClass=com.firefly.kbagent.tool.VectorIndexProvisionTool \
 *   exec:java -Dexec.args="action=Create collection=kb-collection index=kb-index dimension=1024"
 */
@Slf4j
public class VectorIndexProvisionTool {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Map<String, String> params = parseArgs(args);
        String action = params.getOrDefault("action", "Create");
        String collection = params.get("collection");
        String index = params.get("index");
        Integer dimension;
        try {
            dimension = params.containsKey("dimension") ? Integer.valueOf(params.get("dimension")) : null;
        } catch (NumberFormatException e) {
            System.err.println("dimension 必须是正整数: " + params.get("dimension"));
            return 1;
        }

        if (collection == null || index == null) {
            System.err.println("用法: action=Create|Update|Delete collection=<id> index=<name> [dimension=1024] [physicalId=<id>]");
            return 1;
        }

        IndexLifecycleEvent event = IndexLifecycleEvent.builder()
                .requestType(action)
                .physicalResourceId(params.get("physicalId"))
                .resourceProperties(IndexLifecycleEvent.ResourceProperties.builder()
                        .collectionId(collection)
                        .indexName(index)
                        .dimension(dimension)
                        .build())
                .build();

        ConfigurableApplicationContext ctx;
        try {
            ctx = new SpringApplicationBuilder(KbAgentApplication.class)
                    .web(WebApplicationType.NONE)
                    .run();
        } catch (Exception e) {
            log.error("Spring上下文启动失败", e);
            return 1;
        }
        try {
            IndexLifecycleResult result = ctx.getBean(VectorIndexResourceHandler.class).handle(event);
            ObjectMapper mapper = ctx.getBean(ObjectMapper.class);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            return 0;
        } catch (Exception e) {
            log.error("索引供应失败: {}", e.getMessage(), e);
            return 1;
        } finally {
            ctx.close();
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> map = new HashMap<>();
        if (args == null) {
            return map;
        }
        for (String arg : args) {
            if (arg == null || arg.isBlank()) continue;
            String cleaned = arg.startsWith("--") ? arg.substring(2) : arg;
            int idx = cleaned.indexOf('=');
            if (idx > 0 && idx < cleaned.length() - 1) {
                map.put(cleaned.substring(0, idx), cleaned.substring(idx + 1));
            }
        }
        return map;
    }
}
