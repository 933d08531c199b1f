package com.firefly.kbagent.runtime;

/**
 * 远程Agent运行时调用
 */
public interface AgentRuntimeClient {

    /**
     * 发起一次调用并返回完整回复文本（流式响应会被拼接），可能为空字符串
     *
     * @param invocation  请求体
     * @param bearerToken 下游运行时凭证
     */
    String invoke(RuntimeInvocation invocation, String bearerToken);
}
