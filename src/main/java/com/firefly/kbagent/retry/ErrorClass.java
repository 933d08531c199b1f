package com.firefly.kbagent.retry;

public enum ErrorClass {

    /** 目标状态已满足，例如索引已存在 */
    ALREADY_SATISFIED,

    /** 5xx、限流、连接重置、超时、最终一致窗口期内的403 */
    RETRYABLE,

    /** 输入错误、凭证不可用、其余4xx */
    FATAL
}
