package com.firefly.kbagent.index;

import java.util.Optional;

public interface CollectionEndpointResolver {

    /**
     * 通过搜索服务控制面API解析集合的网络端点
     *
     * @return 集合不存在时为空
     */
    Optional<String> resolve(String collectionId);
}
