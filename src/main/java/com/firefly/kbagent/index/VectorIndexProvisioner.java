package com.firefly.kbagent.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firefly.kbagent.exception.FatalProvisioningException;
import com.firefly.kbagent.retry.RetryController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 向量索引的幂等供应：Resolve → CheckExisting → {Create | MigrateThenCreate | NoOp} → Verify。
 * <p>
 * 每一步在修改前都会先检查远端状态，因此任何一步失败后都可以从头重新调用。
 * 维度变化只能通过删除重建完成，从不尝试原地修改映射。
 * <p>
 * 并发的两次供应都观察到"索引不存在"时，由"已存在即成功"保证安全；
 * 但迁移路径（删除后重建）与另一次全新创建之间没有保护。
 */
@Service
@Slf4j
public class VectorIndexProvisioner {

    private final CollectionEndpointCache endpointCache;
    private final SearchIndexClient indexClient;
    private final IndexMappingFactory mappingFactory;
    private final RetryController retryController;
    private final VectorIndexProperties properties;
    private final Sleeper sleeper;

    public VectorIndexProvisioner(CollectionEndpointCache endpointCache,
                                  SearchIndexClient indexClient,
                                  IndexMappingFactory mappingFactory,
                                  @Qualifier("provisioningRetryController") RetryController retryController,
                                  VectorIndexProperties properties,
                                  Sleeper sleeper) {
        this.endpointCache = endpointCache;
        this.indexClient = indexClient;
        this.mappingFactory = mappingFactory;
        this.retryController = retryController;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public ProvisionOutcome provision(VectorIndexSpec spec) {
        String endpoint = resolve(spec);

        Optional<ExistingIndex> existing = checkExisting(endpoint, spec);
        ProvisionStatus status;
        boolean checkDimension = true;
        if (existing.isPresent()) {
            Integer observed = existing.get().dimension();
            if (observed == null) {
                log.warn("无法读取现有索引 {} 的向量维度，保持不变", spec.indexName());
                status = ProvisionStatus.ALREADY_EXISTS;
                checkDimension = false;
            } else if (observed == spec.vectorDimension()) {
                log.info("索引 {} 已存在且维度一致 ({})，跳过创建", spec.indexName(), observed);
                status = ProvisionStatus.ALREADY_EXISTS;
            } else {
                log.warn("索引 {} 维度不一致: 现有 {}, 目标 {}，删除后重建",
                        spec.indexName(), observed, spec.vectorDimension());
                deleteAndSettle(endpoint, spec);
                if (!create(endpoint, spec)) {
                    throw new FatalProvisioningException(ProvisionStep.CREATE,
                            "index " + spec.indexName() + " still exists after delete - deletion has not propagated");
                }
                status = ProvisionStatus.RECREATED;
            }
        } else {
            status = create(endpoint, spec) ? ProvisionStatus.CREATED : ProvisionStatus.ALREADY_EXISTS;
        }

        verify(endpoint, spec, checkDimension);
        log.info("索引供应完成: index={}, collection={}, status={}", spec.indexName(), spec.collectionId(),
                status.label());
        return new ProvisionOutcome(spec.indexName(), spec.collectionId(), status);
    }

    private String resolve(VectorIndexSpec spec) {
        Optional<String> endpoint;
        try {
            endpoint = endpointCache.get(spec.collectionId());
        } catch (RuntimeException e) {
            throw new FatalProvisioningException(ProvisionStep.RESOLVE,
                    "unable to resolve collection " + spec.collectionId() + ": " + e.getMessage(), null, null, e);
        }
        return endpoint.orElseThrow(() -> new FatalProvisioningException(ProvisionStep.RESOLVE,
                "collection " + spec.collectionId() + " does not exist"));
    }

    /**
     * 404 表示不存在；其他失败只记录日志，按不存在继续
     */
    private Optional<ExistingIndex> checkExisting(String endpoint, VectorIndexSpec spec) {
        try {
            return indexClient.getIndex(endpoint, spec.indexName());
        } catch (HttpStatusCodeException e) {
            log.warn("无法检查现有索引 {} ({} {})，继续供应", spec.indexName(),
                    e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RuntimeException e) {
            log.warn("无法检查现有索引 {}: {}，继续供应", spec.indexName(), e.getMessage());
        }
        return Optional.empty();
    }

    private void deleteAndSettle(String endpoint, VectorIndexSpec spec) {
        runStep(ProvisionStep.DELETE, spec, () -> {
            indexClient.deleteIndex(endpoint, spec.indexName());
            return Boolean.TRUE;
        }, () -> Boolean.TRUE);
        long settleMs = properties.getSettleDelay().toMillis();
        log.info("等待删除传播 {} 秒", settleMs / 1000.0);
        try {
            sleeper.sleep(settleMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalProvisioningException(ProvisionStep.DELETE,
                    "interrupted while waiting for delete of " + spec.indexName() + " to settle", null, null, e);
        }
    }

    /**
     * @return false 表示创建请求返回"已存在"（可能被并发调用抢先创建，或删除尚未生效）
     */
    private boolean create(String endpoint, VectorIndexSpec spec) {
        ObjectNode mapping = mappingFactory.build(spec);
        return runStep(ProvisionStep.CREATE, spec, () -> {
            indexClient.createIndex(endpoint, spec.indexName(), mapping);
            return Boolean.TRUE;
        }, () -> Boolean.FALSE);
    }

    /**
     * 存储只保证最终一致，创建成功的响应必须回读确认，且回读的维度必须等于目标维度
     */
    private void verify(String endpoint, VectorIndexSpec spec, boolean checkDimension) {
        Optional<ExistingIndex> readBack = runStep(ProvisionStep.VERIFY, spec,
                () -> indexClient.getIndex(endpoint, spec.indexName()), Optional::empty);
        if (readBack.isEmpty()) {
            throw new FatalProvisioningException(ProvisionStep.VERIFY,
                    "index " + spec.indexName() + " was not created successfully - verification failed");
        }
        Integer dimension = readBack.get().dimension();
        if (checkDimension && (dimension == null || dimension != spec.vectorDimension())) {
            throw new FatalProvisioningException(ProvisionStep.VERIFY,
                    "index " + spec.indexName() + " reports dimension " + dimension + ", expected "
                            + spec.vectorDimension() + " - verification failed");
        }
        log.info("索引校验通过: {} (dimension={})", spec.indexName(), dimension);
    }

    private <T> T runStep(ProvisionStep step, VectorIndexSpec spec, Supplier<T> work, Supplier<T> satisfied) {
        try {
            return retryController.execute(step.label() + " " + spec.indexName(), work, satisfied);
        } catch (FatalProvisioningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw FatalProvisioningException.of(step, spec.indexName(), e);
        }
    }
}
