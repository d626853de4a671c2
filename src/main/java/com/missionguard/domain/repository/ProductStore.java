package com.missionguard.domain.repository;

import java.util.Optional;

/**
 * Write-through store for computed products (gap results, rendered reports).
 *
 * <p>Owned by the persistence collaborator; the engine reads and writes by key and
 * never manages eviction.
 */
public interface ProductStore {

    <T> Optional<T> get(ProductKey key, Class<T> type);

    void put(ProductKey key, Object product);

    /**
     * Key is {@code (missionId, templateId | analysis kind)} plus the policy version the
     * product was computed under.
     */
    record ProductKey(String missionId, String discriminator, String registryVersion) {

        public static ProductKey gapAnalysis(String missionId, String templateId, String registryVersion) {
            return new ProductKey(missionId, "gap:" + (templateId != null ? templateId : "generic"), registryVersion);
        }

        public static ProductKey report(String missionId, String templateId, String registryVersion) {
            return new ProductKey(missionId, "report:" + templateId, registryVersion);
        }
    }
}
