package com.invdash.collector;

import com.invdash.model.InventoryRecord;

import java.util.List;

/**
 * Backend-specific data collection for one provider.
 *
 * <p>Implementations are blocking and may be slow or fail; the refresh orchestrator imposes the
 * per-host timeout and interrupts the calling thread when it is exceeded. Register an
 * implementation as a Spring bean to expose its provider.
 */
public interface InventoryCollector {

    /**
     * @return provider id, e.g. {@code vmware}, {@code hyperv} or {@code ovirt}
     */
    String provider();

    /**
     * Collects the records of one host.
     *
     * @param hostId normalized host id
     * @param level detail level, e.g. {@code summary}
     * @param context job context of this call
     * @return collected records; {@code null} is treated as an empty list
     * @throws Exception on any backend failure
     */
    List<InventoryRecord> collect(String hostId, String level, CollectorContext context) throws Exception;
}
