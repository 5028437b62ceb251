package com.invdash.refresh;

import com.invdash.config.InventoryProperties;
import com.invdash.model.JobStatus;
import com.invdash.model.ScopeKey;
import com.invdash.model.ScopeName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WarmupSchedulerTest {

    private InventoryService inventoryService;
    private InventoryProperties properties;

    @BeforeEach
    void setUp() {
        inventoryService = mock(InventoryService.class);
        properties = new InventoryProperties();
        properties.getWarmup().setEnabled(true);
        properties.getWarmup().setTargets(List.of(
                target("vmware", "vms", "esx-01"),
                target("hyperv", "hosts", "p-hyp-01"),
                target("vmware", "clusters", "esx-01")));
    }

    @Test
    void triggersNonForcedRefreshPerTarget() {
        JobStatus job = JobStatus.builder().jobId("j1").build();
        when(inventoryService.isRefreshing(anyString(), any())).thenReturn(false);
        when(inventoryService.triggerRefresh(eq("vmware"), eq("vms"), any(), any(), eq(false))).thenReturn(Optional.of(job));
        when(inventoryService.triggerRefresh(eq("hyperv"), eq("hosts"), any(), any(), eq(false))).thenReturn(Optional.empty());

        int started = new WarmupScheduler(inventoryService, properties).warmAll();

        assertThat(started).isEqualTo(1);
        verify(inventoryService).triggerRefresh("vmware", "vms", List.of("esx-01"), null, false);
        verify(inventoryService).triggerRefresh("hyperv", "hosts", List.of("p-hyp-01"), null, false);
        verify(inventoryService, never()).triggerRefresh(anyString(), eq("clusters"), any(), any(), anyBoolean());
    }

    @Test
    void skipsScopesAlreadyRefreshing() {
        when(inventoryService.isRefreshing("vmware", ScopeKey.of(ScopeName.VMS, List.of("esx-01")))).thenReturn(true);
        when(inventoryService.triggerRefresh(anyString(), anyString(), any(), any(), anyBoolean())).thenReturn(Optional.empty());

        new WarmupScheduler(inventoryService, properties).warmAll();

        verify(inventoryService, never()).triggerRefresh(eq("vmware"), eq("vms"), any(), any(), anyBoolean());
    }

    @Test
    void disabledWarmupSchedulesNothing() {
        properties.getWarmup().setEnabled(false);
        WarmupScheduler scheduler = new WarmupScheduler(inventoryService, properties);

        scheduler.start();
        scheduler.stop();

        verify(inventoryService, never()).triggerRefresh(any(), any(), any(), any(), anyBoolean());
    }

    private static InventoryProperties.WarmupTarget target(String provider, String scope, String host) {
        InventoryProperties.WarmupTarget target = new InventoryProperties.WarmupTarget();
        target.setProvider(provider);
        target.setScope(scope);
        target.setHosts(List.of(host));
        return target;
    }
}
