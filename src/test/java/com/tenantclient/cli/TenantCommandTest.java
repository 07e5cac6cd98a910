package com.tenantclient.cli;

import com.tenantclient.config.ClientProperties;
import com.tenantclient.model.TenantContext;
import com.tenantclient.model.UsageType;
import com.tenantclient.service.api.TenantUsageTracker;
import com.tenantclient.service.impl.ActiveTenantHolder;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenantCommandTest {

    @Mock
    private TenantUsageTracker usageTracker;

    private ActiveTenantHolder tenantHolder;
    private TenantCommand tenantCommand;

    @BeforeEach
    void setUp() {
        tenantHolder = new ActiveTenantHolder(new ClientProperties());
        tenantCommand = new TenantCommand(tenantHolder, usageTracker);
    }

    @Test
    void tenant_switchesWithExtraHeaders() {
        String output = tenantCommand.tenant("acme", new String[]{"X-Region=eu-west-1", "X-Plan = pro"});

        assertThat(output).contains("Active tenant is now 'acme'");
        assertThat(tenantHolder.resolve()).contains(
                new TenantContext("acme", Map.of("X-Region", "eu-west-1", "X-Plan", "pro")));
    }

    @Test
    void tenant_rejectsMalformedHeader() {
        String output = tenantCommand.tenant("acme", new String[]{"X-Region"});

        assertThat(output).contains("Malformed header 'X-Region'");
        assertThat(tenantHolder.resolve()).isEmpty();
    }

    @Test
    void tenant_rejectsBlankId() {
        assertThat(tenantCommand.tenant(" ", null)).contains("tenantId must not be blank");
    }

    @Test
    void tenantShow_withoutTenant() {
        assertThat(tenantCommand.tenantShow()).contains("No active tenant");
    }

    @Test
    void usage_showsSingleType() {
        when(usageTracker.getUsage("acme", UsageType.API_CALLS)).thenReturn(42L);

        assertThat(tenantCommand.usage("acme", "api_calls")).contains("api_calls: 42");
    }

    @Test
    void usage_showsAllTypes() {
        when(usageTracker.getUsage("acme", UsageType.API_CALLS)).thenReturn(3L);
        when(usageTracker.getUsage("acme", UsageType.STORAGE)).thenReturn(null);
        when(usageTracker.getUsage("acme", UsageType.ACTIONS)).thenReturn(null);

        assertThat(tenantCommand.usage("acme", null))
                .contains("api_calls: 3")
                .contains("storage: none")
                .contains("actions: none");
    }

    @Test
    void usage_rejectsUnknownType() {
        assertThat(tenantCommand.usage("acme", "bandwidth")).contains("Unknown usage type: bandwidth");
    }

    @Test
    void usageClear_delegatesToTracker() {
        assertThat(tenantCommand.usageClear("acme")).contains("Cleared usage for tenant 'acme'");
        verify(usageTracker).clearUsage("acme");
    }

    @Test
    void usageClear_reportsBlankTenant() {
        doThrow(new IllegalArgumentException("tenantId must not be blank")).when(usageTracker).clearUsage(" ");

        assertThat(tenantCommand.usageClear(" ")).contains("tenantId must not be blank");
    }

    @Test
    void usage_reportsBlankTenant() {
        when(usageTracker.getUsage(" ", UsageType.API_CALLS)).thenThrow(new IllegalArgumentException("tenantId must not be blank"));

        assertThat(tenantCommand.usage(" ", null)).contains("tenantId must not be blank");
    }
}
