package com.tenantclient.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TenantDataIsolationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void filterByTenant_keepsOnlyOwnRowsInOrder() throws Exception {
        JsonNode rows = objectMapper.readTree("[{\"id\":1,\"tenant_id\":\"acme\"},"
                + "{\"id\":2,\"tenant_id\":\"globex\"},"
                + "{\"id\":3},"
                + "{\"id\":4,\"tenant_id\":\"acme\"}]");

        ArrayNode kept = TenantDataIsolation.filterByTenant(rows, "acme");

        assertThat(kept.size()).isEqualTo(2);
        assertThat(kept.get(0).get("id").asInt()).isEqualTo(1);
        assertThat(kept.get(1).get("id").asInt()).isEqualTo(4);
        assertThat(rows.size()).isEqualTo(4);
    }

    @Test
    void filterByTenant_nonArrayYieldsEmpty() throws Exception {
        assertThat(TenantDataIsolation.filterByTenant(objectMapper.readTree("{\"tenant_id\":\"acme\"}"), "acme").isEmpty()).isTrue();
        assertThat(TenantDataIsolation.filterByTenant(null, "acme").isEmpty()).isTrue();
    }

    @Test
    void addTenantId_overridesForeignTenantOnACopy() {
        ObjectNode data = objectMapper.createObjectNode().put("name", "Apollo").put("tenant_id", "globex");

        ObjectNode stamped = TenantDataIsolation.addTenantId(data, "acme");

        assertThat(stamped.get("tenant_id").asText()).isEqualTo("acme");
        assertThat(stamped.get("name").asText()).isEqualTo("Apollo");
        assertThat(data.get("tenant_id").asText()).isEqualTo("globex");
    }

    @Test
    void validateTenantAccess_requiresBothSidesToMatch() {
        assertThat(TenantDataIsolation.validateTenantAccess("acme", "acme")).isTrue();
        assertThat(TenantDataIsolation.validateTenantAccess("acme", "globex")).isFalse();
        assertThat(TenantDataIsolation.validateTenantAccess(null, null)).isFalse();
        assertThat(TenantDataIsolation.validateTenantAccess("acme", null)).isFalse();
    }

    @Test
    void createTenantQuery_putsTenantFirstAndKeepsItPinned() {
        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("status", "active");
        additional.put("tenant_id", "globex");
        additional.put("page", 2);

        Map<String, Object> query = TenantDataIsolation.createTenantQuery("acme", additional);

        assertThat(query).containsExactly(
                Map.entry("tenant_id", "acme"),
                Map.entry("status", "active"),
                Map.entry("page", 2));
    }

    @Test
    void blankTenant_isRejected() {
        assertThatThrownBy(() -> TenantDataIsolation.createTenantQuery(" ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TenantDataIsolation.addTenantId(objectMapper.createObjectNode(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
