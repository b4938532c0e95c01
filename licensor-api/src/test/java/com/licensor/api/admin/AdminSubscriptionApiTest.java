package com.licensor.api.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensor.infrastructure.audit.AuditLogEntity;
import com.licensor.infrastructure.audit.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminSubscriptionApiTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper json;
  @Autowired AuditLogRepository audits;

  private String bearer;

  @BeforeEach
  void login() throws Exception {
    String res = mvc.perform(post("/api/v1/operator/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json.writeValueAsString(Map.of("username", "admin", "password", "secret"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tokenType").value("Bearer"))
        .andExpect(jsonPath("$.expiresInSeconds").value(1800))
        .andReturn().getResponse().getContentAsString();
    bearer = "Bearer " + json.readTree(res).get("accessToken").asText();
  }

  private MockHttpServletRequestBuilder authed(MockHttpServletRequestBuilder b) {
    return b.header("Authorization", bearer).contentType(MediaType.APPLICATION_JSON);
  }

  private JsonNode create(UUID customerId, String tier, int maxDevices) throws Exception {
    String res = mvc.perform(authed(post("/api/v1/admin/subscriptions"))
            .content(json.writeValueAsString(Map.of(
                "customer_id", customerId.toString(),
                "tier", tier,
                "duration_days", 30,
                "max_devices", maxDevices))))
        .andExpect(status().isCreated())
        .andReturn().getResponse().getContentAsString();
    return json.readTree(res);
  }

  @Test
  void wrongPasswordIsRejected() throws Exception {
    mvc.perform(post("/api/v1/operator/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json.writeValueAsString(Map.of("username", "admin", "password", "nope"))))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.reason").value("invalid_credentials"));
  }

  @Test
  void adminEndpointsNeedAToken() throws Exception {
    mvc.perform(get("/api/v1/admin/subscriptions/" + UUID.randomUUID()))
        .andExpect(status().isUnauthorized());

    mvc.perform(get("/api/v1/admin/subscriptions/" + UUID.randomUUID()).header("Authorization", "Bearer garbage"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void createdSubscriptionIsActiveWithGeneratedKey() throws Exception {
    UUID customer = UUID.randomUUID();
    JsonNode created = create(customer, "professional", 2);

    assertThat(created.get("status").asText()).isEqualTo("active");
    assertThat(created.get("tier").asText()).isEqualTo("professional");
    assertThat(created.get("license_key").asText()).matches("FL(-[A-Z0-9]{6}){4}");
    assertThat(created.get("max_devices").asInt()).isEqualTo(2);
    assertThat(created.get("grace_period_days").asInt()).isEqualTo(7);

    String id = created.get("id").asText();
    mvc.perform(authed(get("/api/v1/admin/subscriptions/" + id)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.customer_id").value(customer.toString()));

    mvc.perform(authed(get("/api/v1/admin/subscriptions")).param("customerId", customer.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1));

    assertThat(audits.findByTargetTypeAndTargetIdOrderByCreatedAtAsc("subscription", id))
        .extracting(AuditLogEntity::getAction, AuditLogEntity::getActorId)
        .containsExactly(tuple("SUBSCRIPTION_CREATE", "admin"));
  }

  @Test
  void lifecycleTransitionsAreAudited() throws Exception {
    String id = create(UUID.randomUUID(), "basic", 1).get("id").asText();
    String base = "/api/v1/admin/subscriptions/" + id;

    mvc.perform(authed(post(base + "/suspend")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("suspended"));

    mvc.perform(authed(post(base + "/resume")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"));

    mvc.perform(authed(post(base + "/resume")))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("illegal_transition"));

    mvc.perform(authed(post(base + "/extend")).content("{\"days\": 10}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.days_until_expiry").value(39));

    mvc.perform(authed(put(base + "/tier")).content("{\"tier\": \"enterprise\", \"feature_overrides\": {\"max_products\": 42}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tier").value("enterprise"))
        .andExpect(jsonPath("$.features.max_products").value(42))
        .andExpect(jsonPath("$.features.max_customers").value(-1));

    mvc.perform(authed(put(base + "/limits")).content("{\"max_devices\": 5, \"grace_period_days\": 0}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.max_devices").value(5))
        .andExpect(jsonPath("$.grace_period_days").value(0));

    mvc.perform(authed(post(base + "/cancel")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("cancelled"));

    assertThat(audits.findByTargetTypeAndTargetIdOrderByCreatedAtAsc("subscription", id))
        .extracting(AuditLogEntity::getAction)
        .containsExactly("SUBSCRIPTION_CREATE", "SUBSCRIPTION_SUSPEND", "SUBSCRIPTION_RESUME",
            "SUBSCRIPTION_EXTEND", "SUBSCRIPTION_TIER", "SUBSCRIPTION_LIMITS", "SUBSCRIPTION_CANCEL");
  }

  @Test
  void releasingADeviceFreesItsSlot() throws Exception {
    JsonNode created = create(UUID.randomUUID(), "basic", 1);
    String id = created.get("id").asText();
    String key = created.get("license_key").asText();

    mvc.perform(post("/api/v1/licenses/activate").contentType(MediaType.APPLICATION_JSON)
            .content(json.writeValueAsString(Map.of("license_key", key, "device_id", "pc-1"))))
        .andExpect(status().isOk());

    mvc.perform(authed(delete("/api/v1/admin/subscriptions/" + id + "/devices/pc-1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active_devices").value(0))
        .andExpect(jsonPath("$.devices[0].active").value(false));

    mvc.perform(authed(delete("/api/v1/admin/subscriptions/" + id + "/devices/unknown")))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.reason").value("device_not_found"));

    mvc.perform(post("/api/v1/licenses/activate").contentType(MediaType.APPLICATION_JSON)
            .content(json.writeValueAsString(Map.of("license_key", key, "device_id", "pc-2"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.action").value("can_activate"));
  }

  @Test
  void oversizedFeatureOverrideIsBadRequest() throws Exception {
    String id = create(UUID.randomUUID(), "basic", 1).get("id").asText();

    mvc.perform(authed(put("/api/v1/admin/subscriptions/" + id + "/tier"))
            .content("{\"tier\": \"basic\", \"feature_overrides\": {\"max_customers\": 99999999999999999999}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value("error"))
        .andExpect(jsonPath("$.reason").value("bad_request"));

    mvc.perform(authed(put("/api/v1/admin/subscriptions/" + id + "/tier"))
            .content("{\"tier\": \"basic\", \"feature_overrides\": {\"max_customers\": 1e20}}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("bad_request"));

    mvc.perform(authed(get("/api/v1/admin/subscriptions/" + id)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.features.max_customers").value(100));
  }

  @Test
  void unknownSubscriptionIsNotFound() throws Exception {
    mvc.perform(authed(get("/api/v1/admin/subscriptions/" + UUID.randomUUID())))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.reason").value("subscription_not_found"));
  }

  @Test
  void invalidCreateRequestIsBadRequest() throws Exception {
    mvc.perform(authed(post("/api/v1/admin/subscriptions"))
            .content(json.writeValueAsString(Map.of("customer_id", UUID.randomUUID().toString(), "tier", "gold"))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("bad_request"));

    mvc.perform(authed(post("/api/v1/admin/subscriptions"))
            .content(json.writeValueAsString(Map.of("tier", "basic", "max_devices", 0))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("validation_error"));
  }
}
