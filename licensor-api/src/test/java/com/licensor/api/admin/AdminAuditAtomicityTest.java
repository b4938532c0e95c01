package com.licensor.api.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensor.infrastructure.audit.AuditLogEntity;
import com.licensor.infrastructure.audit.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Admin mutations and their audit rows commit together.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminAuditAtomicityTest {

  @Autowired MockMvc mvc;
  @Autowired ObjectMapper json;
  @MockBean AuditLogRepository audits;

  private String bearer;

  @BeforeEach
  void login() throws Exception {
    String res = mvc.perform(post("/api/v1/operator/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json.writeValueAsString(Map.of("username", "admin", "password", "secret"))))
        .andExpect(status().isOk())
        .andReturn().getResponse().getContentAsString();
    bearer = "Bearer " + json.readTree(res).get("accessToken").asText();
  }

  private MockHttpServletRequestBuilder authed(MockHttpServletRequestBuilder b) {
    return b.header("Authorization", bearer).contentType(MediaType.APPLICATION_JSON);
  }

  private String createBody(UUID customerId) throws Exception {
    return json.writeValueAsString(Map.of("customer_id", customerId.toString(), "tier", "basic", "duration_days", 30));
  }

  @Test
  void failedAuditWriteRollsBackTheSuspend() throws Exception {
    String res = mvc.perform(authed(post("/api/v1/admin/subscriptions")).content(createBody(UUID.randomUUID())))
        .andExpect(status().isCreated())
        .andReturn().getResponse().getContentAsString();
    String id = json.readTree(res).get("id").asText();

    when(audits.save(any(AuditLogEntity.class))).thenThrow(new DataAccessResourceFailureException("audit store down"));

    mvc.perform(authed(post("/api/v1/admin/subscriptions/" + id + "/suspend")))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.reason").value("storage_error"));

    mvc.perform(authed(get("/api/v1/admin/subscriptions/" + id)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"));
  }

  @Test
  void failedAuditWriteLeavesNoSubscriptionBehind() throws Exception {
    UUID customer = UUID.randomUUID();
    when(audits.save(any(AuditLogEntity.class))).thenThrow(new DataAccessResourceFailureException("audit store down"));

    mvc.perform(authed(post("/api/v1/admin/subscriptions")).content(createBody(customer)))
        .andExpect(status().isInternalServerError());

    String list = mvc.perform(authed(get("/api/v1/admin/subscriptions")).param("customerId", customer.toString()))
        .andExpect(status().isOk())
        .andReturn().getResponse().getContentAsString();
    assertThat(json.readTree(list).size()).isZero();
  }
}
