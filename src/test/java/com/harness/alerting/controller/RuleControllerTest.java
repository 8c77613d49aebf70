package com.harness.alerting.controller;

import com.harness.alerting.enums.MatchMode;
import com.harness.alerting.model.RuleDto;
import com.harness.alerting.service.RuleFireHistoryService;
import com.harness.alerting.service.RuleService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RuleController.class)
class RuleControllerTest {

  private static final String RULE_JSON = """
      {
        "name": "High volume",
        "enabled": true,
        "actionMatch": "ALL",
        "frequencyMinutes": 30,
        "conditions": [
          {"kind": "event_frequency", "params": {"interval": "1h", "value": 100}}
        ],
        "actions": [
          {"kind": "notify_event", "params": {}}
        ]
      }
      """;

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private RuleService ruleService;

  @MockBean
  private RuleFireHistoryService fireHistoryService;

  @Test
  void createReturns201WithLocation() throws Exception {
    UUID id = UUID.randomUUID();
    given(ruleService.createRule(eq(1L), any(RuleDto.class))).willReturn(rule(id, "High volume"));

    mockMvc.perform(post("/api/v1/projects/1/rules")
            .contentType(MediaType.APPLICATION_JSON)
            .content(RULE_JSON))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/v1/projects/1/rules/" + id))
        .andExpect(jsonPath("$.name").value("High volume"))
        .andExpect(jsonPath("$.frequencyMinutes").value(30));
  }

  @Test
  void invalidRuleReturns400() throws Exception {
    given(ruleService.createRule(eq(1L), any(RuleDto.class)))
        .willThrow(new IllegalArgumentException("Unknown condition kind: event_frequency"));

    mockMvc.perform(post("/api/v1/projects/1/rules")
            .contentType(MediaType.APPLICATION_JSON)
            .content(RULE_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Unknown condition kind: event_frequency"));
  }

  @Test
  void snoozeUnknownRuleReturns404() throws Exception {
    UUID id = UUID.randomUUID();
    given(ruleService.setRuleSnoozed(1L, id, true)).willReturn(Optional.empty());

    mockMvc.perform(patch("/api/v1/projects/1/rules/" + id + "/snooze"))
        .andExpect(status().isNotFound());
  }

  @Test
  void historyOfForeignRuleReturns404() throws Exception {
    UUID id = UUID.randomUUID();
    given(ruleService.getRule(1L, id)).willReturn(Optional.empty());

    mockMvc.perform(get("/api/v1/projects/1/rules/" + id + "/history"))
        .andExpect(status().isNotFound());

    verify(fireHistoryService, never()).listForRule(any());
  }

  @Test
  void historyListsFires() throws Exception {
    UUID id = UUID.randomUUID();
    given(ruleService.getRule(1L, id)).willReturn(Optional.of(rule(id, "High volume")));
    given(fireHistoryService.listForRule(id)).willReturn(List.of());

    mockMvc.perform(get("/api/v1/projects/1/rules/" + id + "/history"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isArray());
  }

  private RuleDto rule(UUID id, String name) {
    Instant now = Instant.parse("2026-03-10T12:00:00Z");
    return new RuleDto(id, 1L, name, null, true, false, MatchMode.ALL, MatchMode.ALL, 30, List.of(), List.of(),
        now, now);
  }
}
