package com.platform.clonegovernance.api;

import com.platform.clonegovernance.error.ResourceNotFoundException;
import com.platform.clonegovernance.error.ValidationException;
import com.platform.clonegovernance.evaluation.ActorIdentity;
import com.platform.clonegovernance.observability.MetricsRegistry;
import com.platform.clonegovernance.policy.Policy;
import com.platform.clonegovernance.policy.PolicyAction;
import com.platform.clonegovernance.policy.PolicyCommandResult;
import com.platform.clonegovernance.policy.PolicyDefinition;
import com.platform.clonegovernance.policy.PolicyDefinitionCodec;
import com.platform.clonegovernance.policy.PolicyDraft;
import com.platform.clonegovernance.policy.PolicyKind;
import com.platform.clonegovernance.policy.PolicyService;
import com.platform.clonegovernance.policy.PolicySeverity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PolicyController.class)
@Import(PolicyDefinitionCodec.class)
class PolicyControllerTest {

    private static final String CREATE_BODY = """
        {
          "name": "MAX_TOTAL_USER_CLONES_10",
          "kind": "USER_QUOTA",
          "definition": {"max_total_clones": 10, "action": "BLOCK"},
          "severity": "ERROR"
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PolicyService policyService;

    @MockBean
    private MetricsRegistry metricsRegistry;

    @Test
    void createReturnsCreatedPolicyWithEncodedDefinition() throws Exception {
        when(policyService.createPolicy(any(), any())).thenReturn(quotaPolicy());

        mockMvc.perform(post("/api/policies")
                .header(ApiHeaders.ACTOR, "admin")
                .header(ApiHeaders.ACTOR_ROLE, "PLATFORM_ADMIN")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CREATE_BODY))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("MAX_TOTAL_USER_CLONES_10"))
            .andExpect(jsonPath("$.kind").value("USER_QUOTA"))
            .andExpect(jsonPath("$.definition.max_total_clones").value(10))
            .andExpect(jsonPath("$.definition.action").value("BLOCK"))
            .andExpect(jsonPath("$.summary").value("Live clones >= 10"));

        ArgumentCaptor<PolicyDraft> draft = ArgumentCaptor.forClass(PolicyDraft.class);
        ArgumentCaptor<ActorIdentity> actor = ArgumentCaptor.forClass(ActorIdentity.class);
        verify(policyService).createPolicy(draft.capture(), actor.capture());
        assertThat(draft.getValue().kind()).isEqualTo("USER_QUOTA");
        assertThat(draft.getValue().definition().get("max_total_clones").asInt()).isEqualTo(10);
        assertThat(actor.getValue().user()).isEqualTo("admin");
        assertThat(actor.getValue().role()).isEqualTo("PLATFORM_ADMIN");
    }

    @Test
    void createWithoutActorHeaderIsRejected() throws Exception {
        mockMvc.perform(post("/api/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CREATE_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CG-102"));

        verify(policyService, never()).createPolicy(any(), any());
    }

    @Test
    void createWithoutNameFailsBeanValidation() throws Exception {
        mockMvc.perform(post("/api/policies")
                .header(ApiHeaders.ACTOR, "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\": \"USER_QUOTA\", \"definition\": {\"max_total_clones\": 10}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CG-100"));
    }

    @Test
    void definitionErrorsComeBackAsBadRequest() throws Exception {
        when(policyService.createPolicy(any(), any()))
            .thenThrow(ValidationException.invalidDefinition("max_total_clones", "ten", "must be an integer"));

        mockMvc.perform(post("/api/policies")
                .header(ApiHeaders.ACTOR, "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CREATE_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CG-112"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("definition.max_total_clones"));
    }

    @Test
    void unknownPolicyIsNotFound() throws Exception {
        when(policyService.getPolicy("missing")).thenThrow(ResourceNotFoundException.policy("missing"));

        mockMvc.perform(get("/api/policies/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CG-301"));
    }

    @Test
    void unknownEndpointIsNotFoundRatherThanServerError() throws Exception {
        mockMvc.perform(get("/api/unknown"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CG-300"))
            .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void toggleOfUnknownPolicyReturnsNotFoundDocument() throws Exception {
        when(policyService.setPolicyActive(eq("missing"), eq(false), any()))
            .thenReturn(PolicyCommandResult.notFound("missing"));

        mockMvc.perform(patch("/api/policies/missing/active")
                .param("active", "false")
                .header(ApiHeaders.ACTOR, "admin"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value("NOT_FOUND"))
            .andExpect(jsonPath("$.policyId").value("missing"))
            .andExpect(jsonPath("$.policy").doesNotExist());
    }

    @Test
    void toggleReturnsUpdatedPolicy() throws Exception {
        Policy inactive = quotaPolicy().toBuilder().active(false).build();
        when(policyService.setPolicyActive(eq(inactive.getId()), eq(false), any()))
            .thenReturn(PolicyCommandResult.success(inactive, "Policy deactivated"));

        mockMvc.perform(patch("/api/policies/{id}/active", inactive.getId())
                .param("active", "false")
                .header(ApiHeaders.ACTOR, "admin"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.policy.active").value(false));
    }

    @Test
    void listPassesFiltersThrough() throws Exception {
        when(policyService.listPolicies("PRD", "USER_QUOTA", true)).thenReturn(List.of(quotaPolicy()));

        mockMvc.perform(get("/api/policies")
                .param("scope", "PRD")
                .param("kind", "USER_QUOTA")
                .param("activeOnly", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("MAX_TOTAL_USER_CLONES_10"))
            .andExpect(jsonPath("$[0].severity").value("ERROR"));
    }

    private static Policy quotaPolicy() {
        return Policy.builder()
            .name("MAX_TOTAL_USER_CLONES_10")
            .kind(PolicyKind.USER_QUOTA)
            .definition(new PolicyDefinition.UserQuota(10, PolicyAction.BLOCK))
            .severity(PolicySeverity.ERROR)
            .createdBy("admin")
            .build();
    }
}
