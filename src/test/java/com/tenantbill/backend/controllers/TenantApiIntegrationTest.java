package com.tenantbill.backend.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantbill.backend.repositories.ApiTokenRepository;
import com.tenantbill.backend.repositories.OrganizationRepository;
import com.tenantbill.backend.repositories.SubscriptionRepository;
import com.tenantbill.backend.repositories.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TenantApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrganizationRepository organizationRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private ApiTokenRepository apiTokenRepository;

    private String registerBody(String slug) {
        return "{\"organization_name\":\"Acme Inc\",\"organization_slug\":\"" + slug + "\","
                + "\"email\":\"Owner@" + slug + ".com\",\"full_name\":\"Owner User\"}";
    }

    private String register(String slug) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(slug)))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("access_token").asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private void addUser(String token, String email) throws Exception {
        mockMvc.perform(post("/organizations/me/users")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"full_name\":\"Team Member\"}"))
                .andExpect(status().isCreated());
    }

    @Test
    void health_ShouldBePublic() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void register_ShouldCreateTenantWithStarterTrial() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody("acme-inc")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.access_token").isNotEmpty())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.organization.slug").value("acme-inc"))
                .andExpect(jsonPath("$.user.email").value("owner@acme-inc.com"))
                .andExpect(jsonPath("$.user.full_name").value("Owner User"))
                .andExpect(jsonPath("$.subscription.plan").value("starter"))
                .andExpect(jsonPath("$.subscription.status").value("trialing"))
                .andExpect(jsonPath("$.subscription.stripe_customer_id").value(nullValue()));
    }

    @Test
    void register_ShouldRejectDuplicateSlugWithoutPartialRows() throws Exception {
        register("dup-co");
        long organizations = organizationRepository.count();
        long users = userRepository.count();
        long subscriptions = subscriptionRepository.count();
        long tokens = apiTokenRepository.count();

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody("dup-co")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"));

        assertThat(organizationRepository.count()).isEqualTo(organizations);
        assertThat(userRepository.count()).isEqualTo(users);
        assertThat(subscriptionRepository.count()).isEqualTo(subscriptions);
        assertThat(apiTokenRepository.count()).isEqualTo(tokens);
    }

    @Test
    void register_ShouldRejectInvalidInput() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organization_name\":\"Acme\",\"organization_slug\":\"Bad Slug\","
                                + "\"email\":\"owner@acme.com\",\"full_name\":\"Owner User\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fields").isNotEmpty());

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organization_name\":\"Acme\",\"organization_slug\":\"acme-bad-mail\","
                                + "\"email\":\"not-an-email\",\"full_name\":\"Owner User\"}"))
                .andExpect(status().isUnprocessableEntity());

        assertThat(organizationRepository.findBySlug("acme-bad-mail")).isEmpty();
    }

    @Test
    void protectedEndpoints_ShouldRequireValidBearerToken() throws Exception {
        mockMvc.perform(get("/organizations/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        mockMvc.perform(get("/organizations/me").header("Authorization", bearer("not-a-real-token")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void organizationMe_ShouldReturnProfileAndSubscription() throws Exception {
        String token = register("profile-co");

        mockMvc.perform(get("/organizations/me").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.organization.slug").value("profile-co"))
                .andExpect(jsonPath("$.organization.name").value("Acme Inc"))
                .andExpect(jsonPath("$.subscription.plan").value("starter"));
    }

    @Test
    void users_ShouldListAndCreateWithinTenant() throws Exception {
        String token = register("team-co");
        String otherToken = register("other-co");

        mockMvc.perform(get("/organizations/me/users").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(post("/organizations/me/users")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"  New.User@Team-Co.com\",\"full_name\":\"New User\"}"))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(post("/organizations/me/users")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"New.User@Team-Co.com\",\"full_name\":\"New User\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value("new.user@team-co.com"));

        mockMvc.perform(get("/organizations/me/users").header("Authorization", bearer(token)))
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].email").value("new.user@team-co.com"));

        // Same address again in the same organization
        mockMvc.perform(post("/organizations/me/users")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"new.user@team-co.com\",\"full_name\":\"New User\"}"))
                .andExpect(status().isConflict());

        // Other tenants do not see it
        mockMvc.perform(get("/organizations/me/users").header("Authorization", bearer(otherToken)))
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void users_ShouldEnforceStarterUserLimit() throws Exception {
        String token = register("full-co");
        for (int i = 1; i <= 4; i++) {
            addUser(token, "member" + i + "@full-co.com");
        }

        mockMvc.perform(post("/organizations/me/users")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"one.too.many@full-co.com\",\"full_name\":\"Extra User\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("PLAN_LIMIT_REACHED"));
    }

    @Test
    void featureGate_ShouldChangeAfterPlanUpgrade() throws Exception {
        String token = register("beta-co");

        mockMvc.perform(get("/features/advanced_analytics").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feature").value("advanced_analytics"))
                .andExpect(jsonPath("$.plan").value("starter"))
                .andExpect(jsonPath("$.required_plan").value("growth"))
                .andExpect(jsonPath("$.allowed").value(false));

        mockMvc.perform(get("/reports/advanced").header("Authorization", bearer(token)))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.message").value("advanced_analytics requires Growth plan or higher."));

        mockMvc.perform(patch("/billing/subscription")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan\":\"growth\",\"status\":\"active\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan").value("growth"))
                .andExpect(jsonPath("$.status").value("active"));

        mockMvc.perform(get("/features/advanced_analytics").header("Authorization", bearer(token)))
                .andExpect(jsonPath("$.allowed").value(true));

        mockMvc.perform(get("/reports/advanced").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kpis.mrr").value(12800))
                .andExpect(jsonPath("$.kpis.churn_rate").value(0.032))
                .andExpect(jsonPath("$.kpis.expansion_revenue").value(1900));
    }

    @Test
    void features_ShouldReturnNotFoundForUnknownKey() throws Exception {
        String token = register("feature-co");

        mockMvc.perform(get("/features/teleportation").header("Authorization", bearer(token)))
                .andExpect(status().isNotFound());
    }

    @Test
    void patchSubscription_ShouldDefaultStatusAndRejectUnknownValues() throws Exception {
        String token = register("patch-co");

        mockMvc.perform(patch("/billing/subscription")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan\":\"enterprise\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan").value("enterprise"))
                .andExpect(jsonPath("$.status").value("active"));

        mockMvc.perform(patch("/billing/subscription")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan\":\"platinum\"}"))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(patch("/billing/subscription")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plan\":\"growth\",\"status\":\"past_due\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void plans_ShouldBePublicAndOrderedByRank() throws Exception {
        mockMvc.perform(get("/billing/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plans", hasSize(3)))
                .andExpect(jsonPath("$.plans[0].name").value("starter"))
                .andExpect(jsonPath("$.plans[0].rank").value(1))
                .andExpect(jsonPath("$.plans[0].limits.max_users").value(5))
                .andExpect(jsonPath("$.plans[0].features", contains("basic_analytics", "team_management")))
                .andExpect(jsonPath("$.plans[2].name").value("enterprise"))
                .andExpect(jsonPath("$.plans[2].features", hasSize(6)));
    }

    @Test
    void rotateToken_ShouldRevokeOldToken() throws Exception {
        String token = register("rotate-co");

        MvcResult result = mockMvc.perform(post("/auth/tokens/rotate").header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.organization").doesNotExist())
                .andReturn();
        String newToken = objectMapper.readTree(result.getResponse().getContentAsString())
                .get("access_token").asText();

        assertThat(newToken).isNotEqualTo(token);

        mockMvc.perform(get("/organizations/me").header("Authorization", bearer(token)))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/organizations/me").header("Authorization", bearer(newToken)))
                .andExpect(status().isOk());
    }
}
