package org.iceforge.bifrost.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminControllerTest {

    private static final String OWNER = "alice";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper json;

    private JsonNode registerPostgres(String owner) throws Exception {
        String body = mvc.perform(post("/api/connectors").header(AdminController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "warehouse", "type": "relational-b",
                                 "connection_config": {"host": "pg.internal", "username": "svc", "password": "pw"},
                                 "allowed_operations": ["select"]}
                                """))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return json.readTree(body);
    }

    @Test
    void registerReturnsTokenAndProxyAddressButNoSecrets() throws Exception {
        JsonNode c = registerPostgres(OWNER);

        assertThat(c.get("id").asText()).isNotBlank();
        assertThat(c.get("access_token").asText()).isNotBlank();
        assertThat(c.get("type").asText()).isEqualTo("relational-b");
        assertThat(c.get("proxy_url").asText()).startsWith("127.0.0.1:");
        assertThat(c.get("allowed_operations").toString()).isEqualTo("[\"SELECT\"]");
        assertThat(c.has("connection_config")).isFalse();
        assertThat(c.toString()).doesNotContain("pg.internal");
    }

    @Test
    void connectorsAreScopedToTheOwner() throws Exception {
        JsonNode c = registerPostgres("owner-scope");

        mvc.perform(get("/api/connectors").header(AdminController.OWNER_HEADER, "owner-scope"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
        mvc.perform(get("/api/connectors/" + c.get("id").asText()).header(AdminController.OWNER_HEADER, "mallory"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("connector_not_found"));
    }

    @Test
    void unknownTypeAndMissingConfigAreBadRequests() throws Exception {
        mvc.perform(post("/api/connectors").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"type\": \"teradata\", \"connection_config\": {\"host\": \"h\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_argument"));
        mvc.perform(post("/api/connectors").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"type\": \"document\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void updateChangesOperationsAndKeepsToken() throws Exception {
        JsonNode c = registerPostgres(OWNER);
        String id = c.get("id").asText();

        mvc.perform(patch("/api/connectors/" + id).header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"renamed\", \"allowed_operations\": [\"SELECT\", \"INSERT\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("renamed"))
                .andExpect(jsonPath("$.allowed_operations", hasSize(2)))
                .andExpect(jsonPath("$.access_token").value(c.get("access_token").asText()));
    }

    @Test
    void linkLifecycle() throws Exception {
        JsonNode c = registerPostgres(OWNER);
        String connectorId = c.get("id").asText();

        String created = mvc.perform(post("/api/links").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"connector_id\": \"" + connectorId + "\", \"name\": \"for bob\","
                                + " \"password\": \"hunter2\", \"max_uses\": 3, \"expires_in_hours\": 24}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.target_type").value("connector"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.password_protected").value(true))
                .andExpect(jsonPath("$.public_url", startsWith("http://127.0.0.1:")))
                .andExpect(jsonPath("$.public_url", containsString("/share/")))
                .andReturn().getResponse().getContentAsString();
        JsonNode link = json.readTree(created);
        assertThat(link.has("password")).isFalse();
        assertThat(link.has("password_hash")).isFalse();
        String shareId = link.get("share_id").asText();

        mvc.perform(get("/api/connectors/" + connectorId + "/links").header(AdminController.OWNER_HEADER, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].share_id").value(shareId));

        mvc.perform(get("/api/links/" + shareId).header(AdminController.OWNER_HEADER, "mallory"))
                .andExpect(status().isNotFound());

        mvc.perform(delete("/api/links/" + shareId).header(AdminController.OWNER_HEADER, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REVOKED"));
        // revoking twice is not an error
        mvc.perform(delete("/api/links/" + shareId).header(AdminController.OWNER_HEADER, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REVOKED"));
        mvc.perform(get("/api/links/" + shareId + "/status").header(AdminController.OWNER_HEADER, OWNER))
                .andExpect(jsonPath("$.status").value("REVOKED"));
    }

    @Test
    void linkNeedsExactlyOneTarget() throws Exception {
        mvc.perform(post("/api/links").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"nothing\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/links").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"connector_id\": \"c\", \"dataset_id\": \"sales-2025\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/links").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset_id\": \"no-such-dataset\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/links").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset_id\": \"sales-2025\", \"expires_in_hours\": 0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void datasetLink() throws Exception {
        mvc.perform(post("/api/links").header(AdminController.OWNER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset_id\": \"sales-2025\", \"name\": \"sales\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.target_type").value("dataset"))
                .andExpect(jsonPath("$.target_id").value("sales-2025"));
    }

    @Test
    void deletingConnectorRevokesItsLinks() throws Exception {
        JsonNode c = registerPostgres(OWNER);
        String connectorId = c.get("id").asText();
        for (int i = 0; i < 2; i++) {
            mvc.perform(post("/api/links").header(AdminController.OWNER_HEADER, OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"connector_id\": \"" + connectorId + "\"}"))
                    .andExpect(status().isCreated());
        }

        mvc.perform(delete("/api/connectors/" + connectorId).header(AdminController.OWNER_HEADER, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.links_revoked").value(2));
        mvc.perform(get("/api/connectors/" + connectorId + "/links").header(AdminController.OWNER_HEADER, OWNER))
                .andExpect(jsonPath("$[0].status").value("REVOKED"))
                .andExpect(jsonPath("$[1].status").value("REVOKED"));
    }

    @Test
    void usageOfFreshConnectorIsZero() throws Exception {
        JsonNode c = registerPostgres(OWNER);
        mvc.perform(get("/api/usage/" + c.get("id").asText()).header(AdminController.OWNER_HEADER, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_requests").value(0))
                .andExpect(jsonPath("$.succeeded").value(0));
    }

    @Test
    void listenersAreReported() throws Exception {
        mvc.perform(get("/api/listeners"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(7)))
                .andExpect(jsonPath("$[?(@.proxy_type == 'postgresql')].state").value("running"));
    }

    @Test
    void missingOwnerHeaderIsRejected() throws Exception {
        mvc.perform(get("/api/connectors")).andExpect(status().isBadRequest());
    }
}
