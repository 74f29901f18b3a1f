package io.changestream.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("inmem")
class ChangeStreamApplicationTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper json;
    @Autowired ChangeStreamProperties props;

    @Test
    void appendSubscribeReadAcknowledgeReplay() throws Exception {
        for (var type : new String[]{"CREATED", "UPDATED", "DELETED"}) {
            mvc.perform(post("/api/events")
                            .header(IdentityFilter.HEADER, "producer")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"eventType\":\"" + type + "\"}"))
                    .andExpect(status().isCreated());
        }

        var body = mvc.perform(post("/api/subscriptions").param("from", "0").header(IdentityFilter.HEADER, "consumer"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        var cursorId = json.readTree(body).get("id").asText();

        mvc.perform(get("/api/subscriptions/" + cursorId).param("max", "2"))
                .andExpect(jsonPath("$.events[*].offset").value(contains(0, 1)))
                .andExpect(jsonPath("$.position").value(2));
        mvc.perform(get("/api/subscriptions/" + cursorId).param("max", "10"))
                .andExpect(jsonPath("$.events", hasSize(1)))
                .andExpect(jsonPath("$.events[0].eventType").value("DELETED"))
                .andExpect(jsonPath("$.events[0].source").value("producer"));

        mvc.perform(post("/api/consumers/consumerX/ack").param("offset", "1")).andExpect(status().isOk());
        mvc.perform(get("/api/consumers/consumerX/progress")).andExpect(jsonPath("$.acknowledgedOffset").value(1));

        mvc.perform(get("/api/events").param("from", "0").param("to", "2")).andExpect(jsonPath("$", hasSize(3)));
        mvc.perform(get("/api/events").param("from", "1").param("to", "5")).andExpect(status().isRequestedRangeNotSatisfiable());
    }

    @Test
    void configurationDefaultsBind() {
        assertThat(props.read().maxBatchSize()).isEqualTo(500);
        assertThat(props.cursor().idleTimeout()).hasMinutes(15);
    }
}
