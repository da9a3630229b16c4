package com.clout.gameshow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Plays whole shows over HTTP against the test question file.
 */
@SpringBootTest(properties = {
        "gameshow.questions-file=src/test/resources/questions/test-questions.json",
        "gameshow.questions-dir=src/test/resources/questions"
})
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class GameshowApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode events() throws Exception {
        String body = mvc.perform(get("/api/getGameEvents"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    private void call(String path, String... params) throws Exception {
        MockHttpServletRequestBuilder request = get(path);
        for (int i = 0; i < params.length; i += 2) {
            request.param(params[i], params[i + 1]);
        }
        mvc.perform(request).andExpect(status().isOk());
    }

    @Test
    void test_starts_with_loaded_questions() throws Exception {
        mvc.perform(get("/api/getGameState"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("Results(false)"))
                .andExpect(jsonPath("$.current_question").value(0))
                .andExpect(jsonPath("$.question_count").value(4));
        assertEquals(0, events().size());
    }

    @Test
    void test_plays_the_whole_show() throws Exception {
        call("/api/joinPlayer", "name", "Ann");
        call("/api/joinPlayer", "name", "Bob");

        // 1: normal, correct 2
        call("/api/activateNextQuestion");
        JsonNode log = events();
        assertEquals("BeginNormalQAnswering", log.get(0).get("event_name").asText());
        assertEquals("Geography", log.get(0).get("event").get("BeginNormalQAnswering").get("category").asText());
        call("/api/answerQuestion", "name", "Ann", "answer", "2");
        call("/api/answerQuestion", "name", "Bob", "answer", "1");
        log = events();
        assertEquals("ShowResults", log.get(1).get("event_name").asText());

        // 2: betting, correct 3
        call("/api/activateNextQuestion");
        assertEquals("BeginBettingQBetting", events().get(2).get("event_name").asText());
        call("/api/betMoney", "name", "Ann", "money_bet", "200");
        call("/api/betMoney", "name", "Bob", "money_bet", "500");
        assertEquals("BeginBettingQAnswering", events().get(3).get("event_name").asText());
        call("/api/answerQuestion", "name", "Ann", "answer", "3");
        call("/api/answerQuestion", "name", "Bob", "answer", "4");
        log = events();
        JsonNode betting = log.get(4).get("event").get("ShowResults");
        assertEquals(1200, betting.get("player_data").get(0).get("money").asLong());
        assertEquals(1, betting.get("player_data").get(1).get("money").asLong());

        // 3: estimation, 1896
        call("/api/activateNextQuestion");
        assertEquals("BeginEstimationQAnswering", events().get(5).get("event_name").asText());
        call("/api/answerQuestion", "name", "Ann", "answer", "1900");
        call("/api/answerQuestion", "name", "Bob", "answer", "1896");
        events();

        // 4: versus, correct 2
        call("/api/activateNextQuestion");
        assertEquals("BeginVersusQSelecting", events().get(7).get("event_name").asText());
        call("/api/attackPlayer", "name", "Ann", "vs_player", "Bob");
        call("/api/attackPlayer", "name", "Bob", "vs_player", "Ann");
        assertEquals("BeginVersusQAnswering", events().get(8).get("event_name").asText());
        call("/api/answerQuestion", "name", "Ann", "answer", "1");
        call("/api/answerQuestion", "name", "Bob", "answer", "2");
        events();

        call("/api/activateNextQuestion");
        log = events();
        assertEquals(11, log.size());
        JsonNode ending = log.get(10);
        assertEquals(10, ending.get("id").asLong());
        assertEquals("GameEnding", ending.get("event_name").asText());
        JsonNode finalData = ending.get("event").get("GameEnding").get("player_data");
        // Ann 1200 x0.5 (Bob was right), Bob 1001 x2.0 (Ann was wrong)
        assertEquals(600, finalData.get(0).get("money").asLong());
        assertEquals(2002, finalData.get(1).get("money").asLong());

        mvc.perform(get("/api/getGameState"))
                .andExpect(jsonPath("$.phase").value("GameEnding"));
    }

    @Test
    void test_rejections_map_to_status_codes() throws Exception {
        mvc.perform(get("/api/joinPlayer").param("name", "  "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        call("/api/joinPlayer", "name", "Ann");
        mvc.perform(get("/api/answerQuestion").param("name", "Ann").param("answer", "1"))
                .andExpect(status().isNotAcceptable())
                .andExpect(jsonPath("$.error").value("PHASE_MISMATCH"));

        call("/api/activateNextQuestion");
        events();
        mvc.perform(get("/api/answerQuestion").param("name", "Nobody").param("answer", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));

        mvc.perform(post("/api/setJokers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Ann\", \"jokers\": 0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jokers").value(0));
        mvc.perform(get("/api/getJokerFiftyFifty").param("name", "Ann"))
                .andExpect(status().isNotAcceptable())
                .andExpect(jsonPath("$.error").value("NO_JOKERS_LEFT"));
    }

    @Test
    void test_moderator_jumps_and_reloads() throws Exception {
        mvc.perform(get("/api/setNextQuestion").param("number", "4"))
                .andExpect(status().isOk())
                .andExpect(content().string("0"));
        call("/api/activateNextQuestion");
        assertEquals(4, events().get(0).get("event").get("BeginVersusQSelecting").get("current_question").asInt());

        mvc.perform(post("/api/loadQuestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\": \"second-round.json\"}"))
                .andExpect(status().isNotAcceptable());

        call("/api/forceQuestionAnswering");
        events();
        call("/api/forceQuestionResults");
        events();

        mvc.perform(post("/api/loadQuestions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\": \"second-round.json\"}"))
                .andExpect(status().isOk())
                .andExpect(content().string("2"));
        mvc.perform(get("/api/getGameState"))
                .andExpect(jsonPath("$.question_count").value(2))
                .andExpect(jsonPath("$.current_question").value(0));
    }
}
