package dao.fhe.mystery.controller;

import dao.fhe.mystery.config.SchedulerProperties;
import dao.fhe.mystery.model.SealedTriple;
import dao.fhe.mystery.oracle.DisclosureReplyMessage;
import dao.fhe.mystery.service.ProtocolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.web3j.utils.Numeric;

import static dao.fhe.mystery.service.ProtocolFixture.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP mapping of the protocol operations and their error codes, without a Spring context.
 */
class ApiControllerTest {

    private ProtocolFixture fx;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        fx = new ProtocolFixture();
        mvc = MockMvcBuilders.standaloneSetup(
                        new BatchController(fx.batchStore, fx.contributions, fx.accusations, fx.solutions),
                        new DisclosureController(fx.coordinator, fx.channel),
                        new AdminController(fx.admin),
                        new MonitoringController(fx.batchStore, fx.coordinator, fx.channel, fx.ledger,
                                fx.state, new SchedulerProperties()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static String tripleJson(SealedTriple t) {
        return "{\"weapon\":\"" + t.weapon().hex() + "\",\"room\":\"" + t.room().hex()
                + "\",\"suspect\":\"" + t.suspect().hex() + "\"}";
    }

    @Test
    @DisplayName("Owner opens a batch, a provider contributes, the batch view reflects it")
    void openAndContribute() throws Exception {
        mvc.perform(post("/api/batches").header("X-Caller", OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value(1));

        mvc.perform(post("/api/batches/1/contributions").header("X-Caller", A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(tripleJson(fx.seal(1, 2, 3))))
                .andExpect(status().isAccepted());

        mvc.perform(get("/api/batches/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.open").value(true))
                .andExpect(jsonPath("$.submissionCount").value(1))
                .andExpect(jsonPath("$.submittedAddresses[0]").value(A));
    }

    @Test
    @DisplayName("Protocol errors map to their HTTP status and error code")
    void protocolErrors() throws Exception {
        mvc.perform(post("/api/batches").header("X-Caller", A))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.error").value("NOT_OWNER"));

        mvc.perform(get("/api/batches/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("INVALID_BATCH"));

        fx.batchStore.openBatch(OWNER);
        mvc.perform(post("/api/batches/1/solution-requests").header("X-Caller", D))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("INVALID_BATCH"));

        mvc.perform(post("/api/admin/pause").header("X-Caller", OWNER))
                .andExpect(status().isOk());
        mvc.perform(post("/api/batches/1/contributions").header("X-Caller", A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(tripleJson(fx.seal(1, 1, 1))))
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.error").value("PAUSED"));
    }

    @Test
    @DisplayName("Missing caller header and malformed handles are bad requests")
    void badRequests() throws Exception {
        mvc.perform(post("/api/batches"))
                .andExpect(status().isBadRequest());

        fx.batchStore.openBatch(OWNER);
        mvc.perform(post("/api/batches/1/accusations").header("X-Caller", D)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weapon\":\"0x12\",\"room\":\"0x12\",\"suspect\":\"0x12\"}"))
                .andExpect(status().isBadRequest());
        assertEquals(0, fx.coordinator.findAll().size());
    }

    @Test
    @DisplayName("Accusation request, oracle callback and ledger view")
    void accusationOverHttp() throws Exception {
        fx.batchStore.openBatch(OWNER);
        fx.contributions.submitContribution(A, 1, fx.seal(3, 5, 2));

        mvc.perform(post("/api/batches/1/accusations").header("X-Caller", D)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(tripleJson(fx.seal(3, 5, 2))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.requestId").value(1));

        mvc.perform(get("/api/disclosures/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("ACCUSATION"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        DisclosureReplyMessage reply = fx.answerNext();
        mvc.perform(post("/api/disclosures/1/reply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cleartext\":\"" + Numeric.toHexString(reply.cleartext())
                                + "\",\"proof\":\"" + Numeric.toHexString(reply.proof()) + "\"}"))
                .andExpect(status().isAccepted());
        assertEquals(1, fx.channel.pendingReplies());

        fx.dispatcher.dispatch(fx.channel.drainReplies(1).get(0));

        mvc.perform(get("/api/monitor/accusations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAccusations").value(1))
                .andExpect(jsonPath("$.accusations[0].correct").value(true));
        mvc.perform(get("/api/monitor/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accusations.correct").value(1))
                .andExpect(jsonPath("$.statistics.contexts.settled").value(1));
    }

    @Test
    @DisplayName("Admin endpoints are owner-only")
    void adminEndpoints() throws Exception {
        mvc.perform(post("/api/admin/version-bump").header("X-Caller", A))
                .andExpect(status().isForbidden());
        mvc.perform(post("/api/admin/version-bump").header("X-Caller", OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentVersion").value(2));

        mvc.perform(post("/api/admin/providers").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identity\":\"" + D + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added").value(true));

        mvc.perform(put("/api/admin/cooldown").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cooldownSeconds\":-1}"))
                .andExpect(status().isBadRequest());

        mvc.perform(get("/api/monitor/solutions/1"))
                .andExpect(status().isNotFound());
    }
}
