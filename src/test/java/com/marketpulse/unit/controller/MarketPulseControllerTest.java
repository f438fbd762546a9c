package com.marketpulse.unit.controller;

import static com.marketpulse.support.TestSnapshots.START;
import static com.marketpulse.support.TestSnapshots.baseline;
import static com.marketpulse.support.TestSnapshots.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marketpulse.api.controller.MarketPulseController;
import com.marketpulse.config.ApiResponseAdvice;
import com.marketpulse.domain.enums.EventSeverity;
import com.marketpulse.domain.enums.EventSubtype;
import com.marketpulse.domain.enums.MarketStatus;
import com.marketpulse.domain.enums.NotificationFormat;
import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.domain.model.MarketState;
import com.marketpulse.domain.model.Notification;
import com.marketpulse.exception.GlobalExceptionHandler;
import com.marketpulse.exception.InvalidSnapshotException;
import com.marketpulse.history.HistoryWindow;
import com.marketpulse.notification.NotificationService;
import com.marketpulse.pipeline.CycleResult;
import com.marketpulse.pipeline.MarketPulsePipeline;
import com.marketpulse.state.StateManager;
import com.marketpulse.support.MutableClock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;
import org.springframework.validation.beanvalidation.MethodValidationPostProcessor;

/**
 * Unit tests for MarketPulseController.
 *
 * <p>Verifies: state/events/notifications reads wrapped in the response envelope,
 * manual cycle submission (201), timestamp stamping and body validation.
 */
class MarketPulseControllerTest {

    private MockMvc mockMvc;

    @Mock
    private MarketPulsePipeline marketPulsePipeline;

    @Mock
    private StateManager stateManager;

    @Mock
    private NotificationService notificationService;

    private final MarketState yellowState = MarketState.builder()
            .timestamp(START)
            .status(MarketStatus.YELLOW)
            .sentimentScore(55.0)
            .mainDriver("Capital flow reversal: Northbound funds turning positive.")
            .summary("Updated by flow_reversal")
            .build();

    private MutableClock clock;
    private MarketPulseController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock(START);
        controller = new MarketPulseController(marketPulsePipeline, stateManager, notificationService, clock);
        mockMvc = mockMvcFor(controller);
    }

    private MockMvc mockMvcFor(Object handler) {
        return MockMvcBuilders.standaloneSetup(handler)
                .setControllerAdvice(new GlobalExceptionHandler(clock), new ApiResponseAdvice(clock))
                .build();
    }

    private static Notification flash(String id) {
        return Notification.builder()
                .notificationId(id)
                .timestamp(START)
                .format(NotificationFormat.FLASH)
                .title("Market Flash")
                .lines(List.of("line"))
                .relatedEvents(List.of("evt_1"))
                .build();
    }

    @Test
    void getState_returnsWrappedCurrentState() throws Exception {
        when(stateManager.getCurrentState()).thenReturn(yellowState);

        mockMvc.perform(get("/api/market/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.timestamp").value("2025-03-10T09:30:00Z"))
                .andExpect(jsonPath("$.data.status").value("YELLOW"))
                .andExpect(jsonPath("$.data.sentimentScore").value(55.0))
                .andExpect(jsonPath("$.data.summary").value("Updated by flow_reversal"));
    }

    @Test
    void getRecentEvents_returnsWindow() throws Exception {
        when(stateManager.getRecentEvents())
                .thenReturn(List.of(event("evt_1", EventSubtype.FLOW_REVERSAL, EventSeverity.MEDIUM, START)));

        mockMvc.perform(get("/api/market/events/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].eventId").value("evt_1"))
                .andExpect(jsonPath("$.data[0].subtype").value("FLOW_REVERSAL"))
                .andExpect(jsonPath("$.data[0].category").value("ANOMALY_DETECTION"));
    }

    @Test
    void getNotifications_newestFirstAndLimited() throws Exception {
        when(notificationService.getSentNotifications())
                .thenReturn(List.of(flash("notif_a"), flash("notif_b"), flash("notif_c")));

        mockMvc.perform(get("/api/market/notifications").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].notificationId").value("notif_c"))
                .andExpect(jsonPath("$.data[1].notificationId").value("notif_b"));
    }

    @Test
    void getHistory_reportsFillLevel() throws Exception {
        HistoryWindow historyWindow = new HistoryWindow(100);
        historyWindow.append(baseline());
        when(marketPulsePipeline.getHistoryWindow()).thenReturn(historyWindow);

        mockMvc.perform(get("/api/market/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.size").value(1))
                .andExpect(jsonPath("$.data.capacity").value(100))
                .andExpect(jsonPath("$.data.latest.topSector").value("Banking"));
    }

    @Test
    void submitSnapshot_runsCycleAndReturns201() throws Exception {
        CycleResult cycleResult = CycleResult.builder()
                .snapshot(baseline())
                .events(List.of(event("evt_1", EventSubtype.FLOW_REVERSAL, EventSeverity.MEDIUM, START)))
                .state(yellowState)
                .notifications(List.of(flash("notif_a")))
                .build();
        when(marketPulsePipeline.runCycle(any())).thenReturn(cycleResult);
        when(marketPulsePipeline.getHistoryWindow()).thenReturn(new HistoryWindow(100));

        mockMvc.perform(post("/api/market/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"volume":1100000,"indexChangePct":0.2,"northBoundFlow":300000,"topSector":"Banking"}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.events[0].subtype").value("FLOW_REVERSAL"))
                .andExpect(jsonPath("$.data.state.status").value("YELLOW"))
                .andExpect(jsonPath("$.data.notifications[0].format").value("FLASH"));

        ArgumentCaptor<MarketSnapshot> captor = ArgumentCaptor.forClass(MarketSnapshot.class);
        verify(marketPulsePipeline).runCycle(captor.capture());
        MarketSnapshot submitted = captor.getValue();
        assertThat(submitted.getTimestamp()).isEqualTo(START);
        assertThat(submitted.getNorthBoundFlow()).isEqualTo(300000.0);
        assertThat(submitted.getLimitDownCount()).isNull();
    }

    @Test
    void submitSnapshot_negativeVolume_returns400() throws Exception {
        mockMvc.perform(post("/api/market/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"volume":-1,"indexChangePct":0.2}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.volume").exists())
                .andExpect(jsonPath("$.error.path").value("/api/market/snapshots"));

        verify(marketPulsePipeline, never()).runCycle(any());
    }

    @Test
    void submitSnapshot_bombRateAbove100_returns400() throws Exception {
        mockMvc.perform(post("/api/market/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"bombRate":120}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void submitSnapshot_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/api/market/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    void submitSnapshot_pipelineRejects_returns400WithPipelineCode() throws Exception {
        when(marketPulsePipeline.runCycle(any())).thenThrow(new InvalidSnapshotException("no snapshot"));

        mockMvc.perform(post("/api/market/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_SNAPSHOT"))
                .andExpect(jsonPath("$.error.message").value("no snapshot"))
                .andExpect(jsonPath("$.error.details").doesNotExist());
    }

    @Test
    void getNotifications_nonNumericLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/market/notifications").param("limit", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.details.limit").value("must be of type int"));
    }

    @Test
    void wrongVerb_returns405() throws Exception {
        mockMvc.perform(post("/api/market/state"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("METHOD_NOT_ALLOWED"));
    }

    /**
     * Query parameter bounds are enforced by method validation, which only runs on the
     * proxied controller the application context creates.
     */
    @Nested
    class WithMethodValidation {

        private MockMvc validatingMockMvc;

        @BeforeEach
        void setUp() {
            LocalValidatorFactoryBean validator = new LocalValidatorFactoryBean();
            validator.afterPropertiesSet();
            MethodValidationPostProcessor postProcessor = new MethodValidationPostProcessor();
            postProcessor.setValidator(validator);
            postProcessor.afterPropertiesSet();
            validatingMockMvc =
                    mockMvcFor(postProcessor.postProcessAfterInitialization(controller, "marketPulseController"));

            when(notificationService.getSentNotifications()).thenReturn(List.of(flash("notif_a")));
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "501", "-3"})
        void limitOutsideOneTo500_returns400(String limit) throws Exception {
            validatingMockMvc
                    .perform(get("/api/market/notifications").param("limit", limit))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.limit").exists())
                    .andExpect(jsonPath("$.error.details['getNotifications.limit']").doesNotExist());
        }

        @ParameterizedTest
        @ValueSource(strings = {"1", "500"})
        void limitAtBounds_returns200(String limit) throws Exception {
            validatingMockMvc
                    .perform(get("/api/market/notifications").param("limit", limit))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].notificationId").value("notif_a"));
        }

        @Test
        void defaultLimit_returns200() throws Exception {
            validatingMockMvc.perform(get("/api/market/notifications")).andExpect(status().isOk());
        }
    }
}
