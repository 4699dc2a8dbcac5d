package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.model.dto.BoostHistoryEntry;
import com.aiinpocket.totemboost.model.entity.BoostEventLog;
import com.aiinpocket.totemboost.repository.BoostEventLogRepository;
import com.aiinpocket.totemboost.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import tools.jackson.databind.json.JsonMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BoostEventRecorder Tests")
class BoostEventRecorderTest {

    private static final String USER = "0x1111111111111111111111111111111111111111";

    @Mock
    private BoostEventLogRepository eventRepo;

    @Captor
    private ArgumentCaptor<BoostEventLog> logCaptor;

    @Captor
    private ArgumentCaptor<Pageable> pageCaptor;

    private MutableClock clock;
    private BoostEventRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-06-01T00:00:00Z"));
        recorder = new BoostEventRecorder(eventRepo, JsonMapper.builder().build(), clock);
    }

    @Test
    @DisplayName("Should store event data as JSON")
    void shouldRecordJson() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("streak", 3);
        data.put("reward", 110L);

        recorder.record(USER, null, BoostEventRecorder.BADGE_MINT, data);

        verify(eventRepo).save(logCaptor.capture());
        BoostEventLog saved = logCaptor.getValue();
        assertThat(saved.getEventData()).isEqualTo("{\"streak\":3,\"reward\":110}");
        assertThat(saved.getTotemAddress()).isNull();
        assertThat(saved.getCreatedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Should clamp the history page size")
    void shouldClampHistoryLimit() {
        when(eventRepo.findByUserAddressOrderByCreatedAtDesc(eq(USER), any(Pageable.class))).thenReturn(List.of(
                BoostEventLog.builder().id(1L).userAddress(USER).eventType(BoostEventRecorder.FREE_BOOST)
                        .eventData("{}").createdAt(clock.instant()).build()));

        List<BoostHistoryEntry> history = recorder.history(USER, 10_000);

        verify(eventRepo).findByUserAddressOrderByCreatedAtDesc(eq(USER), pageCaptor.capture());
        assertThat(pageCaptor.getValue()).isEqualTo(PageRequest.of(0, BoostEventRecorder.MAX_HISTORY));
        assertThat(history).singleElement()
                .extracting(BoostHistoryEntry::eventType).isEqualTo(BoostEventRecorder.FREE_BOOST);
    }
}
