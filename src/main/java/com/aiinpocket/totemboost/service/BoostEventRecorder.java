package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.model.dto.BoostHistoryEntry;
import com.aiinpocket.totemboost.model.entity.BoostEventLog;
import com.aiinpocket.totemboost.repository.BoostEventLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 加持活動紀錄（免費加持、高級加持請求 / 開獎、徽章鑄造、連續重置）。
 * 與加持本身在同一個交易內寫入，加持失敗時紀錄一起回滾。
 */
@Service
@RequiredArgsConstructor
public class BoostEventRecorder {

    public static final String FREE_BOOST = "FREE_BOOST";
    public static final String PREMIUM_REQUEST = "PREMIUM_REQUEST";
    public static final String PREMIUM_REWARD = "PREMIUM_REWARD";
    public static final String BADGE_MINT = "BADGE_MINT";
    public static final String STREAK_RESET = "STREAK_RESET";

    static final int MAX_HISTORY = 100;

    private final BoostEventLogRepository eventRepo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public void record(String user, String totem, String eventType, Map<String, Object> data) {
        eventRepo.save(BoostEventLog.builder()
                .userAddress(user)
                .totemAddress(totem)
                .eventType(eventType)
                .eventData(objectMapper.writeValueAsString(data))
                .createdAt(clock.instant())
                .build());
    }

    @Transactional(readOnly = true)
    public List<BoostHistoryEntry> history(String user, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY));
        return eventRepo.findByUserAddressOrderByCreatedAtDesc(user, PageRequest.of(0, size)).stream()
                .map(e -> new BoostHistoryEntry(
                        e.getId(), e.getTotemAddress(), e.getEventType(), e.getEventData(), e.getCreatedAt().toString()))
                .toList();
    }
}
