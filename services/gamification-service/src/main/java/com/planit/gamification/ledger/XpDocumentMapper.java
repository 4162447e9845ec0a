package com.planit.gamification.ledger;

import com.planit.gamification.aggregate.WindowedAggregator;
import com.planit.gamification.domain.LeaderboardEntry;
import com.planit.gamification.domain.UserProfile;
import com.planit.gamification.domain.UserXpState;
import com.planit.gamification.domain.XpEvent;
import com.planit.gamification.level.LevelCalculator;
import com.planit.gamification.store.StoredDocument;
import com.planit.gamification.store.Values;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Field-level mapping between ledger/leaderboard documents and domain objects.
 *
 * <p>Reading is lenient: missing fields fall back to zero values and history entries that
 * lack an amount or timestamp are skipped. A persisted level that disagrees with the
 * persisted XP is not trusted; the level is recomputed from XP. Weekly XP is likewise
 * recomputed from history against the current clock.
 */
@Slf4j
@RequiredArgsConstructor
public class XpDocumentMapper {

    static final String XP = "xp";
    static final String LEVEL = "level";
    static final String HISTORY = "xpHistory";
    static final String WEEKLY_XP = "weeklyXP";
    static final String LAST_UPDATE = "lastXPUpdate";

    static final String EVENT_ID = "id";
    static final String EVENT_KIND = "event";
    static final String EVENT_XP = "xp";
    static final String EVENT_TIMESTAMP = "timestamp";
    static final String EVENT_SUBJECT = "subjectRef";
    static final String EVENT_DETAILS = "details";

    static final String USERNAME = "username";
    static final String DISPLAY_NAME = "displayName";
    static final String PHOTO_URL = "photoURL";

    static final String ENTRY_USER_ID = "userId";
    static final String ENTRY_AVATAR = "avatarURL";
    static final String ENTRY_LAST_UPDATED = "lastUpdated";
    static final String ENTRY_PERIOD = "monthYear";

    private static final Comparator<XpEvent> NEWEST_FIRST = Comparator.comparing(
            XpEvent::getTimestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final WindowedAggregator aggregator;
    private final Clock clock;

    public UserXpState toState(String userId, Optional<StoredDocument> document) {
        if (document.isEmpty()) {
            return UserXpState.empty(userId);
        }
        StoredDocument doc = document.get();
        long xp = doc.getLong(XP, 0);
        if (xp < 0) {
            log.warn("Negative XP on ledger, clamping to zero: userId={}, xp={}", userId, xp);
            xp = 0;
        }
        int level = LevelCalculator.level(xp);
        long persistedLevel = doc.getLong(LEVEL, level);
        if (persistedLevel != level) {
            log.warn("Ledger level inconsistent with XP, repairing: userId={}, xp={}, persistedLevel={}, level={}",
                    userId, xp, persistedLevel, level);
        }
        List<XpEvent> history = toHistory(doc.getMapList(HISTORY));
        return UserXpState.builder()
                .userId(userId)
                .currentXp(xp)
                .level(level)
                .history(history)
                .weeklyXp(aggregator.weeklyXp(history, clock.instant()))
                .lastUpdate(doc.getInstant(LAST_UPDATE))
                .version(doc.getVersion())
                .build();
    }

    public Map<String, Object> toLedgerFields(UserXpState state) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(XP, state.getCurrentXp());
        fields.put(LEVEL, state.getLevel());
        fields.put(HISTORY, state.getHistory().stream().map(this::toFields).toList());
        fields.put(WEEKLY_XP, state.getWeeklyXp());
        fields.put(LAST_UPDATE, state.getLastUpdate());
        return fields;
    }

    public Map<String, Object> toFields(XpEvent event) {
        Map<String, Object> fields = new HashMap<>();
        fields.put(EVENT_ID, event.getId());
        fields.put(EVENT_KIND, event.getEventKind());
        fields.put(EVENT_XP, event.getXpAmount());
        fields.put(EVENT_TIMESTAMP, event.getTimestamp());
        if (event.getSubjectRef() != null) {
            fields.put(EVENT_SUBJECT, event.getSubjectRef());
        }
        if (event.getDetails() != null) {
            fields.put(EVENT_DETAILS, event.getDetails());
        }
        return fields;
    }

    public UserProfile toProfile(Optional<StoredDocument> document) {
        return document
                .map(doc -> UserProfile.builder()
                        .username(Optional.ofNullable(doc.getString(USERNAME)).orElse(""))
                        .displayName(Optional.ofNullable(doc.getString(DISPLAY_NAME)).orElse(""))
                        .photoUrl(doc.getString(PHOTO_URL))
                        .build())
                .orElseGet(UserProfile::anonymous);
    }

    public LeaderboardEntry toEntry(StoredDocument doc) {
        long xp = Math.max(0, doc.getLong(XP, 0));
        return LeaderboardEntry.builder()
                .userId(doc.getString(ENTRY_USER_ID))
                .username(Optional.ofNullable(doc.getString(USERNAME)).orElse(""))
                .displayName(Optional.ofNullable(doc.getString(DISPLAY_NAME)).orElse(""))
                .currentXp(xp)
                .level(LevelCalculator.level(xp))
                .avatarRef(doc.getString(ENTRY_AVATAR))
                .lastUpdated(doc.getInstant(ENTRY_LAST_UPDATED))
                .periodKey(doc.getString(ENTRY_PERIOD))
                .build();
    }

    public Map<String, Object> toEntryFields(LeaderboardEntry entry) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ENTRY_USER_ID, entry.getUserId());
        fields.put(USERNAME, entry.getUsername());
        fields.put(DISPLAY_NAME, entry.getDisplayName());
        fields.put(XP, entry.getCurrentXp());
        fields.put(LEVEL, entry.getLevel());
        fields.put(ENTRY_AVATAR, entry.getAvatarRef());
        fields.put(ENTRY_LAST_UPDATED, entry.getLastUpdated());
        fields.put(ENTRY_PERIOD, entry.getPeriodKey());
        return fields;
    }

    private List<XpEvent> toHistory(List<Map<String, Object>> rawEvents) {
        List<XpEvent> events = new ArrayList<>(rawEvents.size());
        Set<String> seenIds = new LinkedHashSet<>();
        for (Map<String, Object> raw : rawEvents) {
            Object amount = raw.get(EVENT_XP);
            Instant timestamp = Values.toInstant(raw.get(EVENT_TIMESTAMP));
            if (!(amount instanceof Number) || timestamp == null) {
                log.debug("Skipping malformed history entry: {}", raw);
                continue;
            }
            String id = Values.toStringOrNull(raw.get(EVENT_ID));
            if (id != null && !seenIds.add(id)) {
                continue;
            }
            events.add(XpEvent.builder()
                    .id(id)
                    .eventKind(Values.toStringOrNull(raw.get(EVENT_KIND)))
                    .xpAmount(((Number) amount).intValue())
                    .timestamp(timestamp)
                    .subjectRef(Values.toStringOrNull(raw.get(EVENT_SUBJECT)))
                    .details(Values.toStringOrNull(raw.get(EVENT_DETAILS)))
                    .build());
        }
        events.sort(NEWEST_FIRST);
        return List.copyOf(events);
    }
}
