package com.geodash.mapper;

import com.geodash.dto.RaceResponses;
import com.geodash.dto.UserResponses;
import com.geodash.model.AppUser;
import com.geodash.model.DailyDistanceEntry;
import com.geodash.model.Race;
import com.geodash.model.RaceParticipant;
import com.geodash.service.FinishResolutionState;
import com.geodash.service.ProgressionModel;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class RaceResponseMapper {

    public RaceResponses.FinishState toFinishState(FinishResolutionState state, long confirmationWindowMs) {
        FinishResolutionState resolved = state != null ? state : FinishResolutionState.EMPTY;
        return new RaceResponses.FinishState(
                resolved.status(),
                resolved.currentWinnerUserId(),
                resolved.provisionalWinnerUserId(),
                resolved.provisionalAt(),
                resolved.confirmationWindowEndsAt(),
                resolved.finalWinnerUserId(),
                resolved.finalizedAt(),
                confirmationWindowMs
        );
    }

    public RaceResponses.RaceSummary toRaceSummary(Race race, OffsetDateTime now, long confirmationWindowMs) {
        return new RaceResponses.RaceSummary(
                race.getRaceId(),
                race.getName(),
                race.getDescription(),
                race.statusAt(now),
                startPoint(race),
                endPoint(race),
                race.getStartDate(),
                race.getEndDate(),
                race.getDistanceKm(),
                race.getParticipants().size(),
                toFinishState(FinishResolutionState.of(race.getFinishResolution()), confirmationWindowMs),
                race.getCreatedBy(),
                race.getCreatedAt()
        );
    }

    public RaceResponses.RaceDetail toRaceDetail(
            Race race,
            Map<UUID, AppUser> usersById,
            OffsetDateTime now,
            long confirmationWindowMs
    ) {
        return new RaceResponses.RaceDetail(
                race.getRaceId(),
                race.getName(),
                race.getDescription(),
                race.statusAt(now),
                startPoint(race),
                endPoint(race),
                race.getStartDate(),
                race.getEndDate(),
                race.getDistanceKm(),
                race.getParticipants().stream()
                        .map(participant -> toParticipant(participant, usersById.get(participant.getUserId())))
                        .toList(),
                toFinishState(FinishResolutionState.of(race.getFinishResolution()), confirmationWindowMs),
                race.getCreatedBy(),
                race.getCreatedAt(),
                race.getUpdatedAt()
        );
    }

    public RaceResponses.Participant toParticipant(RaceParticipant participant, AppUser user) {
        return new RaceResponses.Participant(
                participant.getUserId(),
                displayName(user),
                user != null ? user.getAvatarUrl() : null,
                participant.getJoinedAt(),
                participant.getStatus(),
                participant.getCompletedAt(),
                participant.getTotalDistance(),
                toDailyDistances(participant.getDailyDistances())
        );
    }

    public List<RaceResponses.DailyDistance> toDailyDistances(Collection<DailyDistanceEntry> entries) {
        return entries.stream()
                .map(entry -> new RaceResponses.DailyDistance(entry.getDay(), entry.getDistanceKm()))
                .toList();
    }

    public UserResponses.UserProfile toUserProfile(AppUser user) {
        return new UserResponses.UserProfile(
                user.getUserId(),
                user.getName(),
                user.getEmail(),
                user.getAvatarUrl(),
                user.getTotalKmLifetime(),
                user.getTotalXp(),
                user.getLevel(),
                user.getLastHealthSyncAt(),
                ProgressionModel.snapshot(user.getTotalXp()),
                user.getCreatedAt()
        );
    }

    public static String displayName(AppUser user) {
        return user != null ? user.getDisplayName() : AppUser.FALLBACK_DISPLAY_NAME;
    }

    private static RaceResponses.GeoPoint startPoint(Race race) {
        return new RaceResponses.GeoPoint(race.getStartLatitude(), race.getStartLongitude(), race.getStartAddress());
    }

    private static RaceResponses.GeoPoint endPoint(Race race) {
        return new RaceResponses.GeoPoint(race.getEndLatitude(), race.getEndLongitude(), race.getEndAddress());
    }
}
