package com.geodash.service;

import com.geodash.dto.UserRequests;
import com.geodash.dto.UserResponses;
import com.geodash.mapper.RaceResponseMapper;
import com.geodash.model.AppUser;
import com.geodash.model.ProgressionSnapshot;
import com.geodash.model.TimeSupport;
import com.geodash.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final AppUserRepository appUserRepository;
    private final RaceResponseMapper raceResponseMapper;

    @Transactional
    public UserResponses.UserProfile createUser(UserRequests.CreateUserRequest request) {
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Email already registered: " + email);
        }

        AppUser user = new AppUser();
        user.setUserId(UUID.randomUUID());
        user.setName(StringUtils.hasText(request.name()) ? request.name().trim() : null);
        user.setEmail(email);
        user.setAvatarUrl(StringUtils.hasText(request.avatarUrl()) ? request.avatarUrl().trim() : null);
        user.setTotalKmLifetime(0.0);
        user.setTotalXp(0L);
        user.setLevel(1);
        user.setCreatedAt(TimeSupport.utcNow());

        AppUser saved = appUserRepository.save(user);
        log.info("Created user {}", saved.getUserId());
        return raceResponseMapper.toUserProfile(saved);
    }

    @Transactional(readOnly = true)
    public UserResponses.UserProfile getUser(UUID userId) {
        return raceResponseMapper.toUserProfile(requireUser(userId));
    }

    @Transactional(readOnly = true)
    public ProgressionSnapshot getProgression(UUID userId) {
        return ProgressionModel.snapshot(requireUser(userId).getTotalXp());
    }

    private AppUser requireUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found: " + userId));
    }
}
