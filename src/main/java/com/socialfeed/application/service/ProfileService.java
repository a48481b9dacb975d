package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.UpdateProfileUseCase;
import com.socialfeed.application.port.out.IdGenerator;
import com.socialfeed.application.port.out.UserRepository;
import com.socialfeed.domain.error.ValidationError.ProfileValidationError;
import com.socialfeed.domain.event.ProfileChanged;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.model.UserProfile;
import com.socialfeed.infrastructure.exception.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.regex.Pattern;

@Service
public class ProfileService implements UpdateProfileUseCase {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);
    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_]{3,30}$");

    private final UserRepository userRepository;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;

    public ProfileService(UserRepository userRepository, EventBus eventBus, IdGenerator idGenerator) {
        this.userRepository = userRepository;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
    }

    @Override
    @Transactional
    public Result<UserProfile, ProfileValidationError> updateProfile(UserId userId, String username, String avatarUrl) {
        if (username == null && avatarUrl == null) {
            return Result.failure(ProfileValidationError.NothingToUpdate.INSTANCE);
        }
        if (username != null && !USERNAME.matcher(username).matches()) {
            return Result.failure(new ProfileValidationError.InvalidUsername(username));
        }

        if (!userRepository.updateProfile(userId, username, avatarUrl)) {
            throw new UserNotFoundException(userId.toString());
        }
        UserProfile updated = userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId.toString()));

        eventBus.queueTransactional(ProfileChanged.from(idGenerator.generate(), userId, username, avatarUrl));
        log.info("Profile updated: user={}, usernameChanged={}, avatarChanged={}", userId, username != null, avatarUrl != null);
        return Result.success(updated);
    }
}
