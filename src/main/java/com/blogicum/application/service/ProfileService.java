package com.blogicum.application.service;

import com.blogicum.application.port.in.UpdateProfileUseCase;
import com.blogicum.application.port.out.MetricsPort;
import com.blogicum.application.port.out.UserRepository;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.error.ValidationError.UserError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Location;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.ProfileChanges;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProfileService implements UpdateProfileUseCase {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final UserRepository userRepository;
    private final MetricsPort metrics;

    public ProfileService(UserRepository userRepository, MetricsPort metrics) {
        this.userRepository = userRepository;
        this.metrics = metrics;
    }

    /**
     * Edits the acting user's own profile. Someone else's profile is reported as not found,
     * the same as a username that does not exist.
     */
    @Override
    @Transactional
    public Result<Mutation<User>, BlogError> updateProfile(Actor actor, String username, ProfileChanges changes) {
        var acting = ActingUser.require(actor);
        if (acting.isFailure()) {
            log.debug("Anonymous profile edit rejected: username={}", username);
            return acting.castFailure();
        }
        User user = acting.getOrThrow();

        var target = userRepository.findByUsername(username)
            .filter(found -> found.id().equals(user.id()));
        if (target.isEmpty()) {
            log.debug("Profile {} is not editable by {}", username, user.id());
            return Result.failure(new BlogError.UserNotFound(username));
        }

        var updated = target.get().withProfile(changes);
        if (updated.isFailure()) {
            return updated.mapError(BlogError::invalid).castFailure();
        }

        User profile = updated.getOrThrow();
        if (!profile.username().equals(username) && userRepository.existsByUsername(profile.username())) {
            log.warn("Username {} already taken, profile of {} unchanged", profile.username(), user.id());
            return Result.failure(BlogError.invalid(new UserError.UsernameTaken(profile.username())));
        }

        if (!userRepository.update(profile)) {
            log.warn("Username {} taken concurrently, profile of {} unchanged", profile.username(), user.id());
            return Result.failure(BlogError.invalid(new UserError.UsernameTaken(profile.username())));
        }

        metrics.incrementMutations(MetricsPort.Resource.PROFILE, MetricsPort.Action.UPDATED);
        log.info("Profile updated: userId={}, username={}", profile.id(), profile.username());

        return Result.success(Mutation.applied(profile, Location.profile(profile.username())));
    }
}
