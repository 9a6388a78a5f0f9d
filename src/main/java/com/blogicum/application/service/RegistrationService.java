package com.blogicum.application.service;

import com.blogicum.application.port.in.RegisterUserUseCase;
import com.blogicum.application.port.out.IdGenerator;
import com.blogicum.application.port.out.MetricsPort;
import com.blogicum.application.port.out.UserRepository;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.error.ValidationError.UserError;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
public class RegistrationService implements RegisterUserUseCase {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final UserRepository userRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final MetricsPort metrics;

    public RegistrationService(UserRepository userRepository, IdGenerator idGenerator, Clock clock, MetricsPort metrics) {
        this.userRepository = userRepository;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<User, BlogError> register(String username, String firstName, String lastName, String email) {
        var userResult = User.register(
            UserId.of(idGenerator.generate()), username, firstName, lastName, email, Instant.now(clock));
        if (userResult.isFailure()) {
            log.warn("Registration rejected: {}", userResult.errorOrNull().message());
            return userResult.mapError(BlogError::invalid);
        }

        User user = userResult.getOrThrow();
        if (userRepository.existsByUsername(user.username())) {
            log.debug("Username already registered: {}", user.username());
            return Result.failure(BlogError.invalid(new UserError.UsernameTaken(user.username())));
        }

        if (!userRepository.save(user)) {
            log.debug("Username registered concurrently: {}", user.username());
            return Result.failure(BlogError.invalid(new UserError.UsernameTaken(user.username())));
        }

        metrics.incrementRegistrations();
        log.info("User registered: userId={}, username={}", user.id(), user.username());

        return Result.success(user);
    }
}
