package com.blogicum.adapter.in.web;

import com.blogicum.adapter.in.web.FeedController.ProfileResponse;
import com.blogicum.application.port.in.RegisterUserUseCase;
import com.blogicum.application.port.in.UpdateProfileUseCase;
import com.blogicum.domain.model.Location;
import com.blogicum.domain.model.ProfileChanges;
import com.blogicum.domain.model.User;
import com.blogicum.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Profiles", description = "Registration and profile editing")
public class ProfileController {

    private final UpdateProfileUseCase updateProfileUseCase;
    private final RegisterUserUseCase registerUserUseCase;
    private final BlogResponses responses;

    public ProfileController(
            UpdateProfileUseCase updateProfileUseCase,
            RegisterUserUseCase registerUserUseCase,
            BlogResponses responses) {
        this.updateProfileUseCase = updateProfileUseCase;
        this.registerUserUseCase = registerUserUseCase;
        this.responses = responses;
    }

    @PutMapping("/profiles/{username}")
    @LoginRequired
    @Operation(summary = "Edit own profile", description = "Only the profile's owner may edit it; continues at the (possibly renamed) profile")
    public ResponseEntity<?> updateProfile(
            @Parameter(description = "Username", example = "alice") @PathVariable String username,
            @Valid @RequestBody ProfileRequest body,
            HttpServletRequest request) {
        ProfileChanges changes = new ProfileChanges(body.username(), body.firstName(), body.lastName(), body.email());
        var result = updateProfileUseCase.updateProfile(RequestContext.getActor(), username, changes);
        return responses.mutation(result, HttpStatus.OK, ProfileResponse::from, request);
    }

    @PostMapping("/auth/registration")
    @Operation(summary = "Register", description = "Creates a regular user account")
    public ResponseEntity<?> register(@Valid @RequestBody RegistrationRequest body, HttpServletRequest request) {
        var result = registerUserUseCase.register(body.username(), body.firstName(), body.lastName(), body.email());
        if (result.isFailure()) {
            return responses.error(result.errorOrNull(), request);
        }
        User user = result.getOrThrow();
        return ResponseEntity.created(URI.create(Location.profile(user.username()).path()))
            .body(ProfileResponse.from(user));
    }

    public record ProfileRequest(
        @NotBlank @Size(max = 150) String username,
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        @Email String email
    ) {}

    public record RegistrationRequest(
        @NotBlank @Size(max = 150) String username,
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        @Email String email
    ) {}
}
