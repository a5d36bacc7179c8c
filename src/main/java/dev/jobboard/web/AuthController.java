package dev.jobboard.web;

import dev.jobboard.model.LoginRequest;
import dev.jobboard.model.LoginResponse;
import dev.jobboard.model.RegisterRequest;
import dev.jobboard.model.UserResponse;
import dev.jobboard.service.AccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AccountService accountService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return Requests.call(() -> accountService.register(request));
    }

    @PostMapping("/login")
    public Mono<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return Requests.call(() -> accountService.login(request));
    }

    @GetMapping("/me")
    public Mono<UserResponse> me(@ActingUser Long actorId) {
        return Requests.call(() -> accountService.me(actorId));
    }
}
