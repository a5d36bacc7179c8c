package dev.jobboard.web;

import dev.jobboard.entity.Role;
import dev.jobboard.model.PageResponse;
import dev.jobboard.model.UserResponse;
import dev.jobboard.service.AdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Account administration, admins only.
 */
@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService adminService;

    @GetMapping
    public Mono<PageResponse<UserResponse>> list(
            @ActingUser Long actorId,
            @RequestParam(required = false) String role,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        Role filter = Requests.parseEnum(role, Role::fromValue, "role");
        return Requests.call(() -> adminService.listUsers(actorId, filter, page, size));
    }

    @GetMapping("/{userId}")
    public Mono<UserResponse> get(@ActingUser Long actorId,
            @PathVariable Long userId) {
        return Requests.call(() -> adminService.getUser(actorId, userId));
    }

    @PatchMapping("/{userId}/active")
    public Mono<UserResponse> setActive(@ActingUser Long actorId,
            @PathVariable Long userId, @RequestParam boolean active) {
        return Requests.call(() -> adminService.setActive(actorId, userId, active));
    }

    @PostMapping("/{userId}/verify")
    public Mono<UserResponse> verify(@ActingUser Long actorId,
            @PathVariable Long userId) {
        return Requests.call(() -> adminService.verify(actorId, userId));
    }

    @DeleteMapping("/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@ActingUser Long actorId,
            @PathVariable Long userId) {
        return Requests.run(() -> adminService.deleteUser(actorId, userId));
    }
}
