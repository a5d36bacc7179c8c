package dev.jobboard.web;

import dev.jobboard.model.NotificationResponse;
import dev.jobboard.model.PageResponse;
import dev.jobboard.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public Mono<PageResponse<NotificationResponse>> list(
            @ActingUser Long actorId,
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return Requests.call(() -> notificationService.list(actorId, unreadOnly, page, size));
    }

    @GetMapping("/unread-count")
    public Mono<Map<String, Long>> unreadCount(
            @ActingUser Long actorId) {
        return Requests.call(() -> Map.of("count", notificationService.unreadCount(actorId)));
    }

    @PatchMapping("/{notificationId}/read")
    public Mono<NotificationResponse> markRead(
            @ActingUser Long actorId,
            @PathVariable Long notificationId) {
        return Requests.call(() -> notificationService.markRead(actorId, notificationId));
    }

    @PatchMapping("/read-all")
    public Mono<Map<String, Integer>> markAllRead(
            @ActingUser Long actorId) {
        return Requests.call(() -> Map.of("updated", notificationService.markAllRead(actorId)));
    }

    @DeleteMapping("/{notificationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@ActingUser Long actorId,
            @PathVariable Long notificationId) {
        return Requests.run(() -> notificationService.delete(actorId, notificationId));
    }
}
