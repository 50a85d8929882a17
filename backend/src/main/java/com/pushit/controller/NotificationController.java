package com.pushit.controller;

import static com.pushit.util.Constants.API_BASE_PATH;

import com.pushit.dto.response.ApiResponse;
import com.pushit.dto.response.NotificationResponse;
import com.pushit.entity.User;
import com.pushit.security.CurrentUser;
import com.pushit.service.notification.NotificationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(API_BASE_PATH + "/notifications")
@RequiredArgsConstructor
@Tag(name = "Notifications")
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<NotificationResponse>>> list(@CurrentUser User user) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        notificationService.listForUser(user.getId()).stream()
                                .map(NotificationResponse::fromEntity)
                                .toList()));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<ApiResponse<Map<String, Long>>> unreadCount(@CurrentUser User user) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        Map.of("unread", notificationService.unreadCount(user.getId()))));
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<ApiResponse<NotificationResponse>> markRead(
            @CurrentUser User user, @PathVariable Long id) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        NotificationResponse.fromEntity(
                                notificationService.markRead(user.getId(), id))));
    }
}
