package ru.kfl.leasingsync.gateway.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.kfl.leasingsync.gateway.domain.TelegramUser;
import ru.kfl.leasingsync.gateway.service.UpsertEngine;
import ru.kfl.leasingsync.gateway.store.UserFilter;
import ru.kfl.leasingsync.shared.dto.user.UserPayload;
import ru.kfl.leasingsync.shared.dto.user.UserRoleResponse;
import ru.kfl.leasingsync.shared.dto.user.UserUpsertResponse;
import ru.kfl.leasingsync.shared.error.NotFoundException;
import ru.kfl.leasingsync.shared.store.KeyedStore;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class InternalUserController {

    private final UpsertEngine engine;
    private final KeyedStore<Long, TelegramUser, UserFilter> users;

    @PostMapping("/upsert/")
    public ResponseEntity<UserUpsertResponse> upsertUser(@RequestBody UserPayload req) {
        UpsertOutcome<TelegramUser> outcome = engine.upsertUser(req);
        TelegramUser user = outcome.entity();

        return ResponseEntity.status(outcome.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(new UserUpsertResponse(true, outcome.created(),
                        user.getTelegramId(), user.getRole().wireValue()));
    }

    @GetMapping("/{telegramId}/role/")
    public ResponseEntity<UserRoleResponse> userRole(@PathVariable Long telegramId) {
        TelegramUser user = users.get(telegramId)
                .orElseThrow(() -> new NotFoundException("User not found"));

        return ResponseEntity.ok(
                new UserRoleResponse(true, user.getTelegramId(), user.getRole().wireValue())
        );
    }
}
