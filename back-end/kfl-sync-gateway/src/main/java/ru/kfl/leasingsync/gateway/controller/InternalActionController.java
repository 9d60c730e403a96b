package ru.kfl.leasingsync.gateway.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.kfl.leasingsync.gateway.domain.UserAction;
import ru.kfl.leasingsync.gateway.service.UpsertEngine;
import ru.kfl.leasingsync.shared.dto.action.ActionCreatedResponse;
import ru.kfl.leasingsync.shared.dto.action.UserActionPayload;

@RestController
@RequestMapping("/api/actions")
@RequiredArgsConstructor
public class InternalActionController {

    private final UpsertEngine engine;

    @PostMapping("/")
    public ResponseEntity<ActionCreatedResponse> createAction(@RequestBody UserActionPayload req) {
        UserAction saved = engine.appendAction(req);
        return ResponseEntity.status(HttpStatus.CREATED).body(new ActionCreatedResponse(true, saved.getId()));
    }
}
