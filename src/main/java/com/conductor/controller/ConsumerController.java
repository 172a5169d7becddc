package com.conductor.controller;

import com.conductor.dto.ConsumerRequest;
import com.conductor.model.Consumer;
import com.conductor.service.ConsumerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Consumer (cluster) registration.
 *
 * POST   /api/consumers          {"name": "cluster1"}
 * GET    /api/consumers
 * GET    /api/consumers/{name}
 * DELETE /api/consumers/{name}
 */
@RestController
@RequestMapping("/api/consumers")
@RequiredArgsConstructor
public class ConsumerController {

    private final ConsumerService consumerService;

    @PostMapping
    public ResponseEntity<Consumer> register(@Valid @RequestBody ConsumerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(consumerService.register(request.getName()));
    }

    @GetMapping
    public ResponseEntity<List<Consumer>> list() {
        return ResponseEntity.ok(consumerService.list());
    }

    @GetMapping("/{name}")
    public ResponseEntity<Consumer> get(@PathVariable String name) {
        return ResponseEntity.ok(consumerService.get(name));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> delete(@PathVariable String name) {
        consumerService.delete(name);
        return ResponseEntity.noContent().build();
    }
}
