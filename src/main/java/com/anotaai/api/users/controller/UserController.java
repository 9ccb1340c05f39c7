package com.anotaai.api.users.controller;

import com.anotaai.api.common.web.ApiResponse;
import com.anotaai.api.common.web.ValidationException;
import com.anotaai.api.users.dto.PageQuery;
import com.anotaai.api.users.dto.UserDtos;
import com.anotaai.api.users.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.Callable;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService service;

    public UserController(UserService service) {
        this.service = service;
    }

    @PostMapping
    public Callable<ResponseEntity<ApiResponse<UserDtos.UserDto>>> create(
            @Valid @RequestBody UserDtos.CreateUserRequest body
    ) {
        return () -> ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("User created successfully", service.create(body)));
    }

    /** page and limit are taken as strings so a non-number gets the pagination message, not a type error */
    @GetMapping
    public Callable<ResponseEntity<ApiResponse<UserDtos.UserPage>>> list(
            @RequestParam(value = "page", required = false) String page,
            @RequestParam(value = "limit", required = false) String limit
    ) {
        PageQuery q = PageQuery.parse(page, limit);
        return () -> ResponseEntity.ok(ApiResponse.ok("Users retrieved successfully", service.list(q)));
    }

    @GetMapping("/statistics")
    public Callable<ResponseEntity<ApiResponse<UserDtos.UserStatistics>>> statistics() {
        return () -> ResponseEntity.ok(ApiResponse.ok("Statistics retrieved successfully", service.statistics()));
    }

    @GetMapping("/search/email")
    public Callable<ResponseEntity<ApiResponse<UserDtos.UserDto>>> byEmail(
            @RequestParam(value = "email", required = false) String email
    ) {
        if (email == null || email.isBlank()) {
            throw new ValidationException("Email is required");
        }
        return () -> ResponseEntity.ok(ApiResponse.ok("User found successfully", service.findByEmail(email)));
    }

    @GetMapping("/{id}")
    public Callable<ResponseEntity<ApiResponse<UserDtos.UserDto>>> get(@PathVariable("id") String id) {
        return () -> ResponseEntity.ok(ApiResponse.ok("User found successfully", service.getById(id)));
    }

    @GetMapping("/{id}/exists")
    public Callable<ResponseEntity<ApiResponse<UserDtos.ExistsDto>>> exists(@PathVariable("id") String id) {
        return () -> {
            boolean exists = service.exists(id);
            return ResponseEntity.ok(ApiResponse.ok(exists ? "User exists" : "User not found",
                    new UserDtos.ExistsDto(exists, id)));
        };
    }

    @PutMapping("/{id}")
    public Callable<ResponseEntity<ApiResponse<UserDtos.UserDto>>> update(
            @PathVariable("id") String id,
            @Valid @RequestBody UserDtos.UpdateUserRequest body
    ) {
        return () -> ResponseEntity.ok(ApiResponse.ok("User updated successfully", service.update(id, body)));
    }

    @DeleteMapping("/{id}")
    public Callable<ResponseEntity<ApiResponse<Void>>> delete(@PathVariable("id") String id) {
        return () -> {
            service.delete(id);
            return ResponseEntity.ok(ApiResponse.ok("User deleted successfully"));
        };
    }
}
