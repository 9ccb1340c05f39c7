package com.anotaai.api.users.dto;

import com.anotaai.api.users.entity.User;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public class UserDtos {

    static final String NAME_REGEX = "^[a-zA-ZÀ-ÿ\\s]+$";
    static final String EMAIL_REGEX = "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$";
    static final String PASSWORD_REGEX = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d).+$";

    public record CreateUserRequest(
            @NotBlank(message = "Name is required")
            @Size(min = 2, max = 100, message = "Name must be between 2 and 100 characters")
            @Pattern(regexp = NAME_REGEX, message = "Name must contain only letters and spaces")
            String name,

            @NotBlank(message = "Email is required")
            @Email(regexp = EMAIL_REGEX, message = "Email must be a valid address")
            @Size(max = 255, message = "Email cannot exceed 255 characters")
            String email,

            @NotNull(message = "Password is required")
            @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
            @Pattern(regexp = PASSWORD_REGEX,
                    message = "Password must contain at least one uppercase letter, one lowercase letter and one number")
            String password
    ) {
        public CreateUserRequest {
            name = name == null ? null : name.trim();
            email = email == null ? null : email.trim().toLowerCase();
        }
    }

    /**
     * Partial update: absent or blank fields are left untouched.
     * A password sent here is ignored (unknown property).
     */
    public record UpdateUserRequest(
            @Size(min = 2, max = 100, message = "Name must be between 2 and 100 characters")
            @Pattern(regexp = NAME_REGEX, message = "Name must contain only letters and spaces")
            String name,

            @Email(regexp = EMAIL_REGEX, message = "Email must be a valid address")
            @Size(max = 255, message = "Email cannot exceed 255 characters")
            String email
    ) {
        public UpdateUserRequest {
            name = (name == null || name.isBlank()) ? null : name.trim();
            email = (email == null || email.isBlank()) ? null : email.trim().toLowerCase();
        }

        public boolean isEmpty() {
            return name == null && email == null;
        }
    }

    /** public view; the password hash never leaves the service */
    public record UserDto(Long id, String name, String email, Instant createdAt, Instant updatedAt) {

        public static UserDto from(User u) {
            return new UserDto(u.getId(), u.getName(), u.getEmail(), u.getCreatedAt(), u.getUpdatedAt());
        }
    }

    public record Pagination(int page, int limit, long total, int pages, boolean hasNext, boolean hasPrev) {

        public static Pagination of(int page, int limit, long total) {
            int pages = (int) ((total + limit - 1) / limit);
            return new Pagination(page, limit, total, pages, page < pages, page > 1);
        }
    }

    public record UserPage(List<UserDto> users, Pagination pagination) {}

    public record UserStatistics(long totalUsers, long usersToday, long usersThisWeek, long usersThisMonth) {}

    public record ExistsDto(boolean exists, String userId) {}
}
