package com.anotaai.api.users.service;

import com.anotaai.api.common.web.ConflictException;
import com.anotaai.api.common.web.NotFoundException;
import com.anotaai.api.users.dto.PageQuery;
import com.anotaai.api.users.dto.UserDtos;
import com.anotaai.api.users.entity.User;
import com.anotaai.api.users.repo.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

@Slf4j
@Service
public class UserService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final UserRepository repo;
    private final PasswordHasher hasher;
    private final Clock clock;

    public UserService(UserRepository repo, PasswordHasher hasher, Clock clock) {
        this.repo = repo;
        this.hasher = hasher;
        this.clock = clock;
    }

    /**
     * The existence check gives the friendly 409; the unique index catches the race between
     * two creations with the same email.
     */
    @Transactional
    public UserDtos.UserDto create(UserDtos.CreateUserRequest req) {
        if (repo.existsByEmailIgnoreCase(req.email())) {
            throw new ConflictException("Email already in use");
        }

        User u = new User();
        u.setName(req.name());
        u.setEmail(req.email());
        u.setPasswordHash(hasher.hash(req.password()));
        Instant now = clock.instant();
        u.setCreatedAt(now);
        u.setUpdatedAt(now);

        User saved;
        try {
            saved = repo.saveAndFlush(u);
        } catch (DataIntegrityViolationException e) {
            log.warn("user_create_conflict email={}", req.email());
            throw new ConflictException("Email already in use");
        }
        log.info("user_created userId={}", saved.getId());
        return UserDtos.UserDto.from(saved);
    }

    @Transactional(readOnly = true)
    public UserDtos.UserDto getById(String rawId) {
        long id = UserIds.parse(rawId);
        return repo.findById(id)
                .map(UserDtos.UserDto::from)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    /** Full record, hash included. For internal callers only; null when absent. */
    @Transactional(readOnly = true)
    public User getByEmail(String email) {
        if (email == null || email.isBlank()) return null;
        return repo.findByEmailIgnoreCase(email.trim()).orElse(null);
    }

    @Transactional(readOnly = true)
    public UserDtos.UserDto findByEmail(String email) {
        User u = getByEmail(email);
        if (u == null) throw new NotFoundException("User not found");
        return UserDtos.UserDto.from(u);
    }

    /** Pages past the end come back empty with the real total, however far past. */
    @Transactional(readOnly = true)
    public UserDtos.UserPage list(PageQuery q) {
        if (q.offset() > Integer.MAX_VALUE - q.limit()) {
            return emptyPage(q, repo.count());
        }
        Page<User> page = repo.findAll(PageRequest.of(q.page() - 1, q.limit(), NEWEST_FIRST));
        return new UserDtos.UserPage(
                page.getContent().stream().map(UserDtos.UserDto::from).toList(),
                UserDtos.Pagination.of(q.page(), q.limit(), page.getTotalElements())
        );
    }

    private static UserDtos.UserPage emptyPage(PageQuery q, long total) {
        return new UserDtos.UserPage(List.of(), UserDtos.Pagination.of(q.page(), q.limit(), total));
    }

    @Transactional
    public UserDtos.UserDto update(String rawId, UserDtos.UpdateUserRequest req) {
        long id = UserIds.parse(rawId);
        User u = repo.findById(id).orElseThrow(() -> new NotFoundException("User not found"));

        if (req.email() != null && !req.email().equals(u.getEmail())) {
            if (repo.existsByEmailIgnoreCaseAndIdNot(req.email(), id)) {
                throw new ConflictException("Email already in use by another user");
            }
            u.setEmail(req.email());
        }
        if (req.name() != null) {
            u.setName(req.name());
        }
        u.setUpdatedAt(clock.instant());

        User saved;
        try {
            saved = repo.saveAndFlush(u);
        } catch (DataIntegrityViolationException e) {
            log.warn("user_update_conflict userId={}", id);
            throw new ConflictException("Email already in use by another user");
        }
        log.info("user_updated userId={}", id);
        return UserDtos.UserDto.from(saved);
    }

    @Transactional
    public void delete(String rawId) {
        long id = UserIds.parse(rawId);
        if (!repo.existsById(id)) {
            throw new NotFoundException("User not found");
        }
        repo.deleteById(id);
        log.info("user_deleted userId={}", id);
    }

    /**
     * Malformed ids are rejected; store failures read as "does not exist".
     * Not transactional: a failed lookup must not mark an outer transaction rollback-only.
     */
    public boolean exists(String rawId) {
        long id = UserIds.parse(rawId);
        try {
            return repo.existsById(id);
        } catch (RuntimeException e) {
            log.error("user_exists_check_failed userId={} err={}", id, e.toString());
            return false;
        }
    }

    /**
     * Counted at call time in the clock's zone:
     * today from midnight, week = the last 7 days from midnight, month from the 1st.
     */
    @Transactional(readOnly = true)
    public UserDtos.UserStatistics statistics() {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);

        Instant startOfToday = today.atStartOfDay(zone).toInstant();
        Instant startOfWeek = today.minusDays(7).atStartOfDay(zone).toInstant();
        Instant startOfMonth = today.withDayOfMonth(1).atStartOfDay(zone).toInstant();

        return new UserDtos.UserStatistics(
                repo.count(),
                repo.countByCreatedAtGreaterThanEqual(startOfToday),
                repo.countByCreatedAtGreaterThanEqual(startOfWeek),
                repo.countByCreatedAtGreaterThanEqual(startOfMonth)
        );
    }

    public boolean verifyPassword(String email, String candidate) {
        User u = getByEmail(email);
        return u != null && hasher.matches(candidate, u.getPasswordHash());
    }
}
