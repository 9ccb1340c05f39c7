package com.anotaai.api.users.repo;

import com.anotaai.api.users.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    // emails are stored lower-case already; IgnoreCase covers rows written by other tools
    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCaseAndIdNot(String email, Long id);

    long countByCreatedAtGreaterThanEqual(Instant from);
}
