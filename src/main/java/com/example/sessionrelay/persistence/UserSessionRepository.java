package com.example.sessionrelay.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserSessionRepository extends JpaRepository<UserSessionEntity, String> {

    @Query("select s from UserSessionEntity s where s.sessionToken = :token and s.expiresAtEpochMs > :now")
    Optional<UserSessionEntity> findValid(@Param("token") String token, @Param("now") long nowEpochMs);
}
