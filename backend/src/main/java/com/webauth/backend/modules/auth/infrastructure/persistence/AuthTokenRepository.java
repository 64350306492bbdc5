package com.webauth.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.webauth.backend.modules.auth.domain.AuthToken;
import com.webauth.backend.modules.auth.domain.TokenKind;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuthTokenRepository extends JpaRepository<AuthToken, String> {

    @Query("""
            select t
              from AuthToken t
              join fetch t.user u
             where t.hashedValue = :hashedValue
               and t.kind = :kind
            """)
    Optional<AuthToken> findWithUser(@Param("hashedValue") String hashedValue, @Param("kind") TokenKind kind);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from AuthToken t where t.hashedValue = :hashedValue and t.kind = :kind")
    int deleteByHashedValueAndKind(@Param("hashedValue") String hashedValue, @Param("kind") TokenKind kind);

    long countByKind(TokenKind kind);
}
