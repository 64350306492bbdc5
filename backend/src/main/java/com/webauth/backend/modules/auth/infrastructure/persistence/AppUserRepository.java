package com.webauth.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.webauth.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, String> {

    boolean existsByEmail(String email);

    Optional<AppUser> findByEmail(String email);

    List<AppUser> findAllByOrderByUsernameAsc();

    @Modifying
    @Query("update AppUser u set u.hashedPassword = :hashedPassword where u.username = :username")
    int updateHashedPassword(@Param("username") String username, @Param("hashedPassword") String hashedPassword);
}
