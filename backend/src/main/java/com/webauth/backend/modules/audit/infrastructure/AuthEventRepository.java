package com.webauth.backend.modules.audit.infrastructure;

import java.util.List;

import com.webauth.backend.modules.audit.domain.AuthEvent;
import com.webauth.backend.modules.audit.domain.EventName;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuthEventRepository extends JpaRepository<AuthEvent, Long> {

    List<AuthEvent> findByUsernameAndNameOrderByCreatedDescIdDesc(String username, EventName name, Pageable pageable);

    List<AuthEvent> findAllByOrderByCreatedDescIdDesc();

    List<AuthEvent> findByName(EventName name);
}
