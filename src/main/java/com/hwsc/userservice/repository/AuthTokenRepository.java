package com.hwsc.userservice.repository;

import com.hwsc.userservice.entity.AuthToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface AuthTokenRepository extends JpaRepository<AuthToken, String> {

    Optional<AuthToken> findByAccountId(String accountId);

    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("delete from AuthToken t where t.token = :token")
    int deleteByToken(@Param("token") String token);

    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("delete from AuthToken t where t.accountId = :accountId")
    int deleteByAccountId(@Param("accountId") String accountId);
}
