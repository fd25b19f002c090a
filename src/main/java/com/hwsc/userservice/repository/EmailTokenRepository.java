package com.hwsc.userservice.repository;

import com.hwsc.userservice.entity.EmailToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface EmailTokenRepository extends JpaRepository<EmailToken, String> {

    Optional<EmailToken> findByAccountId(String accountId);

    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("delete from EmailToken t where t.accountId = :accountId")
    int deleteByAccountId(@Param("accountId") String accountId);
}
