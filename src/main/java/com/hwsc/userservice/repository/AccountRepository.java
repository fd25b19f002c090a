package com.hwsc.userservice.repository;

import com.hwsc.userservice.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByEmail(String email);

    boolean existsByEmail(String email);

    /** True when the email is committed by, or pending for, any account. */
    boolean existsByEmailOrProspectiveEmail(String email, String prospectiveEmail);

    /** True when another account (not {@code id}) owns or awaits the email. */
    @Query("""
            select case when count(a) > 0 then true else false end from Account a
            where a.id <> :id and (a.email = :email or a.prospectiveEmail = :email)
            """)
    boolean isEmailTakenByOther(@Param("email") String email, @Param("id") String id);
}
