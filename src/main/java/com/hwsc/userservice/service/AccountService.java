package com.hwsc.userservice.service;

import com.hwsc.userservice.dto.UpdateUserRequest;
import com.hwsc.userservice.entity.Account;

import java.util.Optional;

public interface AccountService {

    /** Persists the account, issues its email token and mails it, all or nothing. */
    Account register(Account account);

    Optional<Account> find(String id);

    Optional<Account> findByEmail(String email);

    boolean exists(String id);

    /** Applies the non-blank fields of {@code changes}; an email change stays pending until verified. */
    Account update(String id, UpdateUserRequest changes);

    /** Removes the account together with its auth and email tokens. */
    void delete(String id);
}
