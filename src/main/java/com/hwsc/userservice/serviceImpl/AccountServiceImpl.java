package com.hwsc.userservice.serviceImpl;

import com.hwsc.userservice.dto.UpdateUserRequest;
import com.hwsc.userservice.entity.Account;
import com.hwsc.userservice.exception.UserExceptions;
import com.hwsc.userservice.repository.AccountRepository;
import com.hwsc.userservice.service.AccountService;
import com.hwsc.userservice.service.AuthTokenService;
import com.hwsc.userservice.service.EmailTokenService;
import com.hwsc.userservice.utils.CredentialHasher;
import com.hwsc.userservice.utils.IdentityValidator;
import com.hwsc.userservice.utils.VerificationMailer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountServiceImpl implements AccountService {

    private final AccountRepository accountRepository;
    private final EmailTokenService emailTokenService;
    private final AuthTokenService authTokenService;
    private final CredentialHasher credentialHasher;
    private final VerificationMailer verificationMailer;

    @Override
    @Transactional
    public Account register(Account account) {
        if (accountRepository.existsByEmailOrProspectiveEmail(account.getEmail(), account.getEmail())) {
            throw new UserExceptions.EmailAlreadyInUse(account.getEmail());
        }

        Account saved;
        try {
            saved = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent registration of the same email
            throw new UserExceptions.EmailAlreadyInUse(account.getEmail());
        }

        String token = emailTokenService.issue(saved.getId());
        verificationMailer.sendVerification(saved.getEmail(), saved.getFirstName(), token);
        log.info("Account {} registered", saved.getId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> find(String id) {
        return accountRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByEmail(String email) {
        return accountRepository.findByEmail(IdentityValidator.normalizeEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String id) {
        return accountRepository.existsById(id);
    }

    @Override
    @Transactional
    public Account update(String id, UpdateUserRequest changes) {
        Account account = accountRepository.findById(id)
                .orElseThrow(() -> new UserExceptions.UserNotFound("no account with uuid " + id));

        if (hasText(changes.getFirstName())) {
            account.setFirstName(changes.getFirstName().trim());
        }
        if (hasText(changes.getLastName())) {
            account.setLastName(changes.getLastName().trim());
        }
        if (hasText(changes.getOrganization())) {
            account.setOrganization(changes.getOrganization());
        }
        if (hasText(changes.getPassword())) {
            account.setPassword(credentialHasher.hash(changes.getPassword()));
        }

        String pendingEmail = null;
        if (hasText(changes.getEmail())) {
            String email = IdentityValidator.normalizeEmail(changes.getEmail());
            if (!email.equals(account.getEmail())) {
                if (accountRepository.isEmailTakenByOther(email, id)) {
                    throw new UserExceptions.EmailAlreadyInUse(email);
                }
                account.setProspectiveEmail(email);
                pendingEmail = email;
            }
        }

        Account saved;
        try {
            saved = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw new UserExceptions.EmailAlreadyInUse(pendingEmail != null ? pendingEmail : account.getEmail());
        }
        if (pendingEmail != null) {
            String token = emailTokenService.issue(id);
            verificationMailer.sendVerification(pendingEmail, saved.getFirstName(), token);
            log.info("Account {} requested email change", id);
        }
        log.info("Account {} updated", id);
        return saved;
    }

    @Override
    @Transactional
    public void delete(String id) {
        authTokenService.revoke(id);
        emailTokenService.discard(id);
        accountRepository.deleteById(id);
        log.info("Account {} deleted", id);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
