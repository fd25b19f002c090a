package com.hwsc.userservice.service;

import com.hwsc.userservice.entity.Secret;

public interface SecretService {

    /** The active, unexpired secret; rotates first when there is none. */
    Secret getActive();

    /** Generates a new secret and makes it the active one. */
    Secret rotate();

    /** Forgets the cached active secret; the next read goes to the store. */
    void invalidateCache();
}
