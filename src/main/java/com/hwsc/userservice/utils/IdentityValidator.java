package com.hwsc.userservice.utils;

import com.github.f4b6a3.ulid.Ulid;
import com.hwsc.userservice.exception.RequestExceptions;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Syntax checks for caller-supplied identity fields. Every method throws
 * {@link RequestExceptions.InvalidArgument} on failure and never touches the store.
 */
public final class IdentityValidator {

    static final int MAX_NAME_LENGTH = 32;
    static final int MAX_EMAIL_LENGTH = 320;

    private static final Pattern MULTI_SPACE = Pattern.compile("[\\s\\p{Zs}]{2,}");
    private static final Pattern NAME_CHARS =
            Pattern.compile("^\\p{L}+((['.\\s-][\\p{L}\\s])?\\p{L}*)*$");
    private static final Pattern EMAIL = Pattern.compile(".+@.+");

    private IdentityValidator() {}

    public static void firstName(String name) {
        name("first name", name);
    }

    public static void lastName(String name) {
        name("last name", name);
    }

    public static void email(String email) {
        if (email == null) {
            throw new RequestExceptions.InvalidArgument("invalid email");
        }
        String trimmed = email.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_EMAIL_LENGTH || !EMAIL.matcher(trimmed).matches()) {
            throw new RequestExceptions.InvalidArgument("invalid email");
        }
    }

    public static void password(String password) {
        if (password == null || password.isBlank()) {
            throw new RequestExceptions.InvalidArgument("invalid password");
        }
    }

    public static void organization(String organization) {
        if (organization == null || organization.isEmpty()) {
            throw new RequestExceptions.InvalidArgument("invalid organization");
        }
    }

    /** Accepts only the canonical lower-case, 26-character ULID form the service hands out. */
    public static void accountId(String id) {
        if (id == null || id.isEmpty()
                || !Ulid.isValid(id.toUpperCase(Locale.ROOT))
                || !id.equals(id.toLowerCase(Locale.ROOT))) {
            throw new RequestExceptions.InvalidArgument("invalid uuid");
        }
    }

    /** Lower-cased, trimmed form under which emails are stored and compared. */
    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static void name(String field, String name) {
        if (name == null || name.isBlank()) {
            throw new RequestExceptions.InvalidArgument("invalid " + field);
        }
        String collapsed = MULTI_SPACE.matcher(name.trim()).replaceAll(" ");
        if (collapsed.length() > MAX_NAME_LENGTH || !NAME_CHARS.matcher(collapsed).matches()) {
            throw new RequestExceptions.InvalidArgument("invalid " + field);
        }
    }
}
