package com.storefront.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Account-level problems raised by registration and the admin endpoints.
 *
 * Conventions:
 *  - type:  https://storefront.dev/problems/<slug>
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found: No account with the given id. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(HttpStatus.NOT_FOUND,
                    "https://storefront.dev/problems/user-not-found",
                    "User Not Found",
                    detail);
        }
    }

    /** 409 Conflict: Email already registered. */
    public static final class UserAlreadyExists extends ApiException {
        public UserAlreadyExists(String detail) {
            super(HttpStatus.CONFLICT,
                    "https://storefront.dev/problems/user-already-exists",
                    "User Already Exists",
                    detail);
        }
    }

    /** 400 Bad Request: Input is well-formed but not acceptable for this account. */
    public static final class InvalidUserInput extends ApiException {
        public InvalidUserInput(String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://storefront.dev/problems/invalid-user-input",
                    "Invalid User Input",
                    detail);
        }
    }

    /** 409 Conflict: Requested change is not allowed in the account's current state. */
    public static final class UserUpdateConflict extends ApiException {
        public UserUpdateConflict(String detail) {
            super(HttpStatus.CONFLICT,
                    "https://storefront.dev/problems/user-update-conflict",
                    "User Update Conflict",
                    detail);
        }
    }
}
