package com.tasktracker.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import com.tasktracker.backend.global.error.RetryableProblemException;
import com.tasktracker.backend.modules.auth.application.exception.CredentialIntegrityException;
import com.tasktracker.backend.modules.auth.application.exception.CredentialValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted, adaptive password hashing on top of the bcrypt {@link PasswordEncoder}.
 *
 * <p>The salt and cost factor are embedded in the digest, so verification needs
 * nothing else. All bcrypt work runs on the {@code passwordHashingExecutor} pool and
 * callers wait at most the configured timeout.
 *
 * <p>A timeout releases the caller only. bcrypt does not respond to interruption, so
 * the job keeps its pool thread until the hash completes; the pool size and queue
 * capacity bound how much such abandoned work can pile up.
 */
@Component
public class PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_PASSWORD_BYTES = 72;

    static final String PASSWORD_HASHING_BUSY = "PASSWORD_HASHING_BUSY";

    private static final Pattern BCRYPT_DIGEST = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;
    private final Executor executor;
    private final Duration timeout;
    private final String dummyDigest;

    public PasswordHasher(
            PasswordEncoder passwordEncoder,
            @Qualifier("passwordHashingExecutor") Executor executor,
            @Value("${app.auth.password-hashing.timeout:PT5S}") Duration timeout
    ) {
        this.passwordEncoder = passwordEncoder;
        this.executor = executor;
        this.timeout = timeout;
        this.dummyDigest = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Cannot hash an empty password");
        }
        return runBounded(() -> passwordEncoder.encode(plaintext));
    }

    /**
     * Constant-time check of {@code plaintext} against a stored digest. A wrong
     * password is a plain {@code false}.
     *
     * @throws CredentialIntegrityException if {@code digest} is not a bcrypt digest
     */
    public boolean verify(String plaintext, String digest) {
        if (digest == null || !BCRYPT_DIGEST.matcher(digest).matches()) {
            throw new CredentialIntegrityException(CredentialIntegrityException.CREDENTIAL_INTEGRITY_ERROR,
                    "Stored password hash is not a bcrypt digest");
        }
        if (plaintext == null || plaintext.isEmpty()) {
            return false;
        }
        return runBounded(() -> passwordEncoder.matches(plaintext, digest));
    }

    /**
     * Burns the same CPU as a real verification. Used when there is no account to
     * check against, so response times do not reveal whether a username exists.
     */
    public void verifyAgainstDummy(String plaintext) {
        verify(plaintext == null || plaintext.isEmpty() ? "-" : plaintext, dummyDigest);
    }

    public void checkPolicy(String newPassword) {
        if (newPassword == null || newPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new CredentialValidationException(CredentialValidationException.PASSWORD_TOO_SHORT,
                    "Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        int bytes = newPassword.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > MAX_PASSWORD_BYTES) {
            throw new CredentialValidationException(CredentialValidationException.PASSWORD_TOO_LONG,
                    "Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
    }

    private <T> T runBounded(Supplier<T> work) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(work, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Password hashing pool saturated, rejecting request");
            throw busy(e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw busy(e);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Password hashing did not finish within {}", timeout);
            throw busy(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Password hashing failed", cause);
        }
    }

    private RetryableProblemException busy(Throwable cause) {
        return new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, PASSWORD_HASHING_BUSY,
                "Server is busy, please retry", 1, cause);
    }
}
