/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 */

package juuxel.synthlauncher.auth;

import juuxel.synthlauncher.data.Account;
import juuxel.synthlauncher.state.LauncherState;
import juuxel.synthlauncher.task.CancellationToken;
import juuxel.synthlauncher.task.ErrorKind;
import juuxel.synthlauncher.task.LauncherException;
import juuxel.synthlauncher.task.Task;
import juuxel.synthlauncher.task.TaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Signs accounts in through the device-code flow and refreshes their tokens.
 *
 * <p>One device-code session exists per launcher state: requesting a new code replaces
 * the pending one, and {@link #pollDeviceAuthorization} takes the session so only one
 * loop polls it.
 */
public final class AuthFlow {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuthFlow.class);
    static final Duration SLOW_DOWN_INCREMENT = Duration.ofSeconds(5);

    private final TaskRunner runner;
    private final IdentityProvider provider;
    private final Clock clock;

    public AuthFlow(TaskRunner runner, IdentityProvider provider) {
        this(runner, provider, Clock.systemUTC());
    }

    public AuthFlow(TaskRunner runner, IdentityProvider provider, Clock clock) {
        this.runner = runner;
        this.provider = provider;
        this.clock = clock;
    }

    public Task<AuthSession> requestDeviceCode(LauncherState state) {
        return runner.start("Requesting a device code", token -> {
            var session = provider.requestDeviceCode(token);
            token.throwIfCancelled("Requesting a device code");
            state.setAuthSession(session);
            LOGGER.info("Go to {} and enter {}", session.verificationUrl(), session.userCode());
            return session;
        });
    }

    /**
     * Polls until the user completes the sign-in, then adds the account to the registry,
     * replacing an existing entry for the same profile, and saves the registry.
     */
    public Task<Account> pollDeviceAuthorization(LauncherState state) {
        return runner.start("Waiting for sign-in", token -> {
            var session = state.takeAuthSession();
            var tokens = awaitTokens(session, token);
            var account = toAccount(provider.logIn(tokens, token), tokens);

            token.throwIfCancelled("Signing in");
            int index = state.accounts().upsert(account);
            state.commit();
            LOGGER.info("Signed in as {} (account #{})", account.displayName(), index);
            return account;
        });
    }

    /**
     * Replaces the tokens of the account at {@code index}.
     * A rejected refresh token fails with {@link juuxel.synthlauncher.task.ReauthenticationRequiredException};
     * the account is left as it was.
     */
    public Task<Account> refreshAccount(LauncherState state, int index) {
        return runner.start("Refreshing account #" + index, token -> {
            var account = state.accounts().get(index);
            var tokens = provider.refresh(account.refreshToken(), token);
            var refreshed = toAccount(provider.logIn(tokens, token), tokens);

            if (!refreshed.profile().id().equals(account.profile().id())) {
                throw new LauncherException(ErrorKind.AUTH, "Refreshing " + account.displayName() + " signed in a different profile");
            }

            token.throwIfCancelled("Refreshing " + account.displayName());
            state.accounts().replace(index, refreshed);
            state.commit();
            LOGGER.info("Refreshed {}", refreshed.displayName());
            return refreshed;
        });
    }

    private OAuthTokens awaitTokens(AuthSession session, CancellationToken token) throws LauncherException {
        var interval = session.interval();

        while (true) {
            token.throwIfCancelled("Waiting for sign-in");
            if (!clock.instant().isBefore(session.expiresAt())) {
                throw new LauncherException(ErrorKind.AUTH, "The device code " + session.userCode() + " expired");
            }

            var poll = provider.pollToken(session, token);
            switch (poll.status()) {
                case GRANTED -> {
                    return poll.tokens();
                }
                case SLOW_DOWN -> {
                    interval = interval.plus(SLOW_DOWN_INCREMENT);
                    LOGGER.debug("Slowing down token polls to {}", interval);
                }
                case PENDING -> {
                }
            }

            token.sleep(interval, "Waiting for sign-in");
        }
    }

    private Account toAccount(MinecraftLogin login, OAuthTokens tokens) {
        long expiry = clock.instant().getEpochSecond() + tokens.expiresIn();
        return new Account(login.profile(), login.accessToken(), tokens.refreshToken(), expiry);
    }
}
