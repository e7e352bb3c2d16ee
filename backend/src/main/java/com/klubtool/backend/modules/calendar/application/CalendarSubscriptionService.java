package com.klubtool.backend.modules.calendar.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.application.MembershipResolver;
import com.klubtool.backend.modules.auth.domain.PortalUser;
import com.klubtool.backend.modules.calendar.domain.CalendarSubscriptionToken;
import com.klubtool.backend.modules.calendar.infrastructure.persistence.CalendarSubscriptionTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, revokes and validates calendar feed tokens. A user holds at most one active token.
 */
@Service
@Transactional
public class CalendarSubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(CalendarSubscriptionService.class);
    private static final int MAX_RAW_TOKEN_LENGTH = 128;

    private final CalendarSubscriptionTokenRepository tokenRepository;
    private final SubscriptionTokenHasher tokenHasher;
    private final MembershipResolver membershipResolver;
    private final Clock clock;

    public CalendarSubscriptionService(
            CalendarSubscriptionTokenRepository tokenRepository,
            SubscriptionTokenHasher tokenHasher,
            MembershipResolver membershipResolver,
            Clock clock
    ) {
        this.tokenRepository = tokenRepository;
        this.tokenHasher = tokenHasher;
        this.membershipResolver = membershipResolver;
        this.clock = clock;
    }

    public IssuedSubscription issueForCurrentUser() {
        PortalUser user = membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
        OffsetDateTime now = OffsetDateTime.now(clock);
        revokeActive(user, now);

        String rawToken = tokenHasher.newRawToken();
        CalendarSubscriptionToken token = tokenRepository.save(
                new CalendarSubscriptionToken(user, tokenHasher.hash(rawToken)));
        log.info("Issued calendar subscription token {} for user {}", token.getId(), user.getId());
        return new IssuedSubscription(rawToken, token.getCreatedAt() != null ? token.getCreatedAt() : now);
    }

    public void revokeForCurrentUser() {
        PortalUser user = membershipResolver.findCurrentUser().orElseThrow(ProblemException::forbidden);
        int revoked = revokeActive(user, OffsetDateTime.now(clock));
        log.info("Revoked {} calendar subscription token(s) for user {}", revoked, user.getId());
    }

    /**
     * Owner of a usable token, empty for unknown, revoked or malformed tokens and inactive owners.
     */
    public Optional<PortalUser> resolveFeedUser(String rawToken) {
        if (rawToken == null || rawToken.isBlank() || rawToken.length() > MAX_RAW_TOKEN_LENGTH) {
            return Optional.empty();
        }
        String hash = tokenHasher.hash(rawToken);
        Optional<CalendarSubscriptionToken> token = tokenRepository.findByTokenHash(hash)
                .filter(found -> MessageDigest.isEqual(
                        found.getTokenHash().getBytes(StandardCharsets.US_ASCII),
                        hash.getBytes(StandardCharsets.US_ASCII)))
                .filter(found -> !found.isRevoked())
                .filter(found -> found.getUser().isActive());
        if (token.isEmpty()) {
            log.debug("Rejected calendar feed request with unusable token");
            return Optional.empty();
        }
        token.get().markUsed(OffsetDateTime.now(clock));
        return Optional.of(token.get().getUser());
    }

    private int revokeActive(PortalUser user, OffsetDateTime now) {
        List<CalendarSubscriptionToken> active = tokenRepository.findActiveByUserId(user.getId());
        active.forEach(token -> token.revoke(now));
        // revocations must reach the database before a replacement token is inserted
        tokenRepository.flush();
        return active.size();
    }

    public record IssuedSubscription(String rawToken, OffsetDateTime issuedAt) {
    }
}
