package com.flagship.creator_ledger.ledger.jdbc;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.creator.CreatorProfile;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.subscription.Subscription;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL ledger tables accessed through JdbcTemplate.
 *
 * Amounts are stored as unconstrained NUMERIC so they are never narrowed.
 * Every statement joins the transaction opened by {@link JdbcLedgerRuntime}.
 */
public class JdbcLedgerStore implements LedgerStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    @Override
    public Optional<CreatorProfile> findProfile(Address creator) {
        List<CreatorProfile> rows = jdbcTemplate.query(
            "SELECT address, profile_data, registered_at FROM creator_profiles WHERE address = ?",
            (rs, rowNum) -> new CreatorProfile(
                Address.of(rs.getString("address")),
                rs.getString("profile_data"),
                rs.getTimestamp("registered_at").toInstant()
            ),
            creator.getValue()
        );
        return rows.stream().findFirst();
    }

    @Override
    public void saveProfile(CreatorProfile profile) {
        // Profiles are write-once; a second insert for the same address is a bug upstream
        jdbcTemplate.update(
            "INSERT INTO creator_profiles (address, profile_data, registered_at) VALUES (?, ?, ?)",
            profile.getCreator().getValue(),
            profile.getProfileData(),
            Timestamp.from(profile.getRegisteredAt())
        );
    }

    @Override
    public Optional<CreatorStats> findStats(Address creator) {
        List<CreatorStats> rows = jdbcTemplate.query(
            "SELECT address, total_subscribers, total_content, total_tips_received, subscription_fee, engagement_score " +
            "FROM creator_stats WHERE address = ?",
            creatorStatsRowMapper(),
            creator.getValue()
        );
        return rows.stream().findFirst();
    }

    @Override
    public void saveStats(CreatorStats stats) {
        jdbcTemplate.update(
            "INSERT INTO creator_stats (address, total_subscribers, total_content, total_tips_received, " +
            "subscription_fee, engagement_score) VALUES (?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (address) DO UPDATE SET total_subscribers = EXCLUDED.total_subscribers, " +
            "total_content = EXCLUDED.total_content, total_tips_received = EXCLUDED.total_tips_received, " +
            "subscription_fee = EXCLUDED.subscription_fee, engagement_score = EXCLUDED.engagement_score",
            stats.getCreator().getValue(),
            stats.getTotalSubscribers(),
            stats.getTotalContent(),
            new BigDecimal(stats.getTotalTipsReceived()),
            new BigDecimal(stats.getSubscriptionFee()),
            stats.getEngagementScore()
        );
    }

    @Override
    public Optional<Content> findContent(ContentId id) {
        List<Content> rows = jdbcTemplate.query(
            "SELECT content_id, creator, content_hash, created_at, is_premium, tip_enabled, total_tips, total_engagements " +
            "FROM contents WHERE content_id = ?",
            contentRowMapper(),
            id.getValue()
        );
        return rows.stream().findFirst();
    }

    @Override
    public void saveContent(Content content) {
        // Only the counters may change once a row exists
        jdbcTemplate.update(
            "INSERT INTO contents (content_id, creator, content_hash, created_at, is_premium, tip_enabled, " +
            "total_tips, total_engagements) VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (content_id) DO UPDATE SET total_tips = EXCLUDED.total_tips, " +
            "total_engagements = EXCLUDED.total_engagements",
            content.getId().getValue(),
            content.getCreator().getValue(),
            content.getContentHash(),
            Timestamp.from(content.getTimestamp()),
            content.isPremium(),
            content.isTipEnabled(),
            new BigDecimal(content.getTotalTips()),
            content.getTotalEngagements()
        );
    }

    @Override
    public ContentId nextContentId() {
        Long next = jdbcTemplate.queryForObject(
            "SELECT next_content_id FROM ledger_state WHERE id = 1", Long.class);
        if (next == null) {
            throw new IllegalStateException("ledger_state row is missing");
        }
        return ContentId.of(next);
    }

    @Override
    public void saveNextContentId(ContentId next) {
        jdbcTemplate.update("UPDATE ledger_state SET next_content_id = ? WHERE id = 1", next.getValue());
    }

    @Override
    public Optional<Subscription> findSubscription(Address subscriber, Address creator) {
        List<Subscription> rows = jdbcTemplate.query(
            "SELECT subscriber, creator, active, expires_at FROM subscriptions WHERE subscriber = ? AND creator = ?",
            (rs, rowNum) -> {
                Timestamp expiresAt = rs.getTimestamp("expires_at");
                return new Subscription(
                    Address.of(rs.getString("subscriber")),
                    Address.of(rs.getString("creator")),
                    rs.getBoolean("active"),
                    expiresAt != null ? expiresAt.toInstant() : null
                );
            },
            subscriber.getValue(),
            creator.getValue()
        );
        return rows.stream().findFirst();
    }

    @Override
    public void saveSubscription(Subscription subscription) {
        jdbcTemplate.update(
            "INSERT INTO subscriptions (subscriber, creator, active, expires_at) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT (subscriber, creator) DO UPDATE SET active = EXCLUDED.active, expires_at = EXCLUDED.expires_at",
            subscription.getSubscriber().getValue(),
            subscription.getCreator().getValue(),
            subscription.isActive(),
            subscription.getExpiry() != null ? Timestamp.from(subscription.getExpiry()) : null
        );
    }

    @Override
    public boolean hasEngaged(ContentId contentId, Address user) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM engagement_marks WHERE content_id = ? AND address = ?",
            Integer.class,
            contentId.getValue(),
            user.getValue()
        );
        return count != null && count > 0;
    }

    @Override
    public void markEngaged(ContentId contentId, Address user) {
        // Primary key (content_id, address) rejects a second mark
        jdbcTemplate.update(
            "INSERT INTO engagement_marks (content_id, address) VALUES (?, ?)",
            contentId.getValue(),
            user.getValue()
        );
    }

    @Override
    public long userEngagementScore(Address user) {
        List<Long> rows = jdbcTemplate.queryForList(
            "SELECT score FROM user_engagement_scores WHERE address = ?", Long.class, user.getValue());
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    @Override
    public void saveUserEngagementScore(Address user, long score) {
        jdbcTemplate.update(
            "INSERT INTO user_engagement_scores (address, score) VALUES (?, ?) " +
            "ON CONFLICT (address) DO UPDATE SET score = EXCLUDED.score",
            user.getValue(),
            score
        );
    }

    private RowMapper<CreatorStats> creatorStatsRowMapper() {
        return (rs, rowNum) -> new CreatorStats(
            Address.of(rs.getString("address")),
            rs.getLong("total_subscribers"),
            rs.getLong("total_content"),
            toBigInteger(rs.getBigDecimal("total_tips_received")),
            toBigInteger(rs.getBigDecimal("subscription_fee")),
            rs.getLong("engagement_score")
        );
    }

    private RowMapper<Content> contentRowMapper() {
        return (rs, rowNum) -> new Content(
            ContentId.of(rs.getLong("content_id")),
            Address.of(rs.getString("creator")),
            rs.getString("content_hash"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getBoolean("is_premium"),
            rs.getBoolean("tip_enabled"),
            toBigInteger(rs.getBigDecimal("total_tips")),
            rs.getLong("total_engagements")
        );
    }

    private static BigInteger toBigInteger(BigDecimal value) {
        return value != null ? value.toBigIntegerExact() : BigInteger.ZERO;
    }
}
