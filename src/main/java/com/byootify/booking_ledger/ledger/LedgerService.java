package com.byootify.booking_ledger.ledger;

import com.byootify.booking_ledger.exception.InvariantViolationException;
import com.byootify.booking_ledger.exception.LedgerWriteException;
import com.byootify.booking_ledger.observability.BookingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only ledger of booking money movements.
 *
 * This service enforces the core invariants:
 * 1. Entries are immutable once written (a database trigger rejects UPDATE and DELETE)
 * 2. Each entry carries a unique idempotency key; a replayed batch writes nothing
 * 3. A batch is written all-or-nothing
 * 4. Provider balances are derived from entries, never stored
 *
 * Uses JDBC directly so the SQL behind balances and locks stays visible.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String ENTRY_COLUMNS =
        "id, appointment_id, provider_id, client_id, payout_id, kind, from_account, to_account, " +
        "amount_minor, currency, trigger_event_id, effective_at, created_at, idempotency_key, sequence_number";

    private static final String PROVIDER_DELTA =
        "CASE WHEN to_account = 'PROVIDER' THEN amount_minor " +
        "WHEN from_account = 'PROVIDER' THEN -amount_minor ELSE 0 END";

    private final JdbcTemplate jdbcTemplate;
    private final BookingMetrics bookingMetrics;

    public LedgerService(JdbcTemplate jdbcTemplate, BookingMetrics bookingMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.bookingMetrics = bookingMetrics;
    }

    /**
     * Records a batch of entries for one trigger event.
     *
     * Serialized per subject (appointment or payout) by a transaction-scoped advisory lock.
     * If any key of the batch already exists nothing is written and the prior entries are
     * returned with {@code applied = false}.
     *
     * @throws InvariantViolationException if an amount is not positive or a singular kind repeats
     * @throws LedgerWriteException on infrastructure failure (retryable)
     */
    @Transactional
    public AppendResult append(LedgerPosting posting) {
        if (posting.getDrafts().isEmpty()) {
            return new AppendResult(false, List.of());
        }
        for (LedgerEntryDraft draft : posting.getDrafts()) {
            if (draft.getAmount() <= 0) {
                throw new InvariantViolationException(String.format(
                    "Ledger entry %s for %s has non-positive amount %d",
                    draft.getKind(), posting.subjectId(), draft.getAmount()));
            }
        }

        try {
            lockSubject(posting.subjectId());

            List<String> keys = posting.getDrafts().stream()
                .map(draft -> IdempotencyKeys.forEntry(posting.subjectId(), draft.getKind(), posting.getTriggerEventId()))
                .toList();

            List<LedgerEntry> prior = findByIdempotencyKeys(keys);
            if (!prior.isEmpty()) {
                log.info("Ledger batch already recorded: subject={}, trigger={}, entries={}",
                        posting.subjectId(), posting.getTriggerEventId(), prior.size());
                return new AppendResult(false, prior);
            }

            Instant effectiveAt = posting.getEffectiveAt().truncatedTo(ChronoUnit.MICROS);
            List<LedgerEntry> written = new ArrayList<>();
            for (int i = 0; i < posting.getDrafts().size(); i++) {
                written.add(insert(posting, posting.getDrafts().get(i), keys.get(i), effectiveAt));
            }

            written.forEach(entry -> bookingMetrics.recordLedgerEntry(entry.getKind().name(), entry.getCurrency().name()));
            log.debug("Ledger batch recorded: subject={}, trigger={}, entries={}",
                    posting.subjectId(), posting.getTriggerEventId(), written.size());
            return new AppendResult(true, List.copyOf(written));

        } catch (DuplicateKeyException e) {
            throw new InvariantViolationException(
                "Singular ledger entry already recorded for " + posting.subjectId() + ": " + e.getMostSpecificCause().getMessage());
        } catch (DataAccessException e) {
            throw new LedgerWriteException("Failed to append ledger entries for " + posting.subjectId(), e);
        }
    }

    /**
     * Balance owed to the provider in {@code currency} from entries effective up to {@code upto}.
     * Funds swept by a payout are excluded until that payout is reversed.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public long balanceFor(UUID providerId, CurrencyCode currency, Instant upto) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(" + PROVIDER_DELTA + "), 0) FROM ledger_entries " +
            "WHERE provider_id = ? AND currency = ? AND effective_at <= ?",
            Long.class,
            providerId,
            currency.name(),
            toTimestamp(upto)
        );
        return balance != null ? balance : 0L;
    }

    /**
     * Balances in every currency the provider has entries in.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<ProviderBalance> balancesFor(UUID providerId, Instant upto) {
        return jdbcTemplate.query(
            "SELECT provider_id, currency, COALESCE(SUM(" + PROVIDER_DELTA + "), 0) AS balance " +
            "FROM ledger_entries WHERE provider_id = ? AND effective_at <= ? " +
            "GROUP BY provider_id, currency ORDER BY currency",
            balanceRowMapper(),
            providerId,
            toTimestamp(upto)
        );
    }

    /**
     * Provider balances over entries effective strictly before {@code cutoff} that reach
     * {@code minimum}. Input to the payout sweep.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<ProviderBalance> eligibleBalances(Instant cutoff, long minimum) {
        return jdbcTemplate.query(
            "SELECT provider_id, currency, SUM(" + PROVIDER_DELTA + ") AS balance " +
            "FROM ledger_entries WHERE effective_at < ? " +
            "GROUP BY provider_id, currency " +
            "HAVING SUM(" + PROVIDER_DELTA + ") >= ? " +
            "ORDER BY provider_id, currency",
            balanceRowMapper(),
            toTimestamp(cutoff),
            Math.max(1L, minimum)
        );
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesFor(UUID appointmentId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE appointment_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            appointmentId
        );
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForPayout(UUID payoutId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE payout_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            payoutId
        );
    }

    private void lockSubject(UUID subjectId) {
        long lockKey = subjectId.getMostSignificantBits() ^ subjectId.getLeastSignificantBits();
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", (ResultSetExtractor<Void>) rs -> null, lockKey);
    }

    private List<LedgerEntry> findByIdempotencyKeys(List<String> keys) {
        String placeholders = String.join(", ", keys.stream().map(k -> "?").toList());
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE idempotency_key IN (" + placeholders + ") " +
            "ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            keys.toArray()
        );
    }

    private LedgerEntry insert(LedgerPosting posting, LedgerEntryDraft draft, String key, Instant effectiveAt) {
        UUID id = UUID.randomUUID();
        return jdbcTemplate.queryForObject(
            "INSERT INTO ledger_entries (id, appointment_id, provider_id, client_id, payout_id, kind, " +
            "from_account, to_account, amount_minor, currency, trigger_event_id, effective_at, created_at, idempotency_key) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, ?) RETURNING " + ENTRY_COLUMNS,
            ledgerEntryRowMapper(),
            id,
            posting.getAppointmentId(),
            posting.getProviderId(),
            posting.getClientId(),
            posting.getPayoutId(),
            draft.getKind().name(),
            draft.getFrom().name(),
            draft.getTo().name(),
            draft.getAmount(),
            draft.getCurrency().name(),
            posting.getTriggerEventId(),
            toTimestamp(effectiveAt),
            key
        );
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static UUID uuidOrNull(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private RowMapper<ProviderBalance> balanceRowMapper() {
        return (rs, rowNum) -> new ProviderBalance(
            rs.getObject("provider_id", UUID.class),
            CurrencyCode.valueOf(rs.getString("currency")),
            rs.getLong("balance")
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            uuidOrNull(rs, "appointment_id"),
            rs.getObject("provider_id", UUID.class),
            uuidOrNull(rs, "client_id"),
            uuidOrNull(rs, "payout_id"),
            EntryKind.valueOf(rs.getString("kind")),
            LedgerAccount.valueOf(rs.getString("from_account")),
            LedgerAccount.valueOf(rs.getString("to_account")),
            rs.getLong("amount_minor"),
            CurrencyCode.valueOf(rs.getString("currency")),
            rs.getString("trigger_event_id"),
            instant(rs, "effective_at"),
            instant(rs, "created_at"),
            rs.getString("idempotency_key"),
            rs.getLong("sequence_number")
        );
    }
}
