package com.byootify.booking_ledger.payout;

import com.byootify.booking_ledger.exception.ProcessorUnavailableException;
import com.byootify.booking_ledger.exception.TransferRejectedException;
import com.byootify.booking_ledger.ledger.AppendResult;
import com.byootify.booking_ledger.ledger.EntryKind;
import com.byootify.booking_ledger.ledger.IdempotencyKeys;
import com.byootify.booking_ledger.ledger.LedgerAccount;
import com.byootify.booking_ledger.ledger.LedgerEntryDraft;
import com.byootify.booking_ledger.ledger.LedgerPosting;
import com.byootify.booking_ledger.ledger.LedgerService;
import com.byootify.booking_ledger.ledger.ProviderBalance;
import com.byootify.booking_ledger.observability.BookingMetrics;
import com.byootify.booking_ledger.observability.CorrelationContext;
import com.byootify.booking_ledger.outbox.OutboxService;
import com.byootify.booking_ledger.payout.event.PayoutIssuedEvent;
import com.byootify.booking_ledger.processor.PaymentProcessorClient;
import com.byootify.booking_ledger.processor.TransferStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sweeps eligible provider balances into payouts and reconciles them with the processor.
 *
 * Key principles:
 * - A payout row and its PAYOUT entry commit together, before any transfer is attempted
 * - One payout per (provider, currency, cutoff): the idempotency key makes a re-run a no-op
 * - Transfers are started outside any transaction and retried with the same key
 * - A failed or rejected transfer is offset by PAYOUT_REVERSAL, never by deleting the entry
 * - A provider's own schedule decides on which cycle dates, and from which balance, they are paid
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutService {

    private final LedgerService ledgerService;
    private final PayoutRepository payoutRepository;
    private final PayoutScheduleRepository scheduleRepository;
    private final PaymentProcessorClient paymentProcessor;
    private final OutboxService outboxService;
    private final PayoutProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final BookingMetrics bookingMetrics;
    private final Clock clock;

    /**
     * Start of the first day whose entries are still held back.
     */
    public Instant currentCutoff() {
        LocalDate today = LocalDate.now(clock.withZone(properties.getZone()));
        return today.minusDays(properties.getHoldDays() - 1L).atStartOfDay(properties.getZone()).toInstant();
    }

    /**
     * Creates a payout for every provider/currency whose balance over entries effective before
     * {@code cutoff} reaches the minimum, then starts the transfers. Providers with a payout
     * schedule are only paid when the cutoff date is one of their payout days and the balance
     * reaches their own minimum.
     *
     * @return payouts created by this run
     */
    public List<Payout> runCycle(Instant cutoff) {
        List<ProviderBalance> balances = ledgerService.eligibleBalances(cutoff, properties.getMinimumAmount());
        log.info("Payout cycle started: cutoff={}, eligibleBalances={}", cutoff, balances.size());

        LocalDate cycleDate = cutoff.atZone(properties.getZone()).toLocalDate();
        Map<UUID, PayoutSchedule> schedules = schedulesFor(balances);

        List<Payout> created = new ArrayList<>();
        for (ProviderBalance balance : balances) {
            PayoutSchedule schedule = schedules.get(balance.getProviderId());
            if (schedule != null && !(schedule.isDue(cycleDate) && schedule.accepts(balance.getAmount()))) {
                log.debug("Payout deferred by schedule: providerId={}, frequency={}, balance={}, minimum={}",
                        balance.getProviderId(), schedule.getFrequency(), balance.getAmount(), schedule.getMinimumAmount());
                continue;
            }
            Optional<Payout> payout = transactionTemplate.execute(tx -> createPayout(balance, cutoff));
            if (payout != null && payout.isPresent()) {
                created.add(startTransfer(payout.get()));
            }
        }

        log.info("Payout cycle finished: cutoff={}, created={}", cutoff, created.size());
        return created;
    }

    /**
     * Drives every PENDING payout forward: starts missing transfers and settles or reverses the
     * ones the processor has finished.
     *
     * @return number of payouts that reached a terminal status
     */
    public int reconcile() {
        int finished = 0;
        for (PayoutEntity entity : payoutRepository.findByStatusOrderByCreatedAtAsc(PayoutStatus.PENDING)) {
            Payout payout = entity.toDomain();
            try {
                if (payout.getTransferId() == null) {
                    payout = startTransfer(payout);
                    if (payout.getStatus().isTerminal()) {
                        finished++;
                    }
                    continue;
                }
                TransferStatus status = paymentProcessor.transferStatus(payout.getTransferId());
                if (status == TransferStatus.SETTLED) {
                    settle(payout.getId());
                    finished++;
                } else if (status == TransferStatus.FAILED) {
                    reverse(payout.getId(), "Transfer " + payout.getTransferId() + " failed");
                    finished++;
                }
            } catch (ProcessorUnavailableException e) {
                log.warn("Processor unavailable while reconciling payout {}: {}", payout.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Reconciliation failed for payout {}, continuing with the rest", payout.getId(), e);
            }
        }
        return finished;
    }

    public Optional<Payout> onTransferSettled(String transferId) {
        return transactionTemplate.execute(tx ->
            payoutRepository.findByTransferId(transferId).map(entity -> doSettle(entity.getId())));
    }

    public Optional<Payout> onTransferFailed(String transferId, String reason) {
        return transactionTemplate.execute(tx ->
            payoutRepository.findByTransferId(transferId).map(entity -> doReverse(entity.getId(), reason)));
    }

    /**
     * Marks a PENDING payout settled and publishes PayoutIssued. Terminal payouts are returned as-is.
     */
    public Payout settle(UUID payoutId) {
        return transactionTemplate.execute(tx -> doSettle(payoutId));
    }

    /**
     * Offsets the payout's PAYOUT entry at the same cutoff so the funds become eligible again.
     * A settled payout cannot be reversed.
     */
    public Payout reverse(UUID payoutId, String reason) {
        return transactionTemplate.execute(tx -> doReverse(payoutId, reason));
    }

    private Payout doSettle(UUID payoutId) {
        PayoutEntity entity = lockPayout(payoutId);
        if (entity.getStatus().isTerminal()) {
            log.info("Payout {} already {}, ignoring settlement", payoutId, entity.getStatus());
            return entity.toDomain();
        }

        entity.markSettled();
        Payout payout = entity.toDomain();
        outboxService.saveEvent(OutboxService.PAYOUT_AGGREGATE, payoutId,
                PayoutIssuedEvent.EVENT_TYPE, PayoutIssuedEvent.from(payout, clock.instant()));

        bookingMetrics.recordPayout("settled", payout.getCurrency().name());
        log.info("Payout settled: payoutId={}, providerId={}, amount={} {}",
                payoutId, payout.getProviderId(), payout.getAmount(), payout.getCurrency());
        return payout;
    }

    private Payout doReverse(UUID payoutId, String reason) {
        PayoutEntity entity = lockPayout(payoutId);
        if (entity.getStatus() == PayoutStatus.REVERSED) {
            return entity.toDomain();
        }
        if (entity.getStatus() == PayoutStatus.SETTLED) {
            log.warn("Ignoring reversal of settled payout {}: {}", payoutId, reason);
            return entity.toDomain();
        }

        ledgerService.append(LedgerPosting.forPayout(payoutId, entity.getProviderId(), "payout-reversal:" + payoutId,
            entity.getCutoff(), List.of(LedgerEntryDraft.of(EntryKind.PAYOUT_REVERSAL,
                LedgerAccount.PROVIDER_BANK, LedgerAccount.PROVIDER, entity.getAmount(), entity.getCurrency()))));
        entity.markReversed(reason);

        bookingMetrics.recordPayout("reversed", entity.getCurrency().name());
        log.warn("Payout reversed: payoutId={}, providerId={}, amount={} {}, reason={}",
                payoutId, entity.getProviderId(), entity.getAmount(), entity.getCurrency(), reason);
        return entity.toDomain();
    }

    /**
     * Creates or replaces the provider's payout schedule.
     */
    @Transactional
    public PayoutSchedule updateSchedule(UUID providerId, PayoutFrequency frequency, long minimumAmount,
                                         int payoutDay, boolean active) {
        PayoutScheduleEntity entity = scheduleRepository.findById(providerId)
            .map(existing -> {
                existing.update(frequency, minimumAmount, payoutDay, active);
                return existing;
            })
            .orElseGet(() -> scheduleRepository.save(
                PayoutScheduleEntity.create(providerId, frequency, minimumAmount, payoutDay, active)));
        scheduleRepository.flush();
        log.info("Payout schedule updated: providerId={}, frequency={}, minimum={}, payoutDay={}, active={}",
                providerId, frequency, minimumAmount, payoutDay, active);
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<PayoutSchedule> scheduleFor(UUID providerId) {
        return scheduleRepository.findById(providerId).map(PayoutScheduleEntity::toDomain);
    }

    private Map<UUID, PayoutSchedule> schedulesFor(List<ProviderBalance> balances) {
        Set<UUID> providerIds = balances.stream().map(ProviderBalance::getProviderId).collect(Collectors.toSet());
        if (providerIds.isEmpty()) {
            return Map.of();
        }
        return scheduleRepository.findAllById(providerIds)
            .stream()
            .collect(Collectors.toMap(PayoutScheduleEntity::getProviderId, PayoutScheduleEntity::toDomain));
    }

    @Transactional(readOnly = true)
    public Optional<Payout> findById(UUID payoutId) {
        return payoutRepository.findById(payoutId).map(PayoutEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Payout> payoutsFor(UUID providerId) {
        return payoutRepository.findByProviderIdOrderByCutoffDesc(providerId)
            .stream()
            .map(PayoutEntity::toDomain)
            .toList();
    }

    static String payoutKey(UUID providerId, String currency, Instant cutoff) {
        return IdempotencyKeys.sha256(providerId + "|" + currency + "|" + cutoff);
    }

    private Optional<Payout> createPayout(ProviderBalance balance, Instant cutoff) {
        lockProvider(balance.getProviderId());

        String key = payoutKey(balance.getProviderId(), balance.getCurrency().name(), cutoff);
        if (payoutRepository.existsByIdempotencyKey(key)) {
            log.debug("Payout already created: providerId={}, currency={}, cutoff={}",
                    balance.getProviderId(), balance.getCurrency(), cutoff);
            return Optional.empty();
        }

        UUID payoutId = UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
        PayoutEntity entity = payoutRepository.save(PayoutEntity.pending(payoutId, balance.getProviderId(),
                balance.getAmount(), balance.getCurrency(), cutoff, key));

        AppendResult result = ledgerService.append(LedgerPosting.forPayout(payoutId, balance.getProviderId(),
            "payout-cycle:" + cutoff, cutoff, List.of(LedgerEntryDraft.of(EntryKind.PAYOUT,
                LedgerAccount.PROVIDER, LedgerAccount.PROVIDER_BANK, balance.getAmount(), balance.getCurrency()))));

        bookingMetrics.recordPayout("created", balance.getCurrency().name());
        log.info("Payout created: payoutId={}, providerId={}, amount={} {}, cutoff={}, entryApplied={}",
                payoutId, balance.getProviderId(), balance.getAmount(), balance.getCurrency(), cutoff, result.isApplied());
        return Optional.of(entity.toDomain());
    }

    private Payout startTransfer(Payout payout) {
        MDC.put(CorrelationContext.PAYOUT_ID_MDC_KEY, payout.getId().toString());
        try {
            String transferId = paymentProcessor.transfer(payout.getProviderId().toString(), payout.getAmount(),
                    payout.getCurrency(), "payout:" + payout.getId());
            return transactionTemplate.execute(tx -> {
                PayoutEntity entity = lockPayout(payout.getId());
                entity.recordTransfer(transferId);
                log.info("Payout transfer started: payoutId={}, transferId={}", payout.getId(), transferId);
                return entity.toDomain();
            });

        } catch (TransferRejectedException e) {
            bookingMetrics.recordPayout("transfer_failed", payout.getCurrency().name());
            return reverse(payout.getId(), e.getMessage());

        } catch (ProcessorUnavailableException e) {
            log.warn("Payout transfer deferred to reconciliation: payoutId={}, error={}", payout.getId(), e.getMessage());
            return transactionTemplate.execute(tx -> {
                PayoutEntity entity = lockPayout(payout.getId());
                entity.recordAttemptFailed(e.getMessage());
                return entity.toDomain();
            });
        } finally {
            MDC.remove(CorrelationContext.PAYOUT_ID_MDC_KEY);
        }
    }

    private PayoutEntity lockPayout(UUID payoutId) {
        return payoutRepository.findForUpdate(payoutId)
            .orElseThrow(() -> new IllegalArgumentException("Payout not found: " + payoutId));
    }

    private void lockProvider(UUID providerId) {
        long lockKey = providerId.getMostSignificantBits() ^ providerId.getLeastSignificantBits();
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", (ResultSetExtractor<Void>) rs -> null, lockKey);
    }
}
