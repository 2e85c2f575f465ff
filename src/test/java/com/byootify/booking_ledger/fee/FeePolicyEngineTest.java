package com.byootify.booking_ledger.fee;

import com.byootify.booking_ledger.ledger.CurrencyCode;
import com.byootify.booking_ledger.ledger.EntryKind;
import com.byootify.booking_ledger.ledger.LedgerAccount;
import com.byootify.booking_ledger.ledger.LedgerEntryDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fee policy tests.
 *
 * Default rates: hold 25%, service fee 10%, commission 15%, cancellation fee 15%.
 * For a 100.00 service that is a 25.00 hold, 10.00 service fee and 15.00 commission.
 */
class FeePolicyEngineTest {

    private static final long PRICE = 10_000;
    private static final CurrencyCode USD = CurrencyCode.USD;

    private final FeePolicyEngine engine = new FeePolicyEngine(new FeePolicyProperties());
    private final FeeSchedule schedule = engine.currentSchedule();

    private static long amountOf(List<LedgerEntryDraft> drafts, EntryKind kind) {
        return drafts.stream()
                .filter(d -> d.getKind() == kind)
                .mapToLong(LedgerEntryDraft::getAmount)
                .sum();
    }

    private static long deltaFor(List<LedgerEntryDraft> drafts, LedgerAccount account) {
        return drafts.stream().mapToLong(d -> d.deltaFor(account)).sum();
    }

    private static void assertBalanced(List<LedgerEntryDraft> drafts) {
        long total = 0;
        for (LedgerAccount account : LedgerAccount.values()) {
            total += deltaFor(drafts, account);
        }
        assertEquals(0, total, "Signed deltas across all accounts must sum to zero");
    }

    @Nested
    @DisplayName("Confirmation")
    class Confirmation {

        @Test
        @DisplayName("Confirmation moves the reservation hold from client to escrow")
        void confirmationCapturesHold() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD, FeeEvent.confirmed());

            assertEquals(1, drafts.size());
            LedgerEntryDraft hold = drafts.get(0);
            assertEquals(EntryKind.RESERVATION_HOLD, hold.getKind());
            assertEquals(LedgerAccount.CLIENT, hold.getFrom());
            assertEquals(LedgerAccount.ESCROW, hold.getTo());
            assertEquals(2_500, hold.getAmount());
            assertEquals(USD, hold.getCurrency());
        }
    }

    @Nested
    @DisplayName("Completion")
    class Completion {

        @Test
        @DisplayName("Completion applies the hold to commission and refunds the remainder")
        void completionWithoutTip() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD, FeeEvent.completed(0));

            assertEquals(4, drafts.size());
            assertEquals(1_000, amountOf(drafts, EntryKind.SERVICE_FEE));
            assertEquals(1_500, amountOf(drafts, EntryKind.COMMISSION));
            assertEquals(1_000, amountOf(drafts, EntryKind.REFUND));
            assertEquals(8_500, amountOf(drafts, EntryKind.SERVICE_CHARGE));
            assertEquals(0, amountOf(drafts, EntryKind.TIP));

            assertEquals(8_500, deltaFor(drafts, LedgerAccount.PROVIDER), "Provider nets price minus commission");
            assertEquals(2_500, deltaFor(drafts, LedgerAccount.PLATFORM), "Platform earns service fee plus commission");
            assertEquals(-2_500, deltaFor(drafts, LedgerAccount.ESCROW), "Escrow releases exactly the hold");
            assertBalanced(drafts);
        }

        @Test
        @DisplayName("A tip at completion goes entirely to the provider")
        void completionWithTip() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD, FeeEvent.completed(500));

            assertEquals(5, drafts.size());
            assertEquals(500, amountOf(drafts, EntryKind.TIP));
            assertEquals(9_000, deltaFor(drafts, LedgerAccount.PROVIDER));
            assertBalanced(drafts);
        }

        @Test
        @DisplayName("Zero refund is omitted when the hold equals the commission")
        void completionWithHoldEqualToCommission() {
            FeeSchedule tight = new FeeSchedule(new BigDecimal("0.15"), new BigDecimal("0.10"),
                    new BigDecimal("0.15"), new BigDecimal("0.15"));

            List<LedgerEntryDraft> drafts = engine.computeEntries(tight, PRICE, USD, FeeEvent.completed(0));

            assertEquals(0, amountOf(drafts, EntryKind.REFUND));
            assertTrue(drafts.stream().allMatch(d -> d.getAmount() > 0), "No zero-amount entries");
            assertBalanced(drafts);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Client cancelling at short notice pays the cancellation fee out of the hold")
        void clientShortNotice() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD,
                    FeeEvent.cancelled(CancellationParty.CLIENT, true));

            assertEquals(2, drafts.size());
            assertEquals(1_500, amountOf(drafts, EntryKind.CANCELLATION_FEE));
            assertEquals(1_000, amountOf(drafts, EntryKind.REFUND));
            assertEquals(1_500, deltaFor(drafts, LedgerAccount.PROVIDER));
            assertEquals(-2_500, deltaFor(drafts, LedgerAccount.ESCROW));
            assertBalanced(drafts);
        }

        @Test
        @DisplayName("Client cancelling with enough notice is refunded in full")
        void clientWithNotice() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD,
                    FeeEvent.cancelled(CancellationParty.CLIENT, false));

            assertEquals(1, drafts.size());
            assertEquals(2_500, amountOf(drafts, EntryKind.REFUND));
            assertEquals(0, deltaFor(drafts, LedgerAccount.PROVIDER));
        }

        @Test
        @DisplayName("Provider cancelling never charges the client, even at short notice")
        void providerShortNotice() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD,
                    FeeEvent.cancelled(CancellationParty.PROVIDER, true));

            assertEquals(0, amountOf(drafts, EntryKind.CANCELLATION_FEE));
            assertEquals(2_500, amountOf(drafts, EntryKind.REFUND));
        }
    }

    @Test
    @DisplayName("No-show forfeits the whole hold to the provider")
    void noShowForfeitsHold() {
        List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD, FeeEvent.noShow());

        assertEquals(1, drafts.size());
        assertEquals(EntryKind.CANCELLATION_FEE, drafts.get(0).getKind());
        assertEquals(2_500, drafts.get(0).getAmount());
        assertEquals(LedgerAccount.PROVIDER, drafts.get(0).getTo());
        assertEquals(0, amountOf(drafts, EntryKind.REFUND));
    }

    @Test
    @DisplayName("A standalone tip moves only the tip")
    void standaloneTip() {
        List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, PRICE, USD, FeeEvent.tip(700));

        assertEquals(1, drafts.size());
        assertEquals(EntryKind.TIP, drafts.get(0).getKind());
        assertEquals(700, drafts.get(0).getAmount());
        assertEquals(0, deltaFor(drafts, LedgerAccount.ESCROW));
    }

    @Test
    @DisplayName("Standalone tip must be positive")
    void zeroTipRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.computeEntries(schedule, PRICE, USD, FeeEvent.tip(0)));
    }

    @Test
    @DisplayName("Service price must be positive")
    void nonPositivePriceRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.computeEntries(schedule, 0, USD, FeeEvent.confirmed()));
    }

    @Test
    @DisplayName("Half amounts round to the even minor unit")
    void bankersRounding() {
        // 10 * 0.25 = 2.5 -> 2, 10 * 0.15 = 1.5 -> 2, 10 * 0.10 = 1.0 -> 1
        assertEquals(2, schedule.holdAmount(10));
        assertEquals(2, schedule.commission(10));
        assertEquals(1, schedule.serviceFee(10));
        // 30 * 0.25 = 7.5 -> 8
        assertEquals(8, schedule.holdAmount(30));

        List<LedgerEntryDraft> drafts = engine.computeEntries(schedule, 10, USD, FeeEvent.completed(0));
        assertEquals(0, amountOf(drafts, EntryKind.REFUND));
        assertEquals(8, amountOf(drafts, EntryKind.SERVICE_CHARGE));
        assertBalanced(drafts);
    }

    @Nested
    @DisplayName("Hold below the retained amount")
    class HoldShortfall {

        private final FeeSchedule lowHold = new FeeSchedule(new BigDecimal("0.10"), new BigDecimal("0.10"),
                new BigDecimal("0.15"), new BigDecimal("0.20"));

        @Test
        @DisplayName("Completion charges the client the commission not covered by the hold")
        void completionTopsUpCommission() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(lowHold, PRICE, USD, FeeEvent.completed(0));

            assertEquals(500, amountOf(drafts, EntryKind.HOLD_TOP_UP));
            assertEquals(1_500, amountOf(drafts, EntryKind.COMMISSION));
            assertEquals(0, amountOf(drafts, EntryKind.REFUND));
            assertEquals(8_500, amountOf(drafts, EntryKind.SERVICE_CHARGE));
            assertEquals(-1_000, deltaFor(drafts, LedgerAccount.ESCROW));
            assertEquals(-(1_000 + 500 + 8_500), deltaFor(drafts, LedgerAccount.CLIENT));
            assertBalanced(drafts);
        }

        @Test
        @DisplayName("A short-notice cancellation charges the fee not covered by the hold")
        void cancellationTopsUpFee() {
            List<LedgerEntryDraft> drafts = engine.computeEntries(lowHold, PRICE, USD,
                    FeeEvent.cancelled(CancellationParty.CLIENT, true));

            assertEquals(1_000, amountOf(drafts, EntryKind.HOLD_TOP_UP));
            assertEquals(2_000, amountOf(drafts, EntryKind.CANCELLATION_FEE));
            assertEquals(0, amountOf(drafts, EntryKind.REFUND));
            assertEquals(2_000, deltaFor(drafts, LedgerAccount.PROVIDER));
            assertEquals(-1_000, deltaFor(drafts, LedgerAccount.ESCROW));
            assertBalanced(drafts);
        }

        @Test
        @DisplayName("Configured rates may put the hold below the commission")
        void propertiesAcceptLowHold() {
            FeePolicyProperties properties = new FeePolicyProperties();
            properties.setReservationHoldRate(new BigDecimal("0.05"));

            FeeSchedule snapshot = new FeePolicyEngine(properties).currentSchedule();

            assertEquals(500, snapshot.holdAmount(PRICE));
            assertEquals(1_000, amountOf(new FeePolicyEngine(properties)
                    .computeEntries(snapshot, PRICE, USD, FeeEvent.completed(0)), EntryKind.HOLD_TOP_UP));
        }
    }
}
