package com.yieldbasket.staking.service;

import com.yieldbasket.common.exception.AccumulatorOverflowException;
import com.yieldbasket.common.model.Alert;
import com.yieldbasket.common.model.RewardDepositReceipt;
import com.yieldbasket.common.model.RewardDepositRequest;
import com.yieldbasket.common.reward.AccumulatorLedger;
import com.yieldbasket.common.reward.LedgerUpdate;
import com.yieldbasket.common.reward.StakeEntryState;
import com.yieldbasket.common.reward.StakePoolState;
import com.yieldbasket.staking.client.AlertClient;
import com.yieldbasket.staking.exception.InvalidStakingRequestException;
import com.yieldbasket.staking.exception.StakeEntryNotFoundException;
import com.yieldbasket.staking.model.RewardDepositRecord;
import com.yieldbasket.staking.model.StakeEntryRecord;
import com.yieldbasket.staking.model.StakePoolRecord;
import com.yieldbasket.staking.model.StakingReceipt;
import com.yieldbasket.staking.repository.RewardDepositRepository;
import com.yieldbasket.staking.repository.StakeEntryRepository;
import com.yieldbasket.staking.repository.StakePoolRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reward distributor over the accumulator ledger.
 *
 * <h3>Single writer</h3>
 * Every mutation (stake, unstake, claim, deposit) is queued as a command and the queue is
 * drained by one {@code concatMap}, so no two mutations ever interleave their read-modify-write
 * of the pool row. Each command computes the full next state with {@link AccumulatorLedger}
 * before touching the database and writes all rows in one transaction; a ledger exception
 * (including {@link AccumulatorOverflowException}) therefore leaves every row unchanged.
 * Reads bypass the queue.
 */
@Service
public class RewardDistributorService {

    private static final Logger log = LoggerFactory.getLogger(RewardDistributorService.class);

    static final String ALERT_SOURCE = "staking-service";
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(30);

    private record Command<T>(String name, Supplier<Mono<T>> work, Sinks.One<T> reply) {}

    private final StakePoolRepository poolRepository;
    private final StakeEntryRepository entryRepository;
    private final RewardDepositRepository depositRepository;
    private final TransactionalOperator transactionalOperator;
    private final AlertClient alertClient;
    private final Clock clock;
    private final long minDepositRaw;

    private final Sinks.Many<Command<?>> commands = Sinks.many().unicast().onBackpressureBuffer();

    public RewardDistributorService(StakePoolRepository poolRepository,
                                    StakeEntryRepository entryRepository,
                                    RewardDepositRepository depositRepository,
                                    TransactionalOperator transactionalOperator,
                                    AlertClient alertClient,
                                    Clock clock,
                                    @Value("${staking.min-deposit-raw:1000000}") long minDepositRaw) {
        this.poolRepository        = poolRepository;
        this.entryRepository       = entryRepository;
        this.depositRepository     = depositRepository;
        this.transactionalOperator = transactionalOperator;
        this.alertClient           = alertClient;
        this.clock                 = clock;
        this.minDepositRaw         = minDepositRaw;

        commands.asFlux()
            .concatMap(this::execute)
            .subscribe();
    }

    // ── mutations ───────────────────────────────────────────────────────────

    public Mono<StakingReceipt> stake(String owner, long amountRaw) {
        return submit("stake", () -> {
            requireOwner(owner);
            Instant now = clock.instant();
            return loadPool().zipWith(entryRepository.findByOwner(owner)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty()))
                .flatMap(t -> {
                    StakePoolRecord poolRecord = t.getT1();
                    StakeEntryRecord entryRecord = t.getT2().orElseGet(StakeEntryRecord::new);
                    StakeEntryState current = t.getT2().map(LedgerRecords::toState).orElse(null);
                    LedgerUpdate update = AccumulatorLedger.stake(LedgerRecords.toState(poolRecord), current,
                        owner, amountRaw, now);
                    return persist(poolRecord, update.pool(), entryRecord, update.entry())
                        .thenReturn(receipt("stake", update));
                });
        });
    }

    public Mono<StakingReceipt> unstake(String owner, long amountRaw) {
        return submit("unstake", () -> {
            Instant now = clock.instant();
            return loadPool().zipWith(loadEntry(owner))
                .flatMap(t -> {
                    LedgerUpdate update = AccumulatorLedger.unstake(LedgerRecords.toState(t.getT1()),
                        LedgerRecords.toState(t.getT2()), amountRaw, now);
                    return persist(t.getT1(), update.pool(), t.getT2(), update.entry())
                        .thenReturn(receipt("unstake", update));
                });
        });
    }

    public Mono<StakingReceipt> claim(String owner) {
        return submit("claim", () -> {
            Instant now = clock.instant();
            return loadPool().zipWith(loadEntry(owner))
                .flatMap(t -> {
                    LedgerUpdate update = AccumulatorLedger.claim(LedgerRecords.toState(t.getT1()),
                        LedgerRecords.toState(t.getT2()), now);
                    return persist(t.getT1(), update.pool(), t.getT2(), update.entry())
                        .thenReturn(receipt("claim", update));
                });
        });
    }

    /**
     * Distributes a reward over current weighted stake. Idempotent by reference: a known
     * reference returns the original receipt flagged as duplicate and changes nothing.
     */
    public Mono<RewardDepositReceipt> deposit(RewardDepositRequest request) {
        return submit("deposit", () -> {
            if (request.reference() == null || request.reference().isBlank()) {
                return Mono.error(new InvalidStakingRequestException("deposit reference is required"));
            }
            return depositRepository.findByReference(request.reference())
                .map(existing -> {
                    log.warn("[Staking] Deposit already applied, returning original receipt. reference={}",
                        request.reference());
                    return toReceipt(existing).asDuplicate();
                })
                .switchIfEmpty(Mono.defer(() -> applyDeposit(request)));
        });
    }

    private Mono<RewardDepositReceipt> applyDeposit(RewardDepositRequest request) {
        if (request.amountRaw() < minDepositRaw) {
            return Mono.error(new InvalidStakingRequestException("deposit " + request.amountRaw()
                + " is below the minimum of " + minDepositRaw));
        }
        Instant now = clock.instant();
        return loadPool().flatMap(poolRecord -> {
            StakePoolState before = LedgerRecords.toState(poolRecord);
            if (before.totalWeightedStake() <= 0) {
                return Mono.error(new InvalidStakingRequestException("no weighted stake to distribute to"));
            }
            StakePoolState after = AccumulatorLedger.depositReward(before, request.amountRaw(), now);
            long dust = after.retainedDust() - before.retainedDust();

            RewardDepositRecord record = new RewardDepositRecord();
            record.setReference(request.reference());
            record.setAmountRaw(request.amountRaw());
            record.setCreditedRaw(request.amountRaw() - dust);
            record.setDustRaw(dust);
            record.setAccumulatorAfter(after.accumulator().toString());
            record.setDepositedAt(LedgerRecords.toLocal(now));

            Mono<RewardDepositRecord> writes = poolRepository.save(LedgerRecords.apply(poolRecord, after))
                .then(depositRepository.save(record));
            return transactionalOperator.transactional(writes)
                .map(saved -> {
                    log.info("[Staking] Reward deposited. reference={} amountRaw={} creditedRaw={} dustRaw={} accumulator={}",
                        saved.getReference(), saved.getAmountRaw(), saved.getCreditedRaw(), saved.getDustRaw(),
                        saved.getAccumulatorAfter());
                    return toReceipt(saved);
                });
        });
    }

    // ── single-writer queue ─────────────────────────────────────────────────

    private <T> Mono<T> submit(String name, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Sinks.One<T> reply = Sinks.one();
            Sinks.EmitResult result;
            synchronized (commands) {
                result = commands.tryEmitNext(new Command<>(name, work, reply));
            }
            if (result.isFailure()) {
                return Mono.error(new IllegalStateException("staking command queue rejected " + name + ": " + result));
            }
            return reply.asMono();
        });
    }

    private <T> Mono<Void> execute(Command<T> command) {
        return Mono.defer(command.work())
            .timeout(COMMAND_TIMEOUT)
            .onErrorMap(IllegalArgumentException.class, e -> new InvalidStakingRequestException(e.getMessage()))
            .doOnNext(command.reply()::tryEmitValue)
            .doOnSuccess(value -> {
                if (value == null) {
                    command.reply().tryEmitEmpty();
                }
            })
            .doOnError(e -> {
                if (e instanceof AccumulatorOverflowException) {
                    log.error("[Staking] Accumulator overflow, operation aborted with no state change. op={}",
                        command.name(), e);
                    alertClient.send(Alert.critical(ALERT_SOURCE, "Reward accumulator overflow",
                        command.name() + " aborted: " + e.getMessage(), null));
                } else {
                    log.warn("[Staking] Command rejected. op={} reason={}", command.name(), e.getMessage());
                }
                command.reply().tryEmitError(e);
            })
            .onErrorResume(e -> Mono.empty())
            .then();
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private Mono<Void> persist(StakePoolRecord poolRecord, StakePoolState pool,
                               StakeEntryRecord entryRecord, StakeEntryState entry) {
        Mono<Void> writes = poolRepository.save(LedgerRecords.apply(poolRecord, pool))
            .then(entryRepository.save(LedgerRecords.apply(entryRecord, entry)))
            .doOnNext(saved -> log.info("[Staking] Entry updated. owner={} principal={} weighted={} bps={} unclaimed={}",
                saved.getOwner(), saved.getPrincipal(), saved.getWeightedStake(), saved.getMultiplierBps(),
                saved.getUnclaimedReward()))
            .then();
        return transactionalOperator.transactional(writes);
    }

    Mono<StakePoolRecord> loadPool() {
        return poolRepository.findById(StakePoolRecord.POOL_ID)
            .switchIfEmpty(Mono.error(new IllegalStateException("stake pool row " + StakePoolRecord.POOL_ID + " missing")));
    }

    Mono<StakeEntryRecord> loadEntry(String owner) {
        return entryRepository.findByOwner(owner)
            .switchIfEmpty(Mono.error(new StakeEntryNotFoundException(owner)));
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
    }

    private static StakingReceipt receipt(String operation, LedgerUpdate update) {
        StakeEntryState e = update.entry();
        return new StakingReceipt(e.owner(), operation, e.principal(), e.weightedStake(), e.multiplierBps(),
            update.rewardPaid(), update.principalReturned(), e.unclaimedReward());
    }

    private static RewardDepositReceipt toReceipt(RewardDepositRecord record) {
        return new RewardDepositReceipt(record.getReference(), record.getAmountRaw(), record.getCreditedRaw(),
            record.getDustRaw(), record.getAccumulatorAfter(), LedgerRecords.toInstant(record.getDepositedAt()), false);
    }
}
