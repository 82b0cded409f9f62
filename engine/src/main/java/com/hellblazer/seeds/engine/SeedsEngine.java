/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Seeds.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.seeds.engine;

import com.hellblazer.seeds.eligibility.Addresses;
import com.hellblazer.seeds.eligibility.EligibilityOracle;
import com.hellblazer.seeds.eligibility.MerkleHash;
import com.hellblazer.seeds.engine.config.ConfigurationLedger;
import com.hellblazer.seeds.engine.config.EngineConfig;
import com.hellblazer.seeds.engine.config.ScoringParameters;
import com.hellblazer.seeds.engine.event.SeedsEvent;
import com.hellblazer.seeds.engine.event.SeedsEventListener;
import com.hellblazer.seeds.engine.event.WinnerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

/**
 * The Seeds curation engine: seeds are submitted, electors holding reference units cast dampened, rate-limited
 * blessings and commandments, and each elapsed round resolves to at most one winning seed.
 * <p>
 * The engine is a single-writer state machine. Every mutating operation takes the write lock, validates completely,
 * settles payment and only then mutates, so a thrown {@link SeedsException} always leaves state unchanged. Queries take
 * the read lock and never block each other. Listeners are notified synchronously after the mutation, still under the
 * write lock.
 * <p>
 * Time is read from the injected clock in epoch seconds; round resolution is driven by explicit {@link #advance()}
 * calls, never by timers.
 *
 * @author hal.hildebrand
 */
public class SeedsEngine {
    public static final String VERSION       = "1.0.0";
    public static final int    MAX_PAGE_SIZE = 1_000;

    private static final Logger log = LoggerFactory.getLogger(SeedsEngine.class);

    private final ReadWriteLock                  lock      = new ReentrantReadWriteLock();
    private final List<SeedsEventListener>       listeners = new CopyOnWriteArrayList<>();
    private final EngineConfig                   engineConfig;
    private final EligibilityOracle              oracle;
    private final PaymentGateway                 payments;
    private final LongSupplier                   clock;
    private final ConfigurationLedger            config;
    private final SeedRegistry                   registry;
    private final ElectorLedger                  electors;
    private final RoundStateMachine              rounds;
    private final ScoringEngine                  scoring;
    private final ResolutionPolicy               resolution;
    private final AccessControl                  access;
    private       MerkleHash                     currentRoot;
    private       MerkleHash                     previousRoot;
    private       long                           rootUpdatedAt;
    private       boolean                        paused;
    private       String                         pauseReason = "";

    /**
     * Engine with an in-memory payment ledger and digest entropy.
     */
    public SeedsEngine(EngineConfig engineConfig, String admin, EligibilityOracle oracle, LongSupplier clock) {
        this(engineConfig, admin, oracle, new InMemoryPaymentGateway(),
             new DigestEntropySource(clock, Objects.hashCode(admin)), clock);
    }

    /**
     * @param admin granted {@link Role#ADMIN} and {@link Role#CREATOR}
     * @param clock epoch seconds; round 1 opens at its current reading
     */
    public SeedsEngine(EngineConfig engineConfig, String admin, EligibilityOracle oracle, PaymentGateway payments,
                       EntropySource entropy, LongSupplier clock) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.payments = Objects.requireNonNull(payments, "payments");
        this.clock = Objects.requireNonNull(clock, "clock");
        var adminAddress = Addresses.normalize(Objects.requireNonNull(admin, "admin"));
        var parameters = engineConfig.getParameters();

        this.config = new ConfigurationLedger(parameters, engineConfig.getTreasury().orElse(null));
        this.registry = new SeedRegistry(engineConfig.getMaxTotalSeeds(), engineConfig.getMaxSeedsPerRound());
        this.electors = new ElectorLedger();
        this.rounds = new RoundStateMachine(clock.getAsLong(), parameters.periodDuration());
        this.scoring = new ScoringEngine(registry, electors, rounds, config, clock);
        this.resolution = new ResolutionPolicy(Objects.requireNonNull(entropy, "entropy"));
        this.access = new AccessControl();
        access.grant(Role.ADMIN, adminAddress);
        access.grant(Role.CREATOR, adminAddress);
        log.info("Seeds engine {} started: admin {}, round 1 open until {}, {}", VERSION, adminAddress,
                 rounds.periodEnd(), parameters);
    }

    public void addEventListener(SeedsEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeEventListener(SeedsEventListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------- round lifecycle

    /**
     * Resolve the current round once its period has elapsed, apply pending configuration and open the next round.
     * <p>
     * Deadlock handling follows the pending deadlock strategy, so an operator can break a reverted deadlock by staging
     * a different strategy and calling again.
     *
     * @throws LifecycleException with {@link ErrorCode#PERIOD_NOT_ENDED} before the period ends, or
     *                            {@link ErrorCode#NO_VALID_WINNER} when a deadlock is reverted
     */
    public AdvanceResult advance() {
        lock.writeLock().lock();
        try {
            requireNotPaused();
            var now = clock.getAsLong();
            rounds.requireResolvable(now);
            var roundNumber = rounds.number();
            var parameters = config.current();
            var deadlock = config.pending().deadlockStrategy();

            var candidates = candidates();
            var previousWinners = new ArrayList<Candidate>();
            if (deadlock == DeadlockStrategy.ALLOW_REWINS) {
                for (var seed : registry.previousWinners()) {
                    previousWinners.add(new Candidate(seed.id, seed.blessingScore, seed.createdAt));
                }
            }
            var outcome = resolution.resolve(roundNumber, candidates, previousWinners,
                                             parameters.tieBreakingStrategy(), deadlock);

            // decided: everything below mutates
            var events = new ArrayList<SeedsEvent>();
            WinnerRecord winnerRecord = null;
            long winnerId = 0;
            boolean rewin = false;
            if (outcome instanceof Resolution.Winner winner) {
                var seed = registry.get(winner.seedId());
                registry.markWinner(seed, roundNumber);
                winnerId = seed.id;
                rewin = winner.rewin();
                winnerRecord = new WinnerRecord(roundNumber, seed.id, seed.contentHandle, seed.blessingScore);
                events.add(new SeedsEvent.WinnerSelected(now, roundNumber, winnerRecord, rewin));
                if (parameters.scoreResetOnRoundEnd()) {
                    int reset = 0;
                    for (var candidate : candidates) {
                        var loser = registry.get(candidate.seedId());
                        if (loser.id != seed.id && loser.blessingScore != 0) {
                            loser.blessingScore = 0;
                            reset++;
                        }
                    }
                    events.add(new SeedsEvent.ScoresReset(now, roundNumber, reset));
                }
            } else {
                var carried = registry.carryOver(roundNumber, roundNumber + 1);
                events.add(new SeedsEvent.RoundSkipped(now, roundNumber, deadlock, carried));
            }

            var applied = config.applyPending();
            var next = config.current();
            var resolved = rounds.close(now, winnerId, rewin, next.periodDuration());
            registry.reconcile(next.roundMode(), parameters.roundMode(), rounds.number());
            if (applied) {
                log.info("Applied pending configuration entering round {}: {}", rounds.number(), next);
                events.add(new SeedsEvent.ConfigurationApplied(now, rounds.number(), parameters, next));
            }
            events.add(new SeedsEvent.BlessingPeriodStarted(now, rounds.number(), rounds.periodEnd()));
            if (winnerRecord != null) {
                log.info("Round {} winner: seed {} with score {}{}", roundNumber, winnerId,
                         winnerRecord.finalScore(), rewin ? " (rewin)" : "");
            }
            events.forEach(this::fire);
            return winnerRecord == null ? AdvanceResult.skipped(resolved, applied, rounds.current())
                                        : AdvanceResult.won(resolved, winnerRecord, applied, rounds.current());
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- seeds

    /**
     * @return the new seed id
     */
    public long submitSeed(String creator, String contentHandle) {
        ContentHandles.require(contentHandle);
        var address = address(creator);
        lock.writeLock().lock();
        try {
            requireNotPaused();
            access.requireRole(Role.CREATOR, address);
            var now = clock.getAsLong();
            rounds.requireOpen(now);
            registry.validateSubmit(rounds.number());
            var seed = registry.submit(address, contentHandle, now, rounds.number());
            log.info("Seed {} submitted by {} in round {}", seed.id, address, seed.submittedInRound);
            fire(new SeedsEvent.SeedSubmitted(now, rounds.number(), seed.id, address, contentHandle));
            return seed.id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void retractSeed(long seedId, String caller) {
        var address = address(caller);
        lock.writeLock().lock();
        try {
            requireNotPaused();
            var seed = registry.validateRetract(seedId, address);
            registry.retract(seed);
            log.info("Seed {} retracted by {}", seedId, address);
            fire(new SeedsEvent.SeedRetracted(clock.getAsLong(), rounds.number(), seedId, address));
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- blessings and commandments

    /**
     * Bless a seed with the caller's own quota.
     *
     * @param unitIds units the elector claims in the current ownership snapshot
     * @param proof   membership proof of the claim
     * @param payment amount offered; any excess over the current blessing cost is refunded
     */
    public BlessingResult blessSeed(String elector, long seedId, long[] unitIds, List<MerkleHash> proof,
                                    long payment) {
        var address = address(elector);
        requireUnitIds(unitIds);
        lock.writeLock().lock();
        try {
            requireNotPaused();
            return bless(address, address, seedId, unitIds, proof, payment);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Bless on behalf of an elector that approved the relayer. The elector's quota is consumed; the relayer pays.
     */
    public BlessingResult blessSeedFor(String relayer, long seedId, String elector, long[] unitIds,
                                       List<MerkleHash> proof, long payment) {
        var relayerAddress = address(relayer);
        var electorAddress = address(elector);
        requireUnitIds(unitIds);
        lock.writeLock().lock();
        try {
            requireNotPaused();
            access.requireRole(Role.RELAYER, relayerAddress);
            access.requireDelegate(electorAddress, relayerAddress);
            return bless(electorAddress, relayerAddress, seedId, unitIds, proof, payment);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Apply delegated blessings in order, all or nothing. Every item is validated against the quota left after the
     * items before it, and the relayer pays the blessing cost once per item.
     *
     * @throws ValidationException with {@link ErrorCode#BATCH_TOO_LARGE} above the configured batch size
     */
    public List<BlessingResult> batchBlessSeedsFor(String relayer, List<BlessingRequest> requests, long payment) {
        var relayerAddress = address(relayer);
        Objects.requireNonNull(requests, "requests");
        if (requests.size() > engineConfig.getMaxBatchSize()) {
            throw new ValidationException(ErrorCode.BATCH_TOO_LARGE,
                                          "Batch of " + requests.size() + " exceeds " + engineConfig.getMaxBatchSize());
        }
        var electorAddresses = new ArrayList<String>(requests.size());
        for (var request : requests) {
            electorAddresses.add(address(request.elector()));
            requireUnitIds(request.unitIds());
        }
        lock.writeLock().lock();
        try {
            requireNotPaused();
            access.requireRole(Role.RELAYER, relayerAddress);
            var reserved = new HashMap<String, Long>();
            for (int i = 0; i < requests.size(); i++) {
                var request = requests.get(i);
                var elector = electorAddresses.get(i);
                access.requireDelegate(elector, relayerAddress);
                var proofValid = verifyOwnership(elector, request.unitIds(), request.proof());
                scoring.validateBlessing(request.seedId(), elector, request.unitIds().length, proofValid,
                                         reserved.getOrDefault(elector, 0L));
                reserved.merge(elector, 1L, Long::sum);
            }
            var cost = Math.multiplyExact(config.current().blessingCost(), (long) requests.size());
            validatePayment(cost, payment);
            settle(relayerAddress, cost, payment);

            var results = new ArrayList<BlessingResult>(requests.size());
            var now = clock.getAsLong();
            for (int i = 0; i < requests.size(); i++) {
                var request = requests.get(i);
                var elector = electorAddresses.get(i);
                var result = scoring.applyBlessing(request.seedId(), elector, request.unitIds().length, true);
                results.add(result);
                fire(new SeedsEvent.BlessingSubmitted(now, rounds.number(), request.seedId(), elector, relayerAddress,
                                                      result.scoreDelta(), result.newScore()));
            }
            log.info("Relayer {} applied batch of {} blessings", relayerAddress, results.size());
            return results;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Attach a commandment to any non-retracted seed, including decided ones.
     *
     * @param payment amount offered; any excess over the current commandment cost is refunded
     */
    public Commandment submitCommandment(String elector, long seedId, String contentHandle, long[] unitIds,
                                         List<MerkleHash> proof, long payment) {
        var address = address(elector);
        ContentHandles.require(contentHandle);
        requireUnitIds(unitIds);
        lock.writeLock().lock();
        try {
            requireNotPaused();
            var proofValid = verifyOwnership(address, unitIds, proof);
            scoring.validateCommandment(seedId, address, contentHandle, unitIds.length, proofValid);
            var cost = config.current().commandmentCost();
            validatePayment(cost, payment);
            settle(address, cost, payment);
            var scored = scoring.applyCommandment(seedId, address, contentHandle, unitIds.length, true);
            var commandment = scored.commandment();
            fire(new SeedsEvent.CommandmentSubmitted(commandment.createdAt(), commandment.round(), commandment.id(),
                                                     seedId, address, contentHandle, scored.scoreDelta()));
            return commandment;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private BlessingResult bless(String elector, String actor, long seedId, long[] unitIds, List<MerkleHash> proof,
                                 long payment) {
        var proofValid = verifyOwnership(elector, unitIds, proof);
        scoring.validateBlessing(seedId, elector, unitIds.length, proofValid, 0);
        var cost = config.current().blessingCost();
        validatePayment(cost, payment);
        settle(actor, cost, payment);
        var result = scoring.applyBlessing(seedId, elector, unitIds.length, true);
        fire(new SeedsEvent.BlessingSubmitted(clock.getAsLong(), rounds.number(), seedId, elector, actor,
                                              result.scoreDelta(), result.newScore()));
        return result;
    }

    // ---------------------------------------------------------------- administration

    public void approveDelegate(String elector, String delegate, boolean approved) {
        var electorAddress = address(elector);
        var delegateAddress = address(delegate);
        lock.writeLock().lock();
        try {
            if (access.approveDelegate(electorAddress, delegateAddress, approved)) {
                log.info("{} {} delegate {}", electorAddress, approved ? "approved" : "revoked", delegateAddress);
                fire(new SeedsEvent.DelegateApproval(clock.getAsLong(), rounds.number(), electorAddress,
                                                     delegateAddress, approved));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void grantRole(String admin, Role role, String account) {
        changeRole(admin, role, account, true);
    }

    public void revokeRole(String admin, Role role, String account) {
        changeRole(admin, role, account, false);
    }

    public void pause(String admin, String reason) {
        var address = address(admin);
        lock.writeLock().lock();
        try {
            access.requireRole(Role.ADMIN, address);
            if (paused) {
                throw new LifecycleException(ErrorCode.PAUSED, "Engine is already paused: " + pauseReason);
            }
            paused = true;
            pauseReason = reason == null ? "" : reason;
            log.info("Engine paused by {}: {}", address, pauseReason);
            fire(new SeedsEvent.Paused(clock.getAsLong(), rounds.number(), address, pauseReason));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void unpause(String admin) {
        var address = address(admin);
        lock.writeLock().lock();
        try {
            access.requireRole(Role.ADMIN, address);
            if (!paused) {
                throw new LifecycleException(ErrorCode.NOT_PAUSED, "Engine is not paused");
            }
            paused = false;
            pauseReason = "";
            log.info("Engine unpaused by {}", address);
            fire(new SeedsEvent.Unpaused(clock.getAsLong(), rounds.number(), address));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Publish a new ownership commitment. The previous one stays valid for proofs generated against it.
     *
     * @throws ValidationException with {@link ErrorCode#INVALID_ROOT} for a null or all-zero root
     */
    public void updateOwnershipRoot(String admin, MerkleHash root) {
        var address = address(admin);
        if (root == null || root.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_ROOT, "Ownership root must be non-zero");
        }
        lock.writeLock().lock();
        try {
            access.requireRole(Role.ADMIN, address);
            var now = clock.getAsLong();
            var replaced = currentRoot;
            previousRoot = currentRoot;
            currentRoot = root;
            rootUpdatedAt = now;
            log.info("Ownership root updated to {} by {}", root, address);
            fire(new SeedsEvent.OwnershipRootUpdated(now, rounds.number(), replaced, root));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Takes effect immediately.
     */
    public void setTreasury(String admin, String treasury) {
        var address = address(admin);
        var treasuryAddress = address(treasury);
        lock.writeLock().lock();
        try {
            access.requireRole(Role.ADMIN, address);
            var previous = config.treasury().orElse(null);
            config.setTreasury(treasuryAddress);
            log.info("Treasury set to {} by {}", treasuryAddress, address);
            fire(new SeedsEvent.TreasuryUpdated(clock.getAsLong(), rounds.number(), previous, treasuryAddress));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setBlessingCost(String admin, long cost) {
        stage(admin, p -> p.withBlessingCost(cost));
    }

    public void setBlessingWeight(String admin, long weight) {
        stage(admin, p -> p.withBlessingWeight(weight));
    }

    public void setBlessingsPerUnit(String admin, int count) {
        stage(admin, p -> p.withBlessingsPerUnit(count));
    }

    public void setCommandmentCost(String admin, long cost) {
        stage(admin, p -> p.withCommandmentCost(cost));
    }

    public void setCommandmentWeight(String admin, long weight) {
        stage(admin, p -> p.withCommandmentWeight(weight));
    }

    public void setCommandmentsPerUnit(String admin, int count) {
        stage(admin, p -> p.withCommandmentsPerUnit(count));
    }

    public void setDeadlockStrategy(String admin, DeadlockStrategy strategy) {
        stage(admin, p -> p.withDeadlockStrategy(strategy));
    }

    public void setPeriodDuration(String admin, long seconds) {
        stage(admin, p -> p.withPeriodDuration(seconds));
    }

    public void setRoundMode(String admin, RoundMode mode) {
        stage(admin, p -> p.withRoundMode(mode));
    }

    public void setScoreResetOnRoundEnd(String admin, boolean reset) {
        stage(admin, p -> p.withScoreResetOnRoundEnd(reset));
    }

    public void setTieBreakingStrategy(String admin, TieBreakingStrategy strategy) {
        stage(admin, p -> p.withTieBreakingStrategy(strategy));
    }

    public void setTimeDecay(String admin, long base, long min) {
        stage(admin, p -> p.withTimeDecay(base, min));
    }

    /**
     * Stage an arbitrary change to the pending parameters; it takes effect at the next round boundary.
     *
     * @return the new pending parameters
     */
    public ScoringParameters stage(String admin, UnaryOperator<ScoringParameters> change) {
        var address = address(admin);
        lock.writeLock().lock();
        try {
            access.requireRole(Role.ADMIN, address);
            var pending = config.update(change);
            log.info("Pending configuration staged by {}: {}", address, pending);
            return pending;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void changeRole(String admin, Role role, String account, boolean grant) {
        var adminAddress = address(admin);
        var accountAddress = address(account);
        Objects.requireNonNull(role, "role");
        lock.writeLock().lock();
        try {
            access.requireRole(Role.ADMIN, adminAddress);
            var changed = grant ? access.grant(role, accountAddress) : access.revoke(role, accountAddress);
            if (changed) {
                log.info("{} {} {} {}", adminAddress, grant ? "granted" : "revoked", role, accountAddress);
                fire(new SeedsEvent.RoleChanged(clock.getAsLong(), rounds.number(), role, accountAddress, grant,
                                                adminAddress));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- queries

    public long currentRound() {
        lock.readLock().lock();
        try {
            return rounds.number();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ScoringParameters currentParameters() {
        lock.readLock().lock();
        try {
            return config.current();
        } finally {
            lock.readLock().unlock();
        }
    }

    public EngineConfig engineConfig() {
        return engineConfig;
    }

    public long getBlessingCount(String elector, long seedId) {
        var address = address(elector);
        lock.readLock().lock();
        try {
            return electors.blessingCount(address, seedId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Commandment> getCommandmentsBySeed(long seedId) {
        lock.readLock().lock();
        try {
            registry.get(seedId);
            return List.copyOf(scoring.commandments(seedId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Highest positive score among eligible seeds, lowest id on ties. Empty when no eligible seed has scored.
     */
    public Optional<Seed> getCurrentLeader() {
        var leaders = getCurrentLeaders();
        return leaders.isEmpty() ? Optional.empty() : Optional.of(leaders.get(0));
    }

    /**
     * Every eligible seed tied at the highest positive score, ascending by id.
     */
    public List<Seed> getCurrentLeaders() {
        lock.readLock().lock();
        try {
            var leaders = new ArrayList<Seed>();
            for (var candidate : ResolutionPolicy.leaders(candidates())) {
                leaders.add(registry.get(candidate.seedId()).snapshot());
            }
            return leaders;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Seed> getCurrentRoundSeeds() {
        lock.readLock().lock();
        try {
            return snapshots(registry.roundSubmissions(rounds.number()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Eligible seed ids in eligible-set order.
     */
    public long[] getEligibleSeeds() {
        lock.readLock().lock();
        try {
            return registry.eligible().toArray();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getEligibleSeedsCount() {
        lock.readLock().lock();
        try {
            return registry.eligible().size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long[] getEligibleSeedsPaginated(int offset, int limit) {
        requirePage(offset, limit);
        lock.readLock().lock();
        try {
            return registry.eligible().slice(offset, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getRemainingBlessings(String elector, long ownedUnits) {
        var address = address(elector);
        lock.readLock().lock();
        try {
            return scoring.remainingBlessings(address, ownedUnits);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getRemainingCommandments(String elector, long ownedUnits) {
        var address = address(elector);
        lock.readLock().lock();
        try {
            return scoring.remainingCommandments(address, ownedUnits);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws LifecycleException with {@link ErrorCode#ROUND_NOT_FOUND} for rounds not yet opened
     */
    public Round getRound(long number) {
        lock.readLock().lock();
        try {
            return rounds.round(number)
                         .orElseThrow(() -> new LifecycleException(ErrorCode.ROUND_NOT_FOUND,
                                                                   "Round " + number + " does not exist"));
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getSecondsUntilDailyReset() {
        return ElectorLedger.secondsUntilDailyReset(clock.getAsLong());
    }

    /**
     * @throws LifecycleException with {@link ErrorCode#SEED_NOT_FOUND}
     */
    public Seed getSeed(long seedId) {
        lock.readLock().lock();
        try {
            return registry.get(seedId).snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Seeds in id order.
     */
    public List<Seed> getSeeds(int offset, int limit) {
        requirePage(offset, limit);
        lock.readLock().lock();
        try {
            var page = new ArrayList<Seed>();
            for (var seed : registry.page(offset, limit)) {
                page.add(seed.snapshot());
            }
            return page;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Seed> getSeedsByRound(long round) {
        lock.readLock().lock();
        try {
            return snapshots(registry.roundSubmissions(round));
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getTimeUntilPeriodEnd() {
        lock.readLock().lock();
        try {
            return rounds.timeUntilPeriodEnd(clock.getAsLong());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getTotalSeedsCount() {
        lock.readLock().lock();
        try {
            return registry.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getUserDailyBlessingCount(String elector) {
        var address = address(elector);
        lock.readLock().lock();
        try {
            return electors.blessingsUsed(address, ElectorLedger.day(clock.getAsLong()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getUserDailyCommandmentCount(String elector) {
        var address = address(elector);
        lock.readLock().lock();
        try {
            return electors.commandmentsUsed(address, ElectorLedger.day(clock.getAsLong()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasBlessed(String elector, long seedId) {
        return getBlessingCount(elector, seedId) > 0;
    }

    public boolean hasRole(Role role, String account) {
        var address = address(account);
        lock.readLock().lock();
        try {
            return access.hasRole(role, address);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isDelegate(String elector, String delegate) {
        var electorAddress = address(elector);
        var delegateAddress = address(delegate);
        lock.readLock().lock();
        try {
            return access.isDelegate(electorAddress, delegateAddress);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isPaused() {
        lock.readLock().lock();
        try {
            return paused;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isResolvable() {
        lock.readLock().lock();
        try {
            return rounds.isResolvable(clock.getAsLong());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<MerkleHash> ownershipRoot() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(currentRoot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long ownershipRootUpdatedAt() {
        lock.readLock().lock();
        try {
            return rootUpdatedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String pauseReason() {
        lock.readLock().lock();
        try {
            return pauseReason;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ScoringParameters pendingParameters() {
        lock.readLock().lock();
        try {
            return config.pending();
        } finally {
            lock.readLock().unlock();
        }
    }

    public RoundPhase phase() {
        lock.readLock().lock();
        try {
            return rounds.phase(clock.getAsLong());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<MerkleHash> previousOwnershipRoot() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(previousRoot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return winning seed of a resolved round, 0 if skipped or unresolved
     */
    public long roundWinner(long round) {
        lock.readLock().lock();
        try {
            return rounds.winner(round);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Score a seed gained during one round.
     */
    public long seedScoreByRound(long round, long seedId) {
        lock.readLock().lock();
        try {
            return electors.roundScore(round, seedId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> treasury() {
        lock.readLock().lock();
        try {
            return config.treasury();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long userSeedBlessingsByRound(long round, String elector, long seedId) {
        var address = address(elector);
        lock.readLock().lock();
        try {
            return electors.roundBlessings(round, address, seedId);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------- internals

    private static String address(String address) {
        if (!Addresses.isValid(address)) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "Malformed address: " + address);
        }
        return Addresses.normalize(address);
    }

    private static void requirePage(int offset, int limit) {
        if (offset < 0 || limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException(ErrorCode.INVALID_PAGE,
                                          "Invalid page offset " + offset + ", limit " + limit + " (max "
                                          + MAX_PAGE_SIZE + ")");
        }
    }

    /**
     * Duplicates are rejected so repeated units can never inflate the attested count.
     */
    private static void requireUnitIds(long[] unitIds) {
        if (unitIds == null || unitIds.length == 0) {
            throw new ValidationException(ErrorCode.EMPTY_UNIT_IDS, "At least one unit id is required");
        }
        var seen = new HashSet<Long>(unitIds.length * 2);
        for (var id : unitIds) {
            if (!seen.add(id)) {
                throw new ValidationException(ErrorCode.DUPLICATE_UNIT_IDS, "Duplicate unit id " + id);
            }
        }
    }

    /**
     * Eligible seeds as resolution candidates, ascending by id.
     */
    private List<Candidate> candidates() {
        var ids = registry.eligible().sortedIds();
        var candidates = new ArrayList<Candidate>(ids.length);
        for (var id : ids) {
            var seed = registry.get(id);
            candidates.add(new Candidate(id, seed.blessingScore, seed.createdAt));
        }
        return candidates;
    }

    private void fire(SeedsEvent event) {
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}", listener, event, e);
            }
        }
    }

    private void requireNotPaused() {
        if (paused) {
            throw new LifecycleException(ErrorCode.PAUSED, "Engine is paused: " + pauseReason);
        }
    }

    private void settle(String payer, long cost, long payment) {
        if (cost > 0) {
            payments.deposit(config.treasury().orElseThrow(), cost);
        }
        if (payment > cost) {
            payments.refund(payer, payment - cost);
        }
    }

    private List<Seed> snapshots(long[] ids) {
        var seeds = new ArrayList<Seed>(ids.length);
        for (var id : ids) {
            seeds.add(registry.get(id).snapshot());
        }
        return seeds;
    }

    private void validatePayment(long cost, long payment) {
        if (payment < cost) {
            throw new PaymentException(ErrorCode.INSUFFICIENT_PAYMENT,
                                       "Payment " + payment + " is below the cost " + cost);
        }
        if (cost > 0 && config.treasury().isEmpty()) {
            throw new PaymentException(ErrorCode.TREASURY_NOT_CONFIGURED, "No treasury configured to receive " + cost);
        }
    }

    /**
     * Check the claim against the current root, then the previous one.
     */
    private boolean verifyOwnership(String elector, long[] unitIds, List<MerkleHash> proof) {
        if (currentRoot == null || proof == null) {
            return false;
        }
        if (oracle.verify(currentRoot, elector, unitIds, proof)) {
            return true;
        }
        return previousRoot != null && oracle.verify(previousRoot, elector, unitIds, proof);
    }
}
