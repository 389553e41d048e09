package com.example.spherecombat.duel;

import com.example.spherecombat.model.Actor;
import com.example.spherecombat.model.Arena;
import com.example.spherecombat.util.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Drives consensual duels from challenge to cleanup.
 * <p>
 * Challenges are held per challenged actor and per initiator, with the initiator's wager in
 * escrow. Accepting creates a {@link DuelContext}; every later phase runs off one timer on the
 * shared scheduler. Calls naming an actor that has no duel, or a duel that has already moved
 * past the relevant phase, are ignored.
 */
public class DuelManager {
    private static final Logger logger = LoggerFactory.getLogger(DuelManager.class);

    private final TickScheduler scheduler;
    private final GoldEscrow escrow;
    private final ArenaController arenaController;
    private final DuelSettings settings;
    private final DuelRuleset ruleset;

    private final Map<Long, PendingChallenge> challengesByTarget = new ConcurrentHashMap<>();
    private final Map<Long, PendingChallenge> challengesByInitiator = new ConcurrentHashMap<>();
    private final Map<Long, DuelContext> contextsByActor = new ConcurrentHashMap<>();
    private final Map<Long, DuelContext> activeContexts = new ConcurrentHashMap<>();
    private final Set<Long> rulesetApplied = ConcurrentHashMap.newKeySet();
    private final Deque<DuelResult> history = new ArrayDeque<>();
    private final List<Consumer<DuelEvent>> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean running;

    public DuelManager(TickScheduler scheduler, GoldEscrow escrow, ArenaController arenaController,
                       DuelSettings settings, DuelRuleset ruleset) {
        this.scheduler = scheduler;
        this.escrow = escrow;
        this.arenaController = arenaController;
        this.settings = settings != null ? settings : DuelSettings.defaults();
        this.ruleset = ruleset != null ? ruleset : new StandardRuleset();
    }

    // ========== Lifecycle ==========

    public void start() {
        running = true;
        logger.info("[DuelManager] Started ({}, ruleset {})", settings, ruleset.getName());
    }

    /**
     * Stop accepting challenges, refund every open challenge and call every live duel a draw.
     */
    public void stop() {
        if (!running) return;
        running = false;
        for (PendingChallenge challenge : new ArrayList<>(challengesByTarget.values())) {
            dropChallenge(challenge, DuelEventType.CHALLENGE_EXPIRED, "Duel system stopped");
        }
        for (DuelContext context : new ArrayList<>(activeContexts.values())) {
            if (context.getState() == DuelState.WAITING || context.getState() == DuelState.COUNTDOWN) {
                cancelDuel(context, "Duel system stopped");
            } else {
                endDuel(context, null);
                cleanup(context);
            }
        }
        logger.info("[DuelManager] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ========== Challenges ==========

    /**
     * Challenge another actor to a 1v1 duel in the given arena.
     * @param wager gold each side puts in; ignored for loot duels
     */
    public ChallengeResult issueChallenge(Actor initiator, Actor target, Arena arena, int wager, boolean loot) {
        if (!running) {
            return reject(initiator, target, "Dueling is not available");
        }
        if (initiator == null || target == null) {
            return reject(initiator, target, "Invalid participants");
        }
        if (initiator.getSerial() == target.getSerial()) {
            return reject(initiator, target, "You cannot challenge yourself");
        }
        if (wager < 0) {
            return reject(initiator, target, "Wager cannot be negative");
        }
        if (hasPendingChallenge(initiator) || hasPendingChallenge(target)) {
            return reject(initiator, target, "A challenge is already pending");
        }
        int stake = loot ? 0 : wager;
        String problem = validateChallenge(initiator, target, arena, stake);
        if (problem != null) {
            return reject(initiator, target, problem);
        }

        long now = scheduler.now();
        PendingChallenge challenge = new PendingChallenge(initiator, target, arena, stake, loot, now,
                settings.getChallengeTimeoutMs());
        if (stake > 0) {
            if (!escrow.withdraw(initiator, stake)) {
                return reject(initiator, target, initiator.getName() + " cannot cover the wager");
            }
            challenge.markEscrowHeld();
        }
        challengesByTarget.put(target.getSerial(), challenge);
        challengesByInitiator.put(initiator.getSerial(), challenge);

        WeakReference<PendingChallenge> handle = new WeakReference<>(challenge);
        challenge.setTimeoutTimer(scheduler.schedule(() -> onChallengeTimeout(handle), settings.getChallengeTimeoutMs()));

        logger.info("[DuelManager] {} challenged {} at {} ({})", initiator.getName(), target.getName(), arena.getName(),
                loot ? "loot" : stake + " gold");
        publish(new DuelEvent(DuelEventType.CHALLENGE_ISSUED, DuelEvent.NO_CONTEXT, arena.getName(),
                initiator.getSerial(), target.getSerial()));
        return ChallengeResult.issued(challenge);
    }

    /**
     * The challenged actor accepts. Both sides are checked again and the target's wager is taken.
     * @return the new duel, or null if there was no challenge or it could not go ahead
     */
    public DuelContext acceptChallenge(Actor target) {
        if (target == null) return null;
        PendingChallenge challenge = challengesByTarget.remove(target.getSerial());
        if (challenge == null) return null;
        challengesByInitiator.remove(challenge.getInitiatorSerial(), challenge);
        challenge.cancelTimeout();

        Actor initiator = challenge.getInitiator();
        String problem = initiator == null ? "The challenger is gone"
                : validateChallenge(initiator, target, challenge.getArena(), challenge.getWager());
        if (problem != null) {
            challenge.refund(escrow);
            logger.info("[DuelManager] Challenge {} could not start: {}", challenge, problem);
            publish(new DuelEvent(DuelEventType.CHALLENGE_REJECTED, DuelEvent.NO_CONTEXT, problem,
                    challenge.getInitiatorSerial(), challenge.getTargetSerial()));
            return null;
        }
        if (challenge.getWager() > 0 && !escrow.withdraw(target, challenge.getWager())) {
            challenge.refund(escrow);
            publish(new DuelEvent(DuelEventType.CHALLENGE_REJECTED, DuelEvent.NO_CONTEXT,
                    target.getName() + " cannot cover the wager", challenge.getInitiatorSerial(), challenge.getTargetSerial()));
            return null;
        }

        DuelContext context = new DuelContext(challenge.getArena(), DuelType.of(false, challenge.isLoot()), ruleset,
                challenge.getWager(), scheduler.now());
        openContext(context);
        DuelParticipant first = context.addParticipant(initiator);
        DuelParticipant second = context.addParticipant(target);
        contextsByActor.put(initiator.getSerial(), context);
        contextsByActor.put(target.getSerial(), context);
        // the initiator's escrow now belongs to the duel
        first.setEntryPaid(challenge.isEscrowHeld());
        second.setEntryPaid(challenge.getWager() > 0);

        publish(new DuelEvent(DuelEventType.CHALLENGE_ACCEPTED, context.getId(), null,
                initiator.getSerial(), target.getSerial()));
        publish(new DuelEvent(DuelEventType.DUEL_CREATED, context.getId(), context.getType().getDisplayName(),
                initiator.getSerial(), target.getSerial()));
        logger.info("[DuelManager] {} accepted; {} created", target.getName(), context);

        WeakReference<DuelContext> handle = new WeakReference<>(context);
        context.setPhaseTimer(scheduler.schedule(() -> {
            DuelContext ctx = handle.get();
            if (ctx != null) initiateDuel(ctx);
        }, settings.getPreTeleportDelayMs()));
        return context;
    }

    public boolean declineChallenge(Actor target) {
        if (target == null) return false;
        PendingChallenge challenge = challengesByTarget.get(target.getSerial());
        if (challenge == null) return false;
        return dropChallenge(challenge, DuelEventType.CHALLENGE_DECLINED, target.getName() + " declined");
    }

    private void onChallengeTimeout(WeakReference<PendingChallenge> handle) {
        PendingChallenge challenge = handle.get();
        if (challenge == null) return;
        dropChallenge(challenge, DuelEventType.CHALLENGE_EXPIRED, "Challenge expired");
    }

    /**
     * Remove a challenge from both tables and refund its escrow. Only the first caller does anything.
     */
    private boolean dropChallenge(PendingChallenge challenge, DuelEventType eventType, String reason) {
        boolean removed = challengesByTarget.remove(challenge.getTargetSerial(), challenge);
        challengesByInitiator.remove(challenge.getInitiatorSerial(), challenge);
        challenge.cancelTimeout();
        if (!removed) {
            return false;
        }
        challenge.refund(escrow);
        logger.info("[DuelManager] {}: {}", challenge, reason);
        publish(new DuelEvent(eventType, DuelEvent.NO_CONTEXT, reason,
                challenge.getInitiatorSerial(), challenge.getTargetSerial()));
        return true;
    }

    public PendingChallenge getIncomingChallenge(Actor target) {
        return target == null ? null : challengesByTarget.get(target.getSerial());
    }

    public PendingChallenge getOutgoingChallenge(Actor initiator) {
        return initiator == null ? null : challengesByInitiator.get(initiator.getSerial());
    }

    private boolean hasPendingChallenge(Actor actor) {
        long serial = actor.getSerial();
        return challengesByTarget.containsKey(serial) || challengesByInitiator.containsKey(serial);
    }

    /**
     * @return the reason the pair cannot duel, or null if they can
     */
    private String validateChallenge(Actor initiator, Actor target, Arena arena, int stake) {
        if (arena == null || !arena.isConfigured()) {
            return "The arena is not configured";
        }
        if (arena.isBusy()) {
            return "The arena is in use";
        }
        String problem = validateDuelist(initiator);
        if (problem == null) problem = validateDuelist(target);
        if (problem != null) return problem;
        if (initiator.getHits() < initiator.getMaxHits()) {
            return "You must be at full health to issue a challenge";
        }
        if (stake > 0) {
            if (escrow.getBalance(initiator) < stake) return initiator.getName() + " cannot cover the wager";
            if (escrow.getBalance(target) < stake) return target.getName() + " cannot cover the wager";
        }
        return null;
    }

    private String validateDuelist(Actor actor) {
        if (actor.isDeleted() || !actor.isAlive()) {
            return actor.getName() + " cannot duel right now";
        }
        if (actor.isMounted()) {
            return actor.getName() + " must dismount first";
        }
        if (isInDuel(actor)) {
            return actor.getName() + " is already in a duel";
        }
        return null;
    }

    private ChallengeResult reject(Actor initiator, Actor target, String reason) {
        logger.debug("[DuelManager] Challenge rejected: {}", reason);
        publish(new DuelEvent(DuelEventType.CHALLENGE_REJECTED, DuelEvent.NO_CONTEXT, reason,
                initiator != null ? initiator.getSerial() : 0L, target != null ? target.getSerial() : 0L));
        return ChallengeResult.rejected(reason);
    }

    // ========== Contexts ==========

    /**
     * Open a duel directly, e.g. a team duel filled from a duel stone.
     * @return the context, or null if the arena cannot host it
     */
    public DuelContext createContext(Arena arena, DuelType type, int entryCost) {
        if (!running || arena == null || !arena.isConfigured() || arena.isBusy()) {
            return null;
        }
        DuelContext context = new DuelContext(arena, type, ruleset, type.isLoot() ? 0 : entryCost, scheduler.now());
        openContext(context);
        publish(new DuelEvent(DuelEventType.DUEL_CREATED, context.getId(), type.getDisplayName()));
        return context;
    }

    /**
     * Join a gathering duel, paying its entry cost.
     */
    public boolean addParticipant(DuelContext context, Actor actor) {
        if (context == null || actor == null || context.getState() != DuelState.WAITING || context.isFull()) {
            return false;
        }
        if (validateDuelist(actor) != null) {
            return false;
        }
        int cost = context.getEntryCost();
        if (cost > 0 && !escrow.withdraw(actor, cost)) {
            return false;
        }
        DuelParticipant participant = context.addParticipant(actor);
        if (participant == null) {
            if (cost > 0) escrow.deposit(actor, cost);
            return false;
        }
        participant.setEntryPaid(cost > 0);
        contextsByActor.put(actor.getSerial(), context);
        return true;
    }

    private void openContext(DuelContext context) {
        context.getArena().setBusy(true);
        activeContexts.put(context.getId(), context);
    }

    /**
     * Pre-teleport delay is over: go to the countdown, or call the duel off if someone dropped.
     */
    private void initiateDuel(DuelContext context) {
        if (context.getState() != DuelState.WAITING) return;
        for (DuelParticipant p : context.getParticipants()) {
            Actor actor = p.getActor();
            if (actor == null || actor.isDeleted() || !actor.isAlive()) {
                cancelDuel(context, p.getName() + " is no longer available");
                return;
            }
        }
        startCountdown(context);
    }

    /**
     * Teleport and freeze everyone, then begin the fight when the countdown runs out.
     */
    public boolean startCountdown(DuelContext context) {
        if (context == null || context.getState() != DuelState.WAITING || context.getParticipantCount() < 2) {
            return false;
        }
        int spawns = context.getArena().getSpawnPointCount();
        List<DuelParticipant> participants = context.getParticipants();
        for (int i = 0; i < participants.size(); i++) {
            Actor actor = participants.get(i).getActor();
            if (actor == null) continue;
            arenaController.teleportToArena(actor, i % spawns);
            arenaController.setFrozen(actor, true);
        }
        context.setState(DuelState.COUNTDOWN);
        publish(new DuelEvent(DuelEventType.COUNTDOWN_STARTED, context.getId(), null, serials(participants)));

        WeakReference<DuelContext> handle = new WeakReference<>(context);
        context.setPhaseTimer(scheduler.schedule(() -> {
            DuelContext ctx = handle.get();
            if (ctx != null) beginDuel(ctx);
        }, settings.getCountdownMs()));
        return true;
    }

    /**
     * Start the fight. Only valid from the countdown.
     */
    public boolean beginDuel(DuelContext context) {
        if (context == null || context.getState() != DuelState.COUNTDOWN) {
            return false;
        }
        long now = scheduler.now();
        context.setState(DuelState.IN_PROGRESS);
        context.setStartTime(now);

        int spawns = context.getArena().getSpawnPointCount();
        List<DuelParticipant> participants = context.getParticipants();
        for (int i = 0; i < participants.size(); i++) {
            Actor actor = participants.get(i).getActor();
            if (actor == null) continue;
            arenaController.teleportToArena(actor, i % spawns);
            arenaController.restore(actor);
            arenaController.setFrozen(actor, false);
        }
        context.getRuleset().onDuelBegin(context);
        rulesetApplied.add(context.getId());

        WeakReference<DuelContext> handle = new WeakReference<>(context);
        context.setPhaseTimer(scheduler.schedule(() -> {
            DuelContext ctx = handle.get();
            if (ctx != null) endDuel(ctx, null);
        }, settings.getMatchDurationMs()));

        logger.info("[DuelManager] {} started", context);
        publish(new DuelEvent(DuelEventType.DUEL_STARTED, context.getId(), null, serials(participants)));
        return true;
    }

    // ========== Deaths ==========

    public void onParticipantDeath(Actor victim, Actor killer) {
        DuelContext context = recordDeath(victim, killer);
        if (context != null) {
            evaluate(context);
        }
    }

    /**
     * Several participants died at once, e.g. to one area spell. Every death is recorded
     * before the outcome is checked, so a mutual kill is a draw rather than a win.
     */
    public void onParticipantsKilled(Collection<Actor> victims) {
        if (victims == null) return;
        Set<DuelContext> touched = new LinkedHashSet<>();
        for (Actor victim : victims) {
            DuelContext context = recordDeath(victim, null);
            if (context != null) touched.add(context);
        }
        for (DuelContext context : touched) {
            evaluate(context);
        }
    }

    private DuelContext recordDeath(Actor victim, Actor killer) {
        if (victim == null) return null;
        DuelContext context = contextsByActor.get(victim.getSerial());
        if (context == null || context.getState() != DuelState.IN_PROGRESS) return null;
        DuelParticipant participant = context.getParticipant(victim.getSerial());
        if (participant == null || participant.isEliminated()) return null;

        participant.recordDeath();
        if (killer != null && killer.getSerial() != victim.getSerial()) {
            DuelParticipant scorer = context.getParticipant(killer.getSerial());
            if (scorer != null) {
                scorer.recordKill();
                arenaController.clearAggression(victim, killer);
            }
        }
        publish(new DuelEvent(DuelEventType.PARTICIPANT_ELIMINATED, context.getId(),
                killer != null ? killer.getName() : null, victim.getSerial()));
        return context;
    }

    private void evaluate(DuelContext context) {
        WinCondition outcome = WinCondition.evaluate(context);
        if (outcome.isDecided()) {
            finish(context, outcome);
        }
    }

    // ========== Settlement ==========

    /**
     * End the duel. A null winner is a draw. Calling this again once the duel has ended does nothing.
     * @return true if this call ended the duel
     */
    public boolean endDuel(DuelContext context, DuelParticipant winner) {
        if (context == null) return false;
        WinCondition outcome = winner == null ? WinCondition.drawn() : WinCondition.won(winner, winner.getTeamId());
        return finish(context, outcome);
    }

    private boolean finish(DuelContext context, WinCondition outcome) {
        DuelState state = context.getState();
        if (state.isFinished() || state == DuelState.WAITING || state == DuelState.COUNTDOWN) {
            return false;
        }
        long now = scheduler.now();
        context.cancelTimers();
        context.setState(DuelState.ENDING);
        context.setEndTime(now);
        context.setOutcome(outcome.getWinner(), outcome.getWinningTeam(), outcome.isDraw());

        List<DuelParticipant> winners = new ArrayList<>();
        List<DuelParticipant> losers = new ArrayList<>();
        for (DuelParticipant p : context.getParticipants()) {
            if (!outcome.isDraw() && p.getTeamId() == outcome.getWinningTeam()) winners.add(p); else losers.add(p);
        }

        int pot = context.getEntryCost() * context.getParticipantCount();
        int payout = 0;
        if (!context.isLoot()) {
            if (outcome.isDraw()) {
                refundEntries(context);
            } else if (!winners.isEmpty()) {
                payout = settings.calculatePayout(context.getEntryCost(), context.getParticipantCount());
                int share = payout / winners.size();
                for (DuelParticipant p : winners) {
                    Actor actor = p.getActor();
                    if (actor != null && !actor.isDeleted() && share > 0) {
                        escrow.deposit(actor, share);
                    }
                }
            }
        }

        archive(new DuelResult(context.getId(), context.getType(), names(winners), names(losers),
                now - context.getStartTime(), pot, payout, outcome.isDraw()));
        logger.info("[DuelManager] {} ended: {}", context, outcome);
        publish(new DuelEvent(DuelEventType.DUEL_ENDED, context.getId(), outcome.toString(), serials(winners)));

        long cleanupDelay = settings.getCleanupDelayMs();
        if (context.isLoot()) {
            context.setState(DuelState.LOOT_PHASE);
            cleanupDelay = settings.getLootPhaseMs();
            publish(new DuelEvent(DuelEventType.LOOT_PHASE_STARTED, context.getId(), null, serials(winners)));
        }
        WeakReference<DuelContext> handle = new WeakReference<>(context);
        context.setPhaseTimer(scheduler.schedule(() -> {
            DuelContext ctx = handle.get();
            if (ctx != null) cleanup(ctx);
        }, cleanupDelay));
        return true;
    }

    /**
     * Call off a duel that never started fighting. Entry costs are returned.
     */
    private void cancelDuel(DuelContext context, String reason) {
        context.cancelTimers();
        refundEntries(context);
        context.setState(DuelState.ENDING);
        context.setEndTime(scheduler.now());
        logger.info("[DuelManager] {} cancelled: {}", context, reason);
        publish(new DuelEvent(DuelEventType.DUEL_ENDED, context.getId(), "Cancelled: " + reason));
        cleanup(context);
    }

    private void refundEntries(DuelContext context) {
        for (DuelParticipant p : context.getParticipants()) {
            refundEntry(context, p);
        }
    }

    private void refundEntry(DuelContext context, DuelParticipant participant) {
        if (!participant.isEntryPaid()) return;
        participant.setEntryPaid(false);
        Actor actor = participant.getActor();
        if (actor != null && !actor.isDeleted()) {
            escrow.deposit(actor, context.getEntryCost());
        }
    }

    /**
     * Put everyone back, release the arena and close the context.
     */
    public void cleanup(DuelContext context) {
        if (context == null || context.getState() == DuelState.COMPLETED) return;
        context.cancelTimers();

        List<DuelParticipant> participants = context.getParticipants();
        for (int i = 0; i < participants.size(); i++) {
            for (int j = i + 1; j < participants.size(); j++) {
                Actor a = participants.get(i).getActor();
                Actor b = participants.get(j).getActor();
                if (a != null && b != null) arenaController.clearAggression(a, b);
            }
        }
        for (DuelParticipant p : participants) {
            contextsByActor.remove(p.getSerial(), context);
            Actor actor = p.getActor();
            if (actor == null || actor.isDeleted()) continue;
            arenaController.setFrozen(actor, false);
            arenaController.restore(actor);
            arenaController.returnToOrigin(actor);
        }
        activeContexts.remove(context.getId());
        context.getArena().setBusy(false);
        if (rulesetApplied.remove(context.getId())) {
            context.getRuleset().onDuelEnd(context);
        }
        context.setState(DuelState.COMPLETED);
        publish(new DuelEvent(DuelEventType.DUEL_COMPLETED, context.getId(), null, serials(participants)));
    }

    // ========== Disconnects ==========

    /**
     * An actor logged out. A running duel ends as a draw; a gathering duel loses the actor.
     * Any challenge the actor is part of is dropped with refunds.
     */
    public void handleDisconnect(Actor actor) {
        if (actor == null) return;
        DuelContext context = contextsByActor.get(actor.getSerial());
        if (context != null) {
            DuelParticipant participant = context.getParticipant(actor.getSerial());
            if (context.getState() == DuelState.IN_PROGRESS && participant != null) {
                if (!participant.isEliminated()) {
                    participant.recordDeath();
                    publish(new DuelEvent(DuelEventType.PARTICIPANT_ELIMINATED, context.getId(), "Disconnected",
                            actor.getSerial()));
                }
                endDuel(context, null);
            } else if ((context.getState() == DuelState.WAITING || context.getState() == DuelState.COUNTDOWN)
                    && participant != null) {
                removeParticipant(context, participant);
            }
        }

        for (PendingChallenge challenge : new ArrayList<>(challengesByTarget.values())) {
            if (challenge.involves(actor.getSerial())) {
                dropChallenge(challenge, DuelEventType.CHALLENGE_EXPIRED, actor.getName() + " disconnected");
            }
        }
    }

    private void removeParticipant(DuelContext context, DuelParticipant participant) {
        refundEntry(context, participant);
        context.removeParticipant(participant);
        contextsByActor.remove(participant.getSerial(), context);
        Actor actor = participant.getActor();
        if (actor != null && !actor.isDeleted()) {
            arenaController.setFrozen(actor, false);
            arenaController.returnToOrigin(actor);
        }
        // a team duel may keep gathering; anything else needs its full line-up
        boolean viable = context.getState() == DuelState.WAITING
                && (context.getType().isTeam() ? context.getParticipantCount() > 0 : context.getParticipantCount() >= 2);
        if (!viable) {
            cancelDuel(context, participant.getName() + " left");
        }
    }

    // ========== Queries ==========

    public boolean isInDuel(Actor actor) {
        return actor != null && contextsByActor.containsKey(actor.getSerial());
    }

    public DuelContext getContext(Actor actor) {
        return actor == null ? null : contextsByActor.get(actor.getSerial());
    }

    public Collection<DuelContext> getActiveContexts() {
        return new ArrayList<>(activeContexts.values());
    }

    public synchronized List<DuelResult> getHistory() {
        return new ArrayList<>(history);
    }

    private synchronized void archive(DuelResult result) {
        if (settings.getHistorySize() == 0) return;
        history.addFirst(result);
        while (history.size() > settings.getHistorySize()) {
            history.removeLast();
        }
    }

    // ========== Events ==========

    public void addListener(Consumer<DuelEvent> listener) {
        if (listener != null) listeners.add(listener);
    }

    public boolean removeListener(Consumer<DuelEvent> listener) {
        return listeners.remove(listener);
    }

    private void publish(DuelEvent event) {
        for (Consumer<DuelEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("[DuelManager] Listener failed on {}", event, e);
            }
        }
    }

    private static long[] serials(List<DuelParticipant> participants) {
        long[] result = new long[participants.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = participants.get(i).getSerial();
        }
        return result;
    }

    private static List<String> names(List<DuelParticipant> participants) {
        List<String> result = new ArrayList<>();
        for (DuelParticipant p : participants) {
            result.add(p.getName());
        }
        return result;
    }
}
