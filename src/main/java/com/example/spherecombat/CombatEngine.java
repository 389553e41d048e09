package com.example.spherecombat;

import com.example.spherecombat.audit.AuditConfig;
import com.example.spherecombat.audit.CombatAuditSystem;
import com.example.spherecombat.audit.ShadowModeVerifier;
import com.example.spherecombat.combat.ActionKind;
import com.example.spherecombat.combat.CombatPolicy;
import com.example.spherecombat.combat.CombatantRoster;
import com.example.spherecombat.combat.CombatantTimingState;
import com.example.spherecombat.combat.GlobalPulseScheduler;
import com.example.spherecombat.combat.SwingResolver;
import com.example.spherecombat.combat.TimingProvider;
import com.example.spherecombat.combat.TimingSnapshot;
import com.example.spherecombat.config.ConfigurationException;
import com.example.spherecombat.config.EngineConfig;
import com.example.spherecombat.config.TimingConfigLoader;
import com.example.spherecombat.duel.ArenaController;
import com.example.spherecombat.duel.DuelManager;
import com.example.spherecombat.duel.DuelRuleset;
import com.example.spherecombat.duel.DuelSettings;
import com.example.spherecombat.duel.GoldEscrow;
import com.example.spherecombat.duel.SphereRuleset;
import com.example.spherecombat.duel.StandardRuleset;
import com.example.spherecombat.event.CombatEventBus;
import com.example.spherecombat.model.Actor;
import com.example.spherecombat.spell.CastDescriptor;
import com.example.spherecombat.spell.CastPipeline;
import com.example.spherecombat.spell.CastState;
import com.example.spherecombat.spell.DisturbType;
import com.example.spherecombat.spell.SpellDefinition;
import com.example.spherecombat.util.TickScheduler;
import com.example.spherecombat.util.TickService;
import com.example.spherecombat.util.TimerToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Wires the timing engine and the duel system onto one scheduler.
 * <p>
 * Nothing runs until {@link #start()}: configuration is validated first, and the pulse is
 * never scheduled if it is invalid. Action methods take the current time from the scheduler
 * and must be called from its thread; other threads hand work over with {@link #execute(Runnable)}.
 */
public class CombatEngine {
    private static final Logger logger = LoggerFactory.getLogger(CombatEngine.class);

    /** How long stop() waits for the scheduler thread to run the teardown */
    private static final long STOP_TIMEOUT_MS = 5_000;

    static final String AUDIT_FLUSH_TASK = "combat-audit-flush";

    private final TickScheduler scheduler;
    private final boolean ownsScheduler;
    private final EngineConfig config;
    private final SwingResolver swingResolver;
    private final GoldEscrow escrow;
    private final ArenaController arenaController;
    private final CombatEventBus events = new CombatEventBus();

    private CombatantRoster roster;
    private GlobalPulseScheduler pulse;
    private CastPipeline castPipeline;
    private DuelManager duelManager;
    private CombatAuditSystem audit;
    private ShadowModeVerifier shadow;
    private volatile boolean started;

    public CombatEngine(TickScheduler scheduler, EngineConfig config, SwingResolver swingResolver,
                        GoldEscrow escrow, ArenaController arenaController) {
        this(scheduler, false, config, swingResolver, escrow, arenaController);
    }

    private CombatEngine(TickScheduler scheduler, boolean ownsScheduler, EngineConfig config,
                         SwingResolver swingResolver, GoldEscrow escrow, ArenaController arenaController) {
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.config = config;
        this.swingResolver = swingResolver;
        this.escrow = escrow;
        this.arenaController = arenaController;
    }

    /**
     * Engine on its own tick thread, configured from the classpath YAML resources.
     */
    public static CombatEngine fromClasspath(SwingResolver swingResolver, GoldEscrow escrow,
                                             ArenaController arenaController) throws ConfigurationException {
        EngineConfig config = new TimingConfigLoader().load();
        return new CombatEngine(new TickService(), true, config, swingResolver, escrow, arenaController);
    }

    /**
     * Validate configuration, build the components and start the pulse and duel system.
     * @throws ConfigurationException if the configuration is invalid; nothing is started then
     */
    public synchronized void start() throws ConfigurationException {
        if (started) {
            throw new IllegalStateException("Engine already started");
        }
        CombatPolicy policy = config.getPolicy().validate();
        DuelSettings duelSettings = config.getDuelSettings().validate();
        AuditConfig auditConfig = config.getAuditConfig().validate();
        TimingProvider provider = config.createTimingProvider();

        audit = auditConfig.isEnabled() ? new CombatAuditSystem(auditConfig, provider.getProviderName()) : null;
        shadow = null;
        if (auditConfig.isShadowMode()) {
            shadow = new ShadowModeVerifier(provider, config.createShadowProvider(), auditConfig, audit, scheduler::now);
            provider = shadow;
        }

        roster = new CombatantRoster(policy, provider, events);
        pulse = new GlobalPulseScheduler(scheduler, roster, policy, swingResolver, events);
        castPipeline = new CastPipeline(scheduler, roster, policy, config.getSpellTimings(), events);
        duelManager = new DuelManager(scheduler, escrow, arenaController, duelSettings, createRuleset(duelSettings));

        if (audit != null) {
            audit.attach(events);
            pulse.addTickObserver(audit::checkPerformanceThrottle);
            scheduler.scheduleAtFixedRate(AUDIT_FLUSH_TASK, audit::flush,
                    auditConfig.getFlushIntervalMs(), auditConfig.getFlushIntervalMs());
        }
        pulse.start();
        duelManager.start();
        started = true;
        logger.info("[CombatEngine] Started with {} timing", provider.getProviderName());
    }

    private DuelRuleset createRuleset(DuelSettings settings) {
        if (SphereRuleset.NAME.equals(settings.getRuleset())) {
            return new SphereRuleset(roster, scheduler);
        }
        return new StandardRuleset();
    }

    /**
     * Stop duels first (refunding what is open), then the pulse, then drop every combatant.
     * The teardown runs on the scheduler thread, after any tick already in progress;
     * a caller on another thread waits for it to finish.
     */
    public synchronized void stop() {
        if (!started) return;
        started = false;
        if (scheduler.isSchedulerThread()) {
            teardown();
        } else {
            awaitTeardown();
        }
        if (ownsScheduler) {
            scheduler.shutdown();
        }
        logger.info("[CombatEngine] Stopped");
    }

    private void awaitTeardown() {
        CountDownLatch done = new CountDownLatch(1);
        scheduler.schedule(() -> {
            try {
                teardown();
            } finally {
                done.countDown();
            }
        }, 0);
        try {
            if (!done.await(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.error("[CombatEngine] Teardown did not finish within {}ms", STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[CombatEngine] Interrupted while waiting for teardown");
        }
    }

    private void teardown() {
        try {
            duelManager.stop();
        } catch (RuntimeException e) {
            logger.warn("[CombatEngine] Error stopping duels", e);
        }
        pulse.stop();
        roster.clear("Engine stopped", scheduler.now());
        if (audit != null) {
            scheduler.cancel(AUDIT_FLUSH_TASK);
            audit.flush();
            audit.detach(events);
        }
    }

    /**
     * Hand work over to the scheduler thread. Under virtual time it runs on the next
     * advance.
     * @return token to cancel the task before it runs
     */
    public TimerToken execute(Runnable task) {
        checkStarted();
        return scheduler.schedule(task, 0);
    }

    public boolean isStarted() {
        return started;
    }

    // ========== Actions ==========

    /**
     * Start auto-attacking the actor's combat target with the equipped implement.
     * @throws com.example.spherecombat.combat.ActionBlockedException if the swing is not allowed now
     */
    public TimingSnapshot beginSwing(Actor attacker) {
        long now = scheduler.now();
        CombatantTimingState timing = requireCombatant(attacker, now);
        return timing.beginSwing(attacker, attacker.getEquippedImplement(), now);
    }

    public CastDescriptor beginCast(Actor caster, SpellDefinition spell, boolean fromScroll) {
        checkStarted();
        return castPipeline.beginCast(caster, spell, fromScroll);
    }

    public CastState confirmTarget(CastDescriptor cast, Actor target) {
        checkStarted();
        return castPipeline.confirmTarget(cast, target);
    }

    public CastState confirmTarget(CastDescriptor cast, Actor target, int tiles, int targets) {
        checkStarted();
        return castPipeline.confirmTarget(cast, target, tiles, targets);
    }

    public boolean disturbCast(Actor caster, DisturbType type) {
        checkStarted();
        return castPipeline.disturb(caster, type);
    }

    public void beginBandage(Actor actor) {
        long now = scheduler.now();
        requireCombatant(actor, now).beginBandage(actor, now);
    }

    public void beginWandUse(Actor actor, long delayMs) {
        long now = scheduler.now();
        requireCombatant(actor, now).beginWandUse(actor, delayMs, now);
    }

    /**
     * Cancel an action in progress. Nothing to cancel is not an error.
     */
    public boolean cancel(Actor actor, ActionKind kind, String reason) {
        checkStarted();
        CombatantTimingState timing = roster.get(actor);
        return timing != null && timing.cancel(kind, reason);
    }

    /**
     * Whether the action's timer has recovered. Actors not in combat are always ready.
     */
    public boolean isReady(Actor actor, ActionKind kind) {
        checkStarted();
        CombatantTimingState timing = roster.get(actor);
        return timing == null || timing.isReady(kind, scheduler.now());
    }

    // ========== World notifications ==========

    /**
     * An actor died. Everything it was doing stops; a duel is told about the death.
     */
    public void onDeath(Actor victim, Actor killer) {
        checkStarted();
        if (victim == null) return;
        duelManager.onParticipantDeath(victim, killer);
        roster.unregister(victim, "Died", scheduler.now());
    }

    public void onDisconnect(Actor actor) {
        checkStarted();
        if (actor == null) return;
        duelManager.handleDisconnect(actor);
        roster.unregister(actor, "Disconnected", scheduler.now());
    }

    // ========== Accessors ==========

    public CombatEventBus getEvents() { return events; }
    public TickScheduler getScheduler() { return scheduler; }
    public EngineConfig getConfig() { return config; }

    public CombatantRoster getRoster() {
        checkStarted();
        return roster;
    }

    public GlobalPulseScheduler getPulse() {
        checkStarted();
        return pulse;
    }

    public CastPipeline getCastPipeline() {
        checkStarted();
        return castPipeline;
    }

    public DuelManager getDuelManager() {
        checkStarted();
        return duelManager;
    }

    /** The combat audit, or null when auditing is disabled */
    public CombatAuditSystem getAudit() {
        checkStarted();
        return audit;
    }

    /** The shadow-mode comparator, or null when shadow mode is off */
    public ShadowModeVerifier getShadowVerifier() {
        checkStarted();
        return shadow;
    }

    private CombatantTimingState requireCombatant(Actor actor, long now) {
        checkStarted();
        if (actor == null || actor.isDeleted() || !actor.isAlive()) {
            throw new IllegalArgumentException("Actor cannot act: " + (actor == null ? "null" : actor.getName()));
        }
        return roster.register(actor, now);
    }

    private void checkStarted() {
        if (!started) {
            throw new IllegalStateException("Engine is not running");
        }
    }
}
