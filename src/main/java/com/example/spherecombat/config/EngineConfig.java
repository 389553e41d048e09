package com.example.spherecombat.config;

import com.example.spherecombat.audit.AuditConfig;
import com.example.spherecombat.combat.CombatPolicy;
import com.example.spherecombat.combat.LegacyTimingProvider;
import com.example.spherecombat.combat.TimingProvider;
import com.example.spherecombat.combat.WeaponTimingProvider;
import com.example.spherecombat.combat.WeaponTimingTable;
import com.example.spherecombat.duel.DuelSettings;
import com.example.spherecombat.spell.SpellTimingTable;

/**
 * Everything the engine reads from configuration, validated and immutable.
 */
public final class EngineConfig {

    private final CombatPolicy policy;
    private final DuelSettings duelSettings;
    private final WeaponTimingTable weaponTimings;
    private final SpellTimingTable spellTimings;
    private final AuditConfig auditConfig;

    public EngineConfig(CombatPolicy policy, DuelSettings duelSettings,
                        WeaponTimingTable weaponTimings, SpellTimingTable spellTimings) {
        this(policy, duelSettings, weaponTimings, spellTimings, AuditConfig.defaults());
    }

    public EngineConfig(CombatPolicy policy, DuelSettings duelSettings, WeaponTimingTable weaponTimings,
                        SpellTimingTable spellTimings, AuditConfig auditConfig) {
        this.policy = policy;
        this.duelSettings = duelSettings;
        this.weaponTimings = weaponTimings;
        this.spellTimings = spellTimings;
        this.auditConfig = auditConfig;
    }

    /**
     * Built-in values, used when the host supplies no configuration files.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(CombatPolicy.defaults(), DuelSettings.defaults(),
                WeaponTimingTable.compatibilityMapping(), SpellTimingTable.defaults());
    }

    /**
     * Create the timing provider the policy names.
     * @throws ConfigurationException if the name is not a known provider
     */
    public TimingProvider createTimingProvider() throws ConfigurationException {
        String name = policy.getTimingProvider().trim().toLowerCase();
        switch (name) {
            case WeaponTimingProvider.NAME:
                return new WeaponTimingProvider(weaponTimings);
            case LegacyTimingProvider.NAME:
                return new LegacyTimingProvider();
            default:
                throw new ConfigurationException("Unknown timing provider: " + policy.getTimingProvider());
        }
    }

    /**
     * The provider shadow mode runs beside the live one: the other of weapon and legacy.
     * @throws ConfigurationException if the live provider name is not known
     */
    public TimingProvider createShadowProvider() throws ConfigurationException {
        TimingProvider live = createTimingProvider();
        if (WeaponTimingProvider.NAME.equals(live.getProviderName())) {
            return new LegacyTimingProvider();
        }
        return new WeaponTimingProvider(weaponTimings);
    }

    public CombatPolicy getPolicy() { return policy; }
    public DuelSettings getDuelSettings() { return duelSettings; }
    public WeaponTimingTable getWeaponTimings() { return weaponTimings; }
    public SpellTimingTable getSpellTimings() { return spellTimings; }
    public AuditConfig getAuditConfig() { return auditConfig; }
}
