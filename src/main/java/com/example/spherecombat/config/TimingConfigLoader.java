package com.example.spherecombat.config;

import com.example.spherecombat.audit.AuditConfig;
import com.example.spherecombat.audit.AuditLevel;
import com.example.spherecombat.combat.CombatPolicy;
import com.example.spherecombat.combat.WeaponEntry;
import com.example.spherecombat.combat.WeaponTimingTable;
import com.example.spherecombat.duel.DuelSettings;
import com.example.spherecombat.spell.SpellTimingData;
import com.example.spherecombat.spell.SpellTimingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Loads engine configuration from YAML resources on the classpath.
 * <p>
 * Keys that are absent keep their built-in defaults. A missing resource, a document that
 * does not parse, or a value of the wrong type is a {@link ConfigurationException}.
 */
public class TimingConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(TimingConfigLoader.class);

    public static final String COMBAT_RESOURCE = "/config/combat.yaml";
    public static final String WEAPONS_RESOURCE = "/data/weapons.yaml";
    public static final String SPELL_TIMINGS_RESOURCE = "/data/spell-timings.yaml";

    private final String combatResource;
    private final String weaponsResource;
    private final String spellTimingsResource;

    public TimingConfigLoader() {
        this(COMBAT_RESOURCE, WEAPONS_RESOURCE, SPELL_TIMINGS_RESOURCE);
    }

    public TimingConfigLoader(String combatResource, String weaponsResource, String spellTimingsResource) {
        this.combatResource = combatResource;
        this.weaponsResource = weaponsResource;
        this.spellTimingsResource = spellTimingsResource;
    }

    public EngineConfig load() throws ConfigurationException {
        Map<String, Object> combat = loadDocument(combatResource);
        CombatPolicy policy = parsePolicy(combat).validate();
        DuelSettings duel = parseDuelSettings(section(combat, "duel")).validate();
        AuditConfig audit = parseAuditConfig(section(combat, "audit")).validate();
        WeaponTimingTable weapons = parseWeapons(loadDocument(weaponsResource));
        SpellTimingTable spells = parseSpellTimings(loadDocument(spellTimingsResource));

        logger.info("[Config] Loaded policy {} with {} weapon rows and {} spell rows; {}",
                policy, weapons.size(), spells.size(), audit);
        return new EngineConfig(policy, duel, weapons, spells, audit);
    }

    // ========== Documents ==========

    @SuppressWarnings("unchecked")
    private Map<String, Object> loadDocument(String resource) throws ConfigurationException {
        try (InputStream in = TimingConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            Object root = new Yaml().load(in);
            if (root == null) {
                return Collections.emptyMap();
            }
            if (!(root instanceof Map)) {
                throw new ConfigurationException(resource + ": expected a mapping at the top level");
            }
            return (Map<String, Object>) root;
        } catch (YAMLException e) {
            throw new ConfigurationException(resource + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + resource, e);
        }
    }

    // ========== Sections ==========

    static CombatPolicy parsePolicy(Map<String, Object> root) throws ConfigurationException {
        Map<String, Object> combat = section(root, "combat");
        Map<String, Object> pulse = section(root, "pulse");
        Map<String, Object> timing = section(root, "timing");
        Map<String, Object> logging = section(root, "logging");
        CombatPolicy d = CombatPolicy.defaults();

        return CombatPolicy.builder()
                .independentTimers(getBool(combat, "independentTimers", d.isIndependentTimers()))
                .spellCancelSwing(getBool(combat, "spellCancelSwing", d.isSpellCancelSwing()))
                .swingCancelSpell(getBool(combat, "swingCancelSpell", d.isSwingCancelSpell()))
                .bandageCancelActions(getBool(combat, "bandageCancelActions", d.isBandageCancelActions()))
                .wandCancelActions(getBool(combat, "wandCancelActions", d.isWandCancelActions()))
                .disableSwingDuringCast(getBool(combat, "disableSwingDuringCast", d.isDisableSwingDuringCast()))
                .disableSwingDuringCastDelay(getBool(combat, "disableSwingDuringCastDelay", d.isDisableSwingDuringCastDelay()))
                .disableCastDuringSwing(getBool(combat, "disableCastDuringSwing", d.isDisableCastDuringSwing()))
                .actionsCancelBandage(getBool(combat, "actionsCancelBandage", d.isActionsCancelBandage()))
                .removePostCastRecovery(getBool(combat, "removePostCastRecovery", d.isRemovePostCastRecovery()))
                .damageBasedFizzle(getBool(combat, "damageBasedFizzle", d.isDamageBasedFizzle()))
                .restrictedFizzleTriggers(getBool(combat, "restrictedFizzleTriggers", d.isRestrictedFizzleTriggers()))
                .partialManaPercent(getInt(combat, "partialManaPercent", d.getPartialManaPercent()))
                .minimumCastDelayMs(getLong(combat, "minimumCastDelayMs", d.getMinimumCastDelayMs()))
                .maximumCastDelayMs(getLong(combat, "maximumCastDelayMs", d.getMaximumCastDelayMs()))
                .bandageDelayMs(getLong(combat, "bandageDelayMs", d.getBandageDelayMs()))
                .globalTickMs(getLong(pulse, "globalTickMs", d.getGlobalTickMs()))
                .combatIdleTimeoutMs(getLong(pulse, "combatIdleTimeoutMs", d.getCombatIdleTimeoutMs()))
                .timingProvider(getString(timing, "provider", d.getTimingProvider()))
                .logActionCancellations(getBool(logging, "logActionCancellations", d.isLogActionCancellations()))
                .logTimerStateChanges(getBool(logging, "logTimerStateChanges", d.isLogTimerStateChanges()))
                .build();
    }

    static DuelSettings parseDuelSettings(Map<String, Object> duel) throws ConfigurationException {
        DuelSettings d = DuelSettings.defaults();
        return DuelSettings.builder()
                .challengeTimeoutMs(getLong(duel, "challengeTimeoutMs", d.getChallengeTimeoutMs()))
                .preTeleportDelayMs(getLong(duel, "preTeleportDelayMs", d.getPreTeleportDelayMs()))
                .countdownMs(getLong(duel, "countdownMs", d.getCountdownMs()))
                .matchDurationMs(getLong(duel, "matchDurationMs", d.getMatchDurationMs()))
                .lootPhaseMs(getLong(duel, "lootPhaseMs", d.getLootPhaseMs()))
                .cleanupDelayMs(getLong(duel, "cleanupDelayMs", d.getCleanupDelayMs()))
                .payoutPercent(getInt(duel, "payoutPercent", d.getPayoutPercent()))
                .historySize(getInt(duel, "historySize", d.getHistorySize()))
                .ruleset(getString(duel, "ruleset", d.getRuleset()))
                .build();
    }

    static AuditConfig parseAuditConfig(Map<String, Object> audit) throws ConfigurationException {
        AuditConfig d = AuditConfig.defaults();
        String level = getString(audit, "level", d.getLevel().name());
        AuditLevel parsedLevel;
        try {
            parsedLevel = AuditLevel.valueOf(level.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown audit level: " + level, e);
        }
        return AuditConfig.builder()
                .enabled(getBool(audit, "enabled", d.isEnabled()))
                .level(parsedLevel)
                .bufferSize(getInt(audit, "bufferSize", d.getBufferSize()))
                .flushIntervalMs(getLong(audit, "flushIntervalMs", d.getFlushIntervalMs()))
                .autoThrottleThresholdMs(getDouble(audit, "autoThrottleThresholdMs", d.getAutoThrottleThresholdMs()))
                .actorHistoryEnabled(getBool(audit, "actorHistory", d.isActorHistoryEnabled()))
                .actorHistorySize(getInt(audit, "actorHistorySize", d.getActorHistorySize()))
                .anomalyThresholdMs(getDouble(audit, "anomalyThresholdMs", d.getAnomalyThresholdMs()))
                .shadowMode(getBool(audit, "shadowMode", d.isShadowMode()))
                .maxComparisons(getInt(audit, "maxComparisons", d.getMaxComparisons()))
                .discrepancyThresholdMs(getDouble(audit, "discrepancyThresholdMs", d.getDiscrepancyThresholdMs()))
                .build();
    }

    static WeaponTimingTable parseWeapons(Map<String, Object> root) throws ConfigurationException {
        List<WeaponEntry> rows = new ArrayList<>();
        for (Map<String, Object> row : rows(root, "weapons")) {
            int itemId = getInt(row, "itemId", -1);
            if (itemId < 0) {
                throw new ConfigurationException("Weapon row without a valid itemId: " + row);
            }
            WeaponEntry fallback = WeaponEntry.DEFAULT;
            rows.add(new WeaponEntry(itemId,
                    getString(row, "name", "Item " + itemId),
                    getInt(row, "weaponSpeedValue", fallback.getWeaponSpeedValue()),
                    getInt(row, "weaponBaseMs", fallback.getWeaponBaseMs()),
                    getInt(row, "animationHitOffsetMs", fallback.getAnimationHitOffsetMs()),
                    getInt(row, "animationDurationMs", fallback.getAnimationDurationMs())));
        }
        return new WeaponTimingTable(rows);
    }

    static SpellTimingTable parseSpellTimings(Map<String, Object> root) throws ConfigurationException {
        List<SpellTimingData> rows = new ArrayList<>();
        for (Map<String, Object> row : rows(root, "spells")) {
            String name = getString(row, "name", "");
            if (name.isBlank()) {
                throw new ConfigurationException("Spell timing row without a name: " + row);
            }
            int base = getInt(row, "baseDelayMs", 0);
            rows.add(new SpellTimingData(name, base,
                    getInt(row, "perTileDelayMs", 0),
                    getInt(row, "perTargetDelayMs", 0),
                    getInt(row, "maxDelayMs", 0)));
        }
        return new SpellTimingTable(rows);
    }

    // YAML helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) throws ConfigurationException {
        Object val = root.get(key);
        if (val == null) return Collections.emptyMap();
        if (!(val instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) val;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> rows(Map<String, Object> root, String key) throws ConfigurationException {
        Object val = root.get(key);
        if (val == null) return Collections.emptyList();
        if (!(val instanceof List)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : (List<?>) val) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException("Entries of '" + key + "' must be mappings: " + item);
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) throws ConfigurationException {
        long value = getLong(map, key, defaultVal);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigurationException("'" + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultVal) throws ConfigurationException {
        Object val = map.get(key);
        if (val == null) return defaultVal;
        if (val instanceof Number) return ((Number) val).longValue();
        if (val instanceof String) {
            try {
                return Long.decode(((String) val).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("'" + key + "' must be a number: " + val, e);
            }
        }
        throw new ConfigurationException("'" + key + "' must be a number: " + val);
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultVal) throws ConfigurationException {
        Object val = map.get(key);
        if (val == null) return defaultVal;
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try {
                return Double.parseDouble(((String) val).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("'" + key + "' must be a number: " + val, e);
            }
        }
        throw new ConfigurationException("'" + key + "' must be a number: " + val);
    }

    private static boolean getBool(Map<String, Object> map, String key, boolean defaultVal) throws ConfigurationException {
        Object val = map.get(key);
        if (val == null) return defaultVal;
        if (val instanceof Boolean) return (Boolean) val;
        if (val instanceof String) {
            String s = ((String) val).trim();
            if (s.equalsIgnoreCase("true")) return true;
            if (s.equalsIgnoreCase("false")) return false;
        }
        throw new ConfigurationException("'" + key + "' must be true or false: " + val);
    }
}
