package com.example.spherecombat.audit;

/**
 * The attack interval two timing providers gave for the same actor and weapon.
 */
public final class TimingComparison {

    private final long timestamp;
    private final long actorSerial;
    private final String actorName;
    private final int weaponId;
    private final String weaponName;
    private final int dexterity;
    private final String primaryProvider;
    private final int primaryMs;
    private final String shadowProvider;
    private final int shadowMs;

    public TimingComparison(long timestamp, long actorSerial, String actorName, int weaponId, String weaponName,
                            int dexterity, String primaryProvider, int primaryMs, String shadowProvider, int shadowMs) {
        this.timestamp = timestamp;
        this.actorSerial = actorSerial;
        this.actorName = actorName;
        this.weaponId = weaponId;
        this.weaponName = weaponName;
        this.dexterity = dexterity;
        this.primaryProvider = primaryProvider;
        this.primaryMs = primaryMs;
        this.shadowProvider = shadowProvider;
        this.shadowMs = shadowMs;
    }

    public long getTimestamp() { return timestamp; }
    public long getActorSerial() { return actorSerial; }
    public String getActorName() { return actorName; }
    public int getWeaponId() { return weaponId; }
    public String getWeaponName() { return weaponName; }
    public int getDexterity() { return dexterity; }
    public String getPrimaryProvider() { return primaryProvider; }
    public int getPrimaryMs() { return primaryMs; }
    public String getShadowProvider() { return shadowProvider; }
    public int getShadowMs() { return shadowMs; }

    /** Absolute difference between the two intervals */
    public int getVarianceMs() {
        return Math.abs(primaryMs - shadowMs);
    }

    @Override
    public String toString() {
        return String.format("%s (%d dex) %s: %dms vs %s: %dms (diff %dms)",
                weaponName, dexterity, primaryProvider, primaryMs, shadowProvider, shadowMs, getVarianceMs());
    }
}
