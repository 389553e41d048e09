package com.example.spherecombat.duel;

/**
 * Answer to a challenge request: either the pending challenge or the reason it was refused.
 */
public class ChallengeResult {

    private final boolean accepted;
    private final String reason;
    private final PendingChallenge challenge;

    private ChallengeResult(boolean accepted, String reason, PendingChallenge challenge) {
        this.accepted = accepted;
        this.reason = reason;
        this.challenge = challenge;
    }

    // Static factory methods

    public static ChallengeResult issued(PendingChallenge challenge) {
        return new ChallengeResult(true, null, challenge);
    }

    public static ChallengeResult rejected(String reason) {
        return new ChallengeResult(false, reason, null);
    }

    public boolean isIssued() { return accepted; }
    public String getReason() { return reason; }
    public PendingChallenge getChallenge() { return challenge; }

    @Override
    public String toString() {
        return accepted ? "Issued " + challenge : "Rejected: " + reason;
    }
}
