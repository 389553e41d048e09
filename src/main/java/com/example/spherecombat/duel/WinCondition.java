package com.example.spherecombat.duel;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome check over the standing participants of a duel.
 */
public final class WinCondition {

    private final boolean decided;
    private final boolean draw;
    private final DuelParticipant winner;
    private final int winningTeam;

    private WinCondition(boolean decided, boolean draw, DuelParticipant winner, int winningTeam) {
        this.decided = decided;
        this.draw = draw;
        this.winner = winner;
        this.winningTeam = winningTeam;
    }

    public static WinCondition undecided() {
        return new WinCondition(false, false, null, -1);
    }

    public static WinCondition drawn() {
        return new WinCondition(true, true, null, -1);
    }

    public static WinCondition won(DuelParticipant winner, int winningTeam) {
        return new WinCondition(true, false, winner, winningTeam);
    }

    /**
     * Team duels: a team wins when the other has nobody standing and it still does.
     * Solo duels: the last one standing wins; nobody standing is a draw.
     */
    public static WinCondition evaluate(DuelContext context) {
        List<DuelParticipant> standing = new ArrayList<>();
        for (DuelParticipant p : context.getParticipants()) {
            if (p.isStanding()) standing.add(p);
        }

        if (context.getType().isTeam()) {
            int team0 = 0;
            int team1 = 0;
            for (DuelParticipant p : standing) {
                if (p.getTeamId() == 0) team0++; else team1++;
            }
            if (team0 == 0 && team1 == 0) return drawn();
            if (team1 == 0) return won(firstOfTeam(standing, 0), 0);
            if (team0 == 0) return won(firstOfTeam(standing, 1), 1);
            return undecided();
        }

        if (standing.isEmpty()) return drawn();
        if (standing.size() == 1) {
            DuelParticipant last = standing.get(0);
            return won(last, last.getTeamId());
        }
        return undecided();
    }

    private static DuelParticipant firstOfTeam(List<DuelParticipant> standing, int team) {
        for (DuelParticipant p : standing) {
            if (p.getTeamId() == team) return p;
        }
        return null;
    }

    public boolean isDecided() { return decided; }
    public boolean isDraw() { return draw; }
    public DuelParticipant getWinner() { return winner; }
    public int getWinningTeam() { return winningTeam; }

    @Override
    public String toString() {
        if (!decided) return "Undecided";
        if (draw) return "Draw";
        return "Won by team " + winningTeam + (winner != null ? " (" + winner.getName() + ")" : "");
    }
}
