package habitkit.demo.extensions;

import habitkit.CompletionEntry;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Streak arithmetic over a habit's daily entries.
 */
public final class StreakCalculator {

    /** Milestones celebrated by the streak tracker. */
    public enum Achievement {
        GETTING_STARTED(3, "Getting Started", "3 days in a row!"),
        ONE_WEEK_WARRIOR(7, "One Week Warrior", "A full week!"),
        MONTHLY_MASTER(30, "Monthly Master", "30 days strong!"),
        CENTURY_CHAMPION(100, "Century Champion", "100 days! Incredible!"),
        YEAR_LONG_LEGEND(365, "Year-Long Legend", "A full year! You're a legend!");

        private final int days;
        private final String title;
        private final String message;

        Achievement(int days, String title, String message) {
            this.days = days;
            this.title = title;
            this.message = message;
        }

        public int days() {
            return days;
        }

        public String title() {
            return title;
        }

        public String message() {
            return message;
        }
    }

    /**
     * @param currentStreak    consecutive completed days ending on the reference day
     * @param bestStreak       longest run of consecutive completed days
     * @param totalCompletions completed entries
     */
    public record Streak(int currentStreak, int bestStreak, int totalCompletions) {
        public static final Streak NONE = new Streak(0, 0, 0);
    }

    private StreakCalculator() {
    }

    /**
     * Computes streaks from entries sorted oldest first. The current streak is zero
     * unless {@code today} itself is completed.
     */
    public static Streak calculate(List<CompletionEntry> entries, LocalDate today) {
        if (entries.isEmpty()) {
            return Streak.NONE;
        }

        int current = 0;
        LocalDate expected = today;
        for (int i = entries.size() - 1; i >= 0; i--) {
            CompletionEntry entry = entries.get(i);
            if (entry.date().isAfter(today)) {
                continue;
            }
            if (!entry.date().equals(expected) || !entry.completed()) {
                break;
            }
            current++;
            expected = expected.minusDays(1);
        }

        int best = 0;
        int run = 0;
        int total = 0;
        LocalDate previous = null;
        for (CompletionEntry entry : entries) {
            if (entry.date().isAfter(today)) {
                break;
            }
            if (entry.completed()) {
                total++;
                run = previous != null && previous.plusDays(1).equals(entry.date()) ? run + 1 : 1;
                previous = entry.date();
                best = Math.max(best, run);
            } else {
                run = 0;
                previous = null;
            }
        }
        return new Streak(current, Math.max(best, current), total);
    }

    /** The achievement unlocked by reaching exactly {@code streakLength} days, if any. */
    public static Optional<Achievement> achievementFor(int streakLength) {
        for (Achievement achievement : Achievement.values()) {
            if (achievement.days() == streakLength) {
                return Optional.of(achievement);
            }
        }
        return Optional.empty();
    }
}
