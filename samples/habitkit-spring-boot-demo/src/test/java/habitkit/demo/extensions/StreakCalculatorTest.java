package habitkit.demo.extensions;

import habitkit.CompletionEntry;
import habitkit.demo.extensions.StreakCalculator.Achievement;
import habitkit.demo.extensions.StreakCalculator.Streak;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class StreakCalculatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Test
    void noEntries() {
        assertSame(Streak.NONE, StreakCalculator.calculate(List.of(), TODAY));
    }

    @Test
    void consecutiveDaysEndingToday() {
        Streak streak = StreakCalculator.calculate(completedDays(TODAY.minusDays(4), 5), TODAY);

        assertEquals(new Streak(5, 5, 5), streak);
    }

    @Test
    void currentStreakRequiresToday() {
        Streak streak = StreakCalculator.calculate(completedDays(TODAY.minusDays(5), 5), TODAY);

        assertEquals(0, streak.currentStreak());
        assertEquals(5, streak.bestStreak());
        assertEquals(5, streak.totalCompletions());
    }

    @Test
    void gapResetsRun() {
        List<CompletionEntry> entries = new ArrayList<>(completedDays(TODAY.minusDays(10), 4));
        entries.addAll(completedDays(TODAY.minusDays(1), 2));

        Streak streak = StreakCalculator.calculate(entries, TODAY);

        assertEquals(2, streak.currentStreak());
        assertEquals(4, streak.bestStreak());
        assertEquals(6, streak.totalCompletions());
    }

    @Test
    void incompleteEntryBreaksStreak() {
        List<CompletionEntry> entries = List.of(
                CompletionEntry.completed(TODAY.minusDays(2)),
                CompletionEntry.progress(TODAY.minusDays(1), 2, false),
                CompletionEntry.completed(TODAY));

        Streak streak = StreakCalculator.calculate(entries, TODAY);

        assertEquals(1, streak.currentStreak());
        assertEquals(1, streak.bestStreak());
        assertEquals(2, streak.totalCompletions());
    }

    @Test
    void futureEntriesIgnored() {
        List<CompletionEntry> entries = List.of(
                CompletionEntry.completed(TODAY),
                CompletionEntry.completed(TODAY.plusDays(1)));

        assertEquals(new Streak(1, 1, 1), StreakCalculator.calculate(entries, TODAY));
    }

    @Test
    void achievementsAtMilestonesOnly() {
        assertEquals(Optional.of(Achievement.GETTING_STARTED), StreakCalculator.achievementFor(3));
        assertEquals(Optional.of(Achievement.ONE_WEEK_WARRIOR), StreakCalculator.achievementFor(7));
        assertEquals(Optional.of(Achievement.YEAR_LONG_LEGEND), StreakCalculator.achievementFor(365));
        assertEquals(Optional.empty(), StreakCalculator.achievementFor(8));
        assertEquals("Monthly Master", StreakCalculator.achievementFor(30).orElseThrow().title());
    }

    private static List<CompletionEntry> completedDays(LocalDate first, int count) {
        List<CompletionEntry> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entries.add(CompletionEntry.completed(first.plusDays(i)));
        }
        return entries;
    }
}
