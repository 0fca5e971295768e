package com.pvp.battlesim;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pvp.battlesim.ai.DecisionMode;
import com.pvp.battlesim.battle.BattleConfig;
import com.pvp.battlesim.battle.BattleResult;
import com.pvp.battlesim.battle.Side;
import com.pvp.battlesim.battle.TimelineEvent;
import com.pvp.battlesim.combatant.Combatant;
import com.pvp.battlesim.config.Matchup;
import com.pvp.battlesim.config.MatchupException;
import com.pvp.battlesim.config.MatchupLoader;
import com.pvp.battlesim.rng.BattleRng;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;

/**
 * PvP battle simulator CLI - Main entry point.
 */
@Command(name = "pvp-battle-sim",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Turn-based PvP battle simulator",
        subcommands = {
                Main.SimulateCommand.class,
                Main.BatchCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Options shared by both commands.
     */
    static class MatchupOptions {
        @Parameters(index = "0", description = "Matchup JSON file")
        String matchupPath;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-m", "--mode"},
                description = "Decision mode: smart, random or weighted_random (overrides the file)")
        String mode;

        @Option(names = {"--shields"}, split = ",",
                description = "Starting shields, one value for both sides or two comma-separated")
        List<Integer> shields;

        @Option(names = {"--max-turns"},
                description = "Tick cap (overrides the file)")
        Integer maxTurns;

        @Option(names = {"-v", "--verbose"},
                description = "Log decisions and battle events")
        boolean verbose;

        /**
         * Load the matchup and apply overrides, or print the failure and return null.
         */
        Matchup load() {
            if (verbose) {
                // Must run before any logger is created
                System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
            }
            Matchup matchup;
            try {
                matchup = MatchupLoader.fromFile(matchupPath);
                System.err.println("✓ Loaded " + matchup.one().getId() + " vs " + matchup.two().getId()
                        + " from " + matchupPath);
            } catch (MatchupException e) {
                System.err.println("✗ Failed to load matchup: " + e.getMessage());
                return null;
            }

            BattleConfig config = matchup.config();
            try {
                if (mode != null) {
                    config = config.withMode(DecisionMode.fromName(mode));
                }
                if (shields != null && !shields.isEmpty()) {
                    int one = shields.get(0);
                    int two = shields.size() > 1 ? shields.get(1) : one;
                    config = config.withShields(one, two);
                }
                if (maxTurns != null) {
                    config = config.withMaxTurns(maxTurns);
                }
            } catch (IllegalArgumentException e) {
                System.err.println("✗ Invalid option: " + e.getMessage());
                return null;
            }
            return matchup.withConfig(config);
        }

        BattleRng rng() {
            return seed != null ? new BattleRng(seed) : new BattleRng();
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Simulate one battle")
    static class SimulateCommand implements Callable<Integer> {
        @Mixin
        MatchupOptions options;

        @Option(names = {"-t", "--timeline"},
                description = "Print every resolved action")
        boolean timeline;

        @Option(names = {"--json"},
                description = "Print the result as JSON")
        boolean json;

        @Override
        public Integer call() throws Exception {
            Matchup matchup = options.load();
            if (matchup == null) {
                return 1;
            }
            if (timeline) {
                matchup = matchup.withConfig(matchup.config().withTimeline(true));
            }

            BattleRng rng = options.rng();
            BattleResult result = matchup.newBattle(rng).simulate();

            if (json) {
                printJson(result);
            } else {
                printResult(matchup, result, rng.getSeed());
            }
            return 0;
        }
    }

    // ========== BATCH COMMAND ==========
    @Command(name = "batch", description = "Simulate many seeded battles in parallel")
    static class BatchCommand implements Callable<Integer> {
        @Mixin
        MatchupOptions options;

        @Option(names = {"-n", "--num-battles"}, defaultValue = "1000",
                description = "Number of battles to simulate")
        int numBattles;

        @Override
        public Integer call() throws Exception {
            Matchup matchup = options.load();
            if (matchup == null) {
                return 1;
            }
            if (numBattles <= 0) {
                System.err.println("✗ Number of battles must be positive");
                return 1;
            }

            BattleRng base = options.rng();
            System.out.println("\n=== PvP Battle Batch ===\n");
            System.out.println("Matchup: " + describe(matchup.one()) + " vs " + describe(matchup.two()));
            System.out.println("Mode: " + matchup.config().mode().getName());
            System.out.println("Battles: " + numBattles);
            System.out.println("Base seed: " + base.getSeed());
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<BattleResult> results = runBattles(matchup, base, numBattles);
            long elapsed = System.currentTimeMillis() - startTime;

            printSummary(matchup, results, elapsed);
            return 0;
        }
    }

    /**
     * Run battles in parallel; battle i uses the base generator forked with index i.
     */
    static List<BattleResult> runBattles(Matchup matchup, BattleRng base, int count) {
        return IntStream.range(0, count)
                .parallel()
                .mapToObj(i -> matchup.newBattle(base.fork(i)).simulate())
                .toList();
    }

    // ========== OUTPUT ==========

    private static String describe(Combatant combatant) {
        return combatant.getName() + " (CP " + combatant.getCombatPower() + ")";
    }

    private static void printResult(Matchup matchup, BattleResult result, long seed) {
        Combatant one = matchup.one();
        Combatant two = matchup.two();

        System.out.println("\n=== PvP Battle ===\n");
        System.out.println("Side one: " + describe(one));
        System.out.println("Side two: " + describe(two));
        System.out.println("Shields: " + matchup.config().shieldsOne() + "v" + matchup.config().shieldsTwo());
        System.out.println("Seed: " + seed);
        System.out.println();

        if (!result.timeline().isEmpty()) {
            System.out.println("=== Timeline ===\n");
            for (TimelineEvent event : result.timeline()) {
                String actor = event.actor() == Side.ONE ? one.getId() : two.getId();
                System.out.printf("  Turn %3d: %-12s %-8s %-16s %4d dmg%s%s  (energy %d)%n",
                        event.turn(), actor, event.kind(), event.moveId(), event.damage(),
                        event.shielded() ? " [shielded]" : "",
                        event.buffApplied() ? " [buff]" : "",
                        event.energyAfter());
            }
            System.out.println();
        }

        System.out.println("=== Result ===\n");
        String winner = result.isDraw() ? "Draw"
                : (result.winner() == Side.ONE ? one.getName() : two.getName());
        System.out.println("Winner: " + winner);
        System.out.printf("HP: %d/%d vs %d/%d%n", result.hpOne(), one.getMaxHp(), result.hpTwo(), two.getMaxHp());
        System.out.printf("Rating: %d vs %d%n", result.ratingOne(), result.ratingTwo());
        System.out.printf("Turns: %d (%.1fs remaining)%n", result.turns(), result.timeRemainingMs() / 1000.0);
    }

    private static void printJson(BattleResult result) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper();
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }

    private static void printSummary(Matchup matchup, List<BattleResult> results, long elapsedMs) {
        int count = results.size();
        long winsOne = results.stream().filter(r -> r.winner() == Side.ONE).count();
        long winsTwo = results.stream().filter(r -> r.winner() == Side.TWO).count();
        long draws = results.stream().filter(BattleResult::isDraw).count();
        double meanRatingOne = results.stream().mapToInt(BattleResult::ratingOne).average().orElse(0.0);
        double meanRatingTwo = results.stream().mapToInt(BattleResult::ratingTwo).average().orElse(0.0);
        double meanTurns = results.stream().mapToInt(BattleResult::turns).average().orElse(0.0);

        System.out.println("=== Results ===\n");
        System.out.printf("%s wins: %5.1f%% (%d/%d)%n", matchup.one().getName(),
                winsOne * 100.0 / count, winsOne, count);
        System.out.printf("%s wins: %5.1f%% (%d/%d)%n", matchup.two().getName(),
                winsTwo * 100.0 / count, winsTwo, count);
        System.out.printf("Draws: %5.1f%% (%d/%d)%n", draws * 100.0 / count, draws, count);
        System.out.printf("Mean rating: %.1f vs %.1f%n", meanRatingOne, meanRatingTwo);
        System.out.printf("Mean turns: %.1f%n", meanTurns);
        System.out.println();

        double elapsedSec = elapsedMs / 1000.0;
        double battlesPerSec = elapsedSec > 0 ? count / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f battles/sec)%n", elapsedSec, battlesPerSec);
    }
}
