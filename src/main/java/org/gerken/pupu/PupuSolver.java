package org.gerken.pupu;

import org.gerken.pupu.invalidity.InvalidityTestCoordinator;
import org.gerken.pupu.logic.BoardParser;
import org.gerken.pupu.logic.LevelFormatException;
import org.gerken.pupu.logic.PendingStates;
import org.gerken.pupu.logic.ProgressReporter;
import org.gerken.pupu.logic.SearchResult;
import org.gerken.pupu.logic.SolutionReplayer;
import org.gerken.pupu.logic.StateProcessor;
import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.BoardState;
import org.gerken.pupu.model.Move;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Main class for the Pupu Puzzle Solver.
 * Finds a sequence of slides that clears every erasable tile from a falling-block playfield.
 *
 * Architecture:
 * - Breadth-first search over stable boards, driven by StateProcessor
 * - PendingStates holds the FIFO queue, the set of boards already seen and the counters
 * - TransitionEngine applies a slide and resolves gravity and removals
 * - Invalidity tests prune boards that can never be cleared
 * - Progress reporter provides periodic status updates from a daemon thread
 *
 * Usage:
 *   java PupuSolver [options] <level-file>
 *   java PupuSolver [options] -l <level-text>
 *   java PupuSolver [options] --sample
 *
 * Options:
 *   -r <seconds>     Progress report interval (default: 30, 0 to disable)
 *   -m <states>      Stop after this many distinct boards (default: 0, no limit)
 *   -s               Print every board of the solution
 *
 * Examples:
 *   java PupuSolver level93.txt
 *   java PupuSolver -r 5 -m 5000000 level93.txt
 */
public class PupuSolver {

    private static final int DEFAULT_REPORT_INTERVAL = 30; // seconds
    private static final long DEFAULT_MAX_STATES = 0; // unlimited

    private final Config config;
    private PendingStates pendingStates;

    /**
     * Creates a new solver with the given configuration.
     *
     * @param config the solver configuration
     */
    public PupuSolver(Config config) {
        this.config = config;
    }

    /**
     * Gets the pending states container of the most recent search.
     *
     * @return the pending states, or null before the first search
     */
    public PendingStates getPendingStates() {
        return pendingStates;
    }

    /**
     * Gets the configured report interval.
     *
     * @return the report interval in seconds
     */
    public int getReportInterval() {
        return config.reportInterval;
    }

    /**
     * Gets the configured limit on distinct boards.
     *
     * @return the limit, or 0 for no limit
     */
    public long getMaxStates() {
        return config.maxStates;
    }

    /**
     * Main entry point for the solver.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        // Parse command-line arguments
        Config config = parseArguments(args);

        if (config == null) {
            printUsage();
            System.exit(1);
        }

        // Print header
        printHeader(config);

        try {
            // Load and parse the level
            BoardState initialState = loadLevel(config);
            System.out.println("Level loaded successfully.");
            System.out.println(initialState.getBoard());
            System.out.println("Erasable tiles: " + initialState.getBoard().getErasableTileCount());
            System.out.println();

            PupuSolver solver = new PupuSolver(config);
            SearchResult result = solver.solve(initialState);

            switch (result.getOutcome()) {
                case SOLVED:
                    printSolution(result, initialState, config);
                    System.exit(0);
                    break;
                case STATE_LIMIT_REACHED:
                    System.out.println("State limit of " + config.maxStates + " boards reached before a solution was found.");
                    System.exit(1);
                    break;
                default:
                    System.out.println("No solution found.");
                    System.exit(1);
            }

        } catch (LevelFormatException e) {
            System.err.println("Bad level data: " + e.getMessage());
            printLevelHelp();
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Error reading level file: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Error solving puzzle: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Solves the puzzle using breadth-first search with pruning.
     * Runs in the calling thread; only the progress reporter runs alongside it.
     *
     * @param initialState the starting board state
     * @return the result of the search
     */
    public SearchResult solve(BoardState initialState) {
        this.pendingStates = new PendingStates();
        StateProcessor processor = new StateProcessor(pendingStates, config.maxStates);

        // Create and start progress reporter thread (unless disabled)
        ProgressReporter reporter = null;
        Thread reporterThread = null;
        if (config.reportInterval > 0) {
            reporter = new ProgressReporter(pendingStates, config.reportInterval);
            reporterThread = new Thread(reporter, "progress-reporter");
            reporterThread.setDaemon(true);
            reporterThread.start();
        }

        SearchResult result = processor.search(initialState);
        if (reporterThread != null) {
            reporterThread.interrupt();
        }

        // Print final summary (if reporting enabled)
        if (reporter != null) {
            reporter.printFinalSummary(result);
        }
        return result;
    }

    /**
     * Loads the initial state from the source selected on the command line.
     */
    private static BoardState loadLevel(Config config) throws IOException {
        if (config.useSample) {
            System.out.println("Loading bundled sample level (Level 93)");
            return BoardParser.parseResource(BoardParser.SAMPLE_LEVEL);
        } else if (config.levelText != null) {
            System.out.println("Loading level from command line");
            return BoardParser.parseText(config.levelText);
        } else {
            System.out.println("Loading level from: " + config.levelFile);
            return BoardParser.parse(config.levelFile);
        }
    }

    /**
     * Prints the solution (sequence of moves) to console and, when the level came
     * from a file, writes it to a solution file.
     * If level file is "name.txt", solution file will be "name.solution.txt".
     *
     * @param result the solved search result
     * @param initialState the initial state the search started from
     * @param config the solver configuration
     */
    private static void printSolution(SearchResult result, BoardState initialState, Config config) {
        List<Move> moves = result.getMoves();
        List<Board> boards = SolutionReplayer.replay(initialState.getBoard(), moves);

        System.out.println("\nSOLUTION FOUND!");
        System.out.println("Number of moves: " + moves.size());
        System.out.println("\nMove sequence:");

        for (int i = 0; i < moves.size(); i++) {
            Move move = moves.get(i);
            System.out.printf("Step %d: %s  %s%n", i + 1, move.getCoordinates(), move.getNotation());
            if (config.printSteps) {
                System.out.println(boards.get(i + 1));
                System.out.println();
            }
        }

        if (config.levelFile == null) {
            return;
        }

        try {
            String solutionFile = writeSolutionFile(config.levelFile, moves, boards);
            System.out.println("\nSolution written to: " + solutionFile);
        } catch (IOException e) {
            System.err.println("Warning: Could not write solution file: " + e.getMessage());
        }
    }

    /**
     * Writes the move list and the board after every move next to the level file.
     *
     * @param levelFile the level file the solution belongs to
     * @param moves the solution moves
     * @param boards the initial board followed by the board after each move
     * @return the path of the written file
     * @throws IOException if the file cannot be written
     */
    static String writeSolutionFile(String levelFile, List<Move> moves, List<Board> boards) throws IOException {
        String solutionFile = getSolutionFilePath(levelFile);
        try (PrintWriter writer = new PrintWriter(new FileWriter(solutionFile, StandardCharsets.UTF_8))) {
            writer.println("# Pupu Puzzle Solution");
            writer.println("# Level: " + levelFile);
            writer.println("# Moves: " + moves.size());
            writer.println();

            // Section 1: Move sequence
            writer.println("Move sequence:");
            for (int i = 0; i < moves.size(); i++) {
                writer.printf("Step %d: %s  %s%n", i + 1, moves.get(i).getCoordinates(), moves.get(i).getNotation());
            }

            // Section 2: Moves with board states
            writer.println();
            writer.println("=".repeat(60));
            writer.println("Step-by-step board states:");
            writer.println("=".repeat(60));

            writer.println();
            writer.println("Initial state:");
            writer.println(boards.get(0));

            for (int i = 0; i < moves.size(); i++) {
                writer.println();
                writer.printf("After move %d: %s%n", i + 1, moves.get(i).getNotation());
                writer.println(boards.get(i + 1));
            }

            if (writer.checkError()) {
                throw new IOException("Failed writing " + solutionFile);
            }
        }
        return solutionFile;
    }

    /**
     * Computes the solution file path for a given level file.
     * If level file is "name.txt", solution file is "name.solution.txt".
     *
     * @param levelFile the level file path
     * @return the solution file path
     */
    static String getSolutionFilePath(String levelFile) {
        if (levelFile.endsWith(".txt")) {
            return levelFile.substring(0, levelFile.length() - 4) + ".solution.txt";
        }
        return levelFile + ".solution.txt";
    }

    /**
     * Parses command-line arguments.
     *
     * @return the configuration, or null if the arguments are invalid or help was requested
     */
    static Config parseArguments(String[] args) {
        Config config = new Config();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if (arg.equals("-r") || arg.equals("--report")) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a value");
                    return null;
                }
                try {
                    config.reportInterval = Integer.parseInt(args[++i]);
                    if (config.reportInterval < 0) {
                        System.err.println("Error: report interval must be non-negative (0 to disable)");
                        return null;
                    }
                } catch (NumberFormatException e) {
                    System.err.println("Error: invalid report interval: " + args[i]);
                    return null;
                }
            } else if (arg.equals("-m") || arg.equals("--max-states")) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a value");
                    return null;
                }
                try {
                    config.maxStates = Long.parseLong(args[++i]);
                    if (config.maxStates < 0) {
                        System.err.println("Error: state limit must be non-negative (0 for no limit)");
                        return null;
                    }
                } catch (NumberFormatException e) {
                    System.err.println("Error: invalid state limit: " + args[i]);
                    return null;
                }
            } else if (arg.equals("-l") || arg.equals("--level")) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a value");
                    return null;
                }
                config.levelText = args[++i];
            } else if (arg.equals("--sample")) {
                config.useSample = true;
            } else if (arg.equals("-s") || arg.equals("--steps")) {
                config.printSteps = true;
            } else if (arg.equals("-h") || arg.equals("--help")) {
                return null; // Will trigger usage message
            } else if (arg.startsWith("-")) {
                System.err.println("Error: unknown option: " + arg);
                return null;
            } else {
                // Assume it's the level file
                if (config.levelFile != null) {
                    System.err.println("Error: multiple level files specified");
                    return null;
                }
                config.levelFile = arg;
            }
        }

        // Exactly one level source
        int sources = (config.levelFile != null ? 1 : 0)
            + (config.levelText != null ? 1 : 0)
            + (config.useSample ? 1 : 0);
        if (sources == 0) {
            System.err.println("Error: no level specified");
            return null;
        }
        if (sources > 1) {
            System.err.println("Error: use only one of <level-file>, --level and --sample");
            return null;
        }

        return config;
    }

    /**
     * Prints usage information.
     */
    private static void printUsage() {
        System.out.println("Pupu Puzzle Solver");
        System.out.println();
        System.out.println("Usage: java -jar pupu-solver.jar [options] <level-file>");
        System.out.println("       java -jar pupu-solver.jar [options] -l <level-text>");
        System.out.println("       java -jar pupu-solver.jar [options] --sample");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -l, --level <text>      Level data inline, rows separated by newlines or '/'");
        System.out.println("  --sample                Solve the bundled Level 93 sample");
        System.out.println("  -r, --report <N>        Progress report interval in seconds (default: 30, 0 to disable)");
        System.out.println("  -m, --max-states <N>    Give up after N distinct boards (default: 0, no limit)");
        System.out.println("  -s, --steps             Print the board after every move of the solution");
        System.out.println("  -h, --help              Show this help message");
        System.out.println();
        printLevelHelp();
        System.out.println();
        System.out.println("Example:");
        System.out.println("  java -jar pupu-solver.jar -r 10 level93.txt");
    }

    /**
     * Prints the level data format.
     */
    private static void printLevelHelp() {
        System.out.println("Level data needs to be " + Board.STANDARD_ROWS + " lines of "
            + Board.STANDARD_COLUMNS + " characters per line.");
        System.out.println();
        System.out.println("Valid characters:");
        System.out.println("  'H' -> Heart tile         'D' -> Diamond tile");
        System.out.println("  'T' -> Triangle tile      'R' -> Ring tile");
        System.out.println("  '1' -> Cross #1 tile      'S' -> Sandglass tile");
        System.out.println("  '2' -> Cross #2 tile      'F' -> Frame tile");
        System.out.println("  'G' -> Glass block        '#' -> Wall");
        System.out.println("  'P' -> Background         '.' -> Empty");
    }

    /**
     * Prints application header.
     */
    private static void printHeader(Config config) {
        System.out.println("=".repeat(80));
        System.out.println("Pupu Puzzle Solver");
        System.out.println("Breadth-first search with duplicate detection and pruning");
        System.out.println("=".repeat(80));
        System.out.println("Configuration:");
        System.out.println("  Report interval: " + (config.reportInterval > 0 ? config.reportInterval + " seconds" : "disabled"));
        System.out.println("  State limit: " + (config.maxStates > 0 ? config.maxStates + " boards" : "none"));
        System.out.println("  Invalidity tests: " +
            InvalidityTestCoordinator.getInstance().getTestCount());
        System.out.println("=".repeat(80));
        System.out.println();
    }

    /**
     * Configuration holder.
     */
    public static class Config {
        String levelFile;
        String levelText;
        boolean useSample;
        int reportInterval = DEFAULT_REPORT_INTERVAL;
        long maxStates = DEFAULT_MAX_STATES;
        boolean printSteps;

        /**
         * Sets the progress report interval.
         *
         * @param seconds seconds between reports, 0 to disable reporting
         * @return this configuration
         */
        public Config withReportInterval(int seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("Report interval must be non-negative: " + seconds);
            }
            this.reportInterval = seconds;
            return this;
        }

        /**
         * Sets the limit on distinct boards.
         *
         * @param maxStates the limit, 0 for no limit
         * @return this configuration
         */
        public Config withMaxStates(long maxStates) {
            if (maxStates < 0) {
                throw new IllegalArgumentException("State limit must be non-negative: " + maxStates);
            }
            this.maxStates = maxStates;
            return this;
        }
    }
}
