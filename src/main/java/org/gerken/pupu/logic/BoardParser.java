package org.gerken.pupu.logic;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.BoardState;
import org.gerken.pupu.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses level data and creates initial board states.
 *
 * Level data is a block of lines, one per playfield row from top to bottom,
 * with one symbol per cell. Leading and trailing whitespace is ignored, and so
 * are blank lines. A standard level has 12 rows of 12 symbols.
 *
 * Symbols:
 * H Heart, D Diamond, T Triangle, R Ring, 1 Cross #1, S Sandglass,
 * 2 Cross #2, F Frame, G Glass block, # Wall, P Background, . Empty
 *
 * Example (Level 93):
 * PPPPPPPPPPPP
 * PPPPPPPPPPPP
 * PPPPP##PPPPP
 * PPPP#.R#PPPP
 * PPP#..2R#PPP
 * PP#...S2F#PP
 * PP#...FS1#PP
 * PPP#..1R#PPP
 * PPPP#.F#PPPP
 * PPPPP##PPPPP
 * PPPPPPPPPPPP
 * PPPPPPPPPPPP
 *
 * The board is returned as written; no gravity or removal is applied.
 */
public class BoardParser {

    private static final Logger log = LoggerFactory.getLogger(BoardParser.class);

    /** Classpath location of the bundled sample level. */
    public static final String SAMPLE_LEVEL = "/levels/level93.txt";

    /**
     * Parses a level file and creates the initial BoardState.
     *
     * @param filename path to the level file
     * @return the initial board state
     * @throws IOException if file cannot be read
     * @throws LevelFormatException if the level data is invalid
     */
    public static BoardState parse(String filename) throws IOException {
        try (BufferedReader reader = new BufferedReader(new FileReader(filename, StandardCharsets.UTF_8))) {
            log.debug("Reading level file {}", filename);
            return new BoardState(parseBoard(readLines(reader), Board.STANDARD_ROWS, Board.STANDARD_COLUMNS));
        }
    }

    /**
     * Parses a level stored as a classpath resource.
     *
     * @param resource absolute resource path, e.g. {@link #SAMPLE_LEVEL}
     * @return the initial board state
     * @throws IOException if the resource is missing or cannot be read
     * @throws LevelFormatException if the level data is invalid
     */
    public static BoardState parseResource(String resource) throws IOException {
        InputStream in = BoardParser.class.getResourceAsStream(resource);
        if (in == null) {
            throw new FileNotFoundException("Level resource not found: " + resource);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            log.debug("Reading level resource {}", resource);
            return new BoardState(parseBoard(readLines(reader), Board.STANDARD_ROWS, Board.STANDARD_COLUMNS));
        }
    }

    /**
     * Parses inline level text of standard size. Rows are separated by line
     * breaks or by '/'.
     *
     * @param text the level text
     * @return the initial board state
     * @throws LevelFormatException if the level data is invalid
     */
    public static BoardState parseText(String text) {
        return new BoardState(parseText(text, Board.STANDARD_ROWS, Board.STANDARD_COLUMNS));
    }

    /**
     * Parses inline level text of the given size. Rows are separated by line
     * breaks or by '/'.
     *
     * @param text the level text
     * @param rows the required number of rows
     * @param cols the required number of symbols per row
     * @return the parsed board
     * @throws LevelFormatException if the level data is invalid
     */
    public static Board parseText(String text, int rows, int cols) {
        return parseBoard(Arrays.asList(text.split("[\\r\\n/]")), rows, cols);
    }

    /**
     * Builds a board from level lines. Lines are trimmed and blank lines are skipped.
     *
     * @param lines the level lines, top row first
     * @param rows the required number of rows
     * @param cols the required number of symbols per row
     * @return the parsed board
     * @throws InvalidLevelDimensionsException if the row or column count is wrong
     * @throws UnknownTileSymbolException if a symbol is not in the tile table
     */
    public static Board parseBoard(List<String> lines, int rows, int cols) {
        List<String> rowLines = new ArrayList<>();
        for (String line : lines) {
            line = line.trim();
            if (!line.isEmpty()) {
                rowLines.add(line);
            }
        }

        if (rowLines.size() != rows) {
            throw new InvalidLevelDimensionsException("rows", rows, rowLines.size());
        }

        Board board = new Board(rows, cols);
        for (int row = 0; row < rows; row++) {
            String line = rowLines.get(row);
            if (line.length() != cols) {
                throw new InvalidLevelDimensionsException("symbols in row " + (char) ('A' + row), cols, line.length());
            }
            for (int col = 0; col < cols; col++) {
                char symbol = line.charAt(col);
                Tile tile = Tile.fromSymbol(symbol);
                if (tile == null) {
                    throw new UnknownTileSymbolException(symbol, row, col);
                }
                board.setTile(row, col, tile);
            }
        }

        log.debug("Parsed {}x{} level with {} erasable tiles", rows, cols, board.getErasableTileCount());
        return board;
    }

    private static List<String> readLines(BufferedReader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return lines;
    }
}
