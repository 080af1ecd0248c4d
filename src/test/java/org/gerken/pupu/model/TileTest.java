package org.gerken.pupu.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

class TileTest {

    @Test
    void everySymbolMapsBackToItsTile() {
        for (Tile tile : Tile.values()) {
            assertSame(tile, Tile.fromSymbol(tile.getSymbol()));
        }
    }

    @Test
    void unknownSymbolHasNoTile() {
        assertNull(Tile.fromSymbol('X'));
        assertNull(Tile.fromSymbol(' '));
    }

    @Test
    void gamePiecesAreMobileAndErasable() {
        Tile[] pieces = {Tile.HEART, Tile.DIAMOND, Tile.TRIANGLE, Tile.RING,
                         Tile.CROSS_1, Tile.SANDGLASS, Tile.CROSS_2, Tile.FRAME};
        assertEquals(Tile.ERASABLE_KINDS, pieces.length);
        for (int i = 0; i < pieces.length; i++) {
            assertEquals(i, pieces[i].ordinal(), "erasable kinds are indexed 0..7");
            assertTrue(pieces[i].isMobile());
            assertTrue(pieces[i].isErasable());
        }
    }

    @Test
    void glassBlockFallsButNeverMatches() {
        assertTrue(Tile.GLASS_BLOCK.isMobile());
        assertFalse(Tile.GLASS_BLOCK.isErasable());
    }

    @Test
    void scenerySitsStill() {
        for (Tile tile : new Tile[]{Tile.WALL, Tile.BACKGROUND, Tile.EMPTY}) {
            assertFalse(tile.isMobile(), tile + " must not move");
            assertFalse(tile.isErasable(), tile + " must not be erased");
        }
    }
}
