package com.riichimahjong.engine;

import com.riichimahjong.model.Suit;
import com.riichimahjong.model.Tile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 牌码解析测试
 */
class TileParserTest {

    @Test
    void testParseMixedNotation() {
        List<Tile> tiles = TileParser.parseTiles("123m406p11z");

        assertEquals(8, tiles.size(), "应该解析出 8 张牌");
        assertEquals(new Tile(Suit.MANZU, 1), tiles.get(0));
        assertEquals(new Tile(Suit.PINZU, 4), tiles.get(3));
        // 0p 是赤五筒
        assertTrue(tiles.get(4).isRed());
        assertEquals(5, tiles.get(4).getRank());
        assertEquals(Suit.PINZU, tiles.get(4).getSuit());
        assertEquals(Suit.WIND, tiles.get(6).getSuit());
    }

    @Test
    void testHonorCodes() {
        assertEquals(new Tile(Suit.WIND, 4), TileParser.parseTile("4z"), "4z 是北");
        assertEquals(new Tile(Suit.DRAGON, 1), TileParser.parseTile("5z"), "5z 是白");
        assertEquals(new Tile(Suit.DRAGON, 3), TileParser.parseTile("7z"), "7z 是中");
    }

    @Test
    void testCodeMatchesNotation() {
        String notation = "0m9p0s1z7z";
        StringBuilder codes = new StringBuilder();
        for (Tile tile : TileParser.parseTiles(notation)) {
            codes.append(tile.getCode());
        }
        assertEquals("0m9p0s1z7z", codes.toString());
    }

    @Test
    void testInvalidNotation() {
        assertThrows(IllegalArgumentException.class, () -> TileParser.parseTiles("8z"), "字牌没有 8z");
        assertThrows(IllegalArgumentException.class, () -> TileParser.parseTiles("123"), "缺少花色");
        assertThrows(IllegalArgumentException.class, () -> TileParser.parseTiles("m"), "缺少数字");
        assertThrows(IllegalArgumentException.class, () -> TileParser.parseTiles("12x"), "未知花色");
        assertThrows(IllegalArgumentException.class, () -> TileParser.parseTile("12m"), "单张牌码只能有一张");
    }

    @Test
    void testRedFiveIsSameKind() {
        Tile red = TileParser.parseTile("0s");
        Tile normal = TileParser.parseTile("5s");

        assertTrue(red.isSameAs(normal));
        assertNotEquals(red, normal, "赤牌与普通牌不相等");
        assertEquals(normal, red.kind());
    }
}
