package com.riichimahjong.engine;

import com.riichimahjong.model.Suit;
import com.riichimahjong.model.Tile;

import java.util.ArrayList;
import java.util.List;

/**
 * 牌码解析。
 * <ul>
 *   <li>万：1m～9m，筒：1p～9p，索：1s～9s</li>
 *   <li>赤五：0m / 0p / 0s</li>
 *   <li>字牌：1z～7z（东 南 西 北 白 发 中）</li>
 * </ul>
 * 同花色可以连写，例如 {@code 123m406p789s11z}。
 */
public final class TileParser {

    private TileParser() {
    }

    /**
     * 解析连写的牌码串，格式错误时抛出 IllegalArgumentException
     */
    public static List<Tile> parseTiles(String notation) {
        List<Tile> tiles = new ArrayList<>();
        if (notation == null) {
            return tiles;
        }
        String s = notation.replace(" ", "").trim().toLowerCase();
        List<Character> pendingDigits = new ArrayList<>();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') {
                pendingDigits.add(c);
                continue;
            }
            if (pendingDigits.isEmpty()) {
                throw new IllegalArgumentException("花色 '" + c + "' 前缺少数字：" + notation);
            }
            for (char digit : pendingDigits) {
                tiles.add(toTile(digit - '0', c, notation));
            }
            pendingDigits.clear();
        }
        if (!pendingDigits.isEmpty()) {
            throw new IllegalArgumentException("牌码末尾缺少花色：" + notation);
        }
        return tiles;
    }

    /**
     * 解析单张牌码，如 "5m"、"0p"、"7z"
     */
    public static Tile parseTile(String code) {
        List<Tile> tiles = parseTiles(code);
        if (tiles.size() != 1) {
            throw new IllegalArgumentException("需要恰好一张牌：" + code);
        }
        return tiles.get(0);
    }

    private static Tile toTile(int digit, char suitCode, String notation) {
        switch (suitCode) {
            case 'm':
                return numberTile(Suit.MANZU, digit);
            case 'p':
                return numberTile(Suit.PINZU, digit);
            case 's':
                return numberTile(Suit.SOUZU, digit);
            case 'z':
                if (digit >= 1 && digit <= 4) {
                    return new Tile(Suit.WIND, digit);
                }
                if (digit >= 5 && digit <= 7) {
                    return new Tile(Suit.DRAGON, digit - 4);
                }
                throw new IllegalArgumentException("字牌只能是 1z～7z：" + notation);
            default:
                throw new IllegalArgumentException("未知花色 '" + suitCode + "'：" + notation);
        }
    }

    private static Tile numberTile(Suit suit, int digit) {
        return digit == 0 ? new Tile(suit, 5, true) : new Tile(suit, digit);
    }
}
