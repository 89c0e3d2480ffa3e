package com.riichimahjong.engine;

import com.riichimahjong.model.Tile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 手牌的一种拆解方式。
 * <p>
 * 三种和牌形互斥，由 {@link #getShape()} 区分，各自只使用对应的字段：
 * <ul>
 *   <li>STANDARD：{@link #getSets()} 四个面子 + {@link #getPair()} 雀头</li>
 *   <li>SEVEN_PAIRS：{@link #getPairs()} 七个对子</li>
 *   <li>THIRTEEN_ORPHANS：{@link #getOrphanDuplicate()} 重复的那一种幺九牌</li>
 * </ul>
 * 和了牌放在不同组里会得到不同的听牌形，每种放法都是单独的一个拆解。
 */
public final class Decomposition {

    private final DecompositionShape shape;
    private final List<Group> sets;
    private final Group pair;
    private final List<Group> pairs;
    private final Tile orphanDuplicate;
    private final Group winningGroup;
    private final Tile winningTile;
    private final WaitShape wait;
    private final List<Tile> tiles;
    private final boolean closedHand;

    private Decomposition(DecompositionShape shape, List<Group> sets, Group pair, List<Group> pairs,
                          Tile orphanDuplicate, Group winningGroup, Tile winningTile, WaitShape wait,
                          List<Tile> tiles, boolean closedHand) {
        this.shape = shape;
        this.sets = sets;
        this.pair = pair;
        this.pairs = pairs;
        this.orphanDuplicate = orphanDuplicate;
        this.winningGroup = winningGroup;
        this.winningTile = winningTile.kind();
        this.wait = wait;
        this.tiles = Collections.unmodifiableList(new ArrayList<>(tiles));
        this.closedHand = closedHand;
    }

    public static Decomposition standard(List<Group> sets, Group pair, Group winningGroup, Tile winningTile,
                                         WaitShape wait, List<Tile> tiles, boolean closedHand) {
        if (sets.size() != 4 || !pair.isPair()) {
            throw new IllegalArgumentException("标准形需要四个面子和一个雀头");
        }
        List<Group> sortedSets = new ArrayList<>(sets);
        sortedSets.sort((a, b) -> a.signature().compareTo(b.signature()));
        return new Decomposition(DecompositionShape.STANDARD, Collections.unmodifiableList(sortedSets), pair,
                Collections.<Group>emptyList(), null, winningGroup, winningTile, wait, tiles, closedHand);
    }

    public static Decomposition sevenPairs(List<Group> pairs, Tile winningTile, List<Tile> tiles) {
        if (pairs.size() != 7) {
            throw new IllegalArgumentException("七对子需要七个对子");
        }
        Group winningPair = null;
        for (Group p : pairs) {
            if (p.contains(winningTile)) {
                winningPair = p;
            }
        }
        return new Decomposition(DecompositionShape.SEVEN_PAIRS, Collections.<Group>emptyList(), null,
                Collections.unmodifiableList(new ArrayList<>(pairs)), null, winningPair, winningTile,
                WaitShape.TANKI, tiles, true);
    }

    public static Decomposition thirteenOrphans(Tile duplicate, Tile winningTile, List<Tile> tiles) {
        WaitShape wait = duplicate.isSameAs(winningTile) ? WaitShape.KOKUSHI_THIRTEEN : WaitShape.KOKUSHI_SINGLE;
        return new Decomposition(DecompositionShape.THIRTEEN_ORPHANS, Collections.<Group>emptyList(), null,
                Collections.<Group>emptyList(), duplicate.kind(), null, winningTile, wait, tiles, true);
    }

    public DecompositionShape getShape() {
        return shape;
    }

    public boolean isStandard() {
        return shape == DecompositionShape.STANDARD;
    }

    /**
     * 标准形的四个面子（含副露）
     */
    public List<Group> getSets() {
        return sets;
    }

    /**
     * 标准形的雀头
     */
    public Group getPair() {
        return pair;
    }

    /**
     * 七对子的七个对子
     */
    public List<Group> getPairs() {
        return pairs;
    }

    public Tile getOrphanDuplicate() {
        return orphanDuplicate;
    }

    /**
     * 所有组：标准形为面子 + 雀头，七对子为七个对子，国士无双为空
     */
    public List<Group> getGroups() {
        switch (shape) {
            case STANDARD:
                List<Group> groups = new ArrayList<>(sets);
                groups.add(pair);
                return groups;
            case SEVEN_PAIRS:
                return pairs;
            default:
                return Collections.emptyList();
        }
    }

    public Group getWinningGroup() {
        return winningGroup;
    }

    public Tile getWinningTile() {
        return winningTile;
    }

    public WaitShape getWait() {
        return wait;
    }

    /**
     * 手中全部的牌（保留赤牌标记，杠子计 4 张）
     */
    public List<Tile> getTiles() {
        return tiles;
    }

    /**
     * 门前清（无明副露）
     */
    public boolean isClosedHand() {
        return closedHand;
    }

    /**
     * 该组是否按暗刻/暗杠计算：荣和时由和了牌完成的刻子算明刻
     */
    public boolean countsAsConcealed(Group group, boolean ron) {
        if (!group.isConcealed()) {
            return false;
        }
        return !(ron && group == winningGroup && group.getType() == GroupType.TRIPLET);
    }

    String signature() {
        StringBuilder sb = new StringBuilder(shape.name()).append('|');
        switch (shape) {
            case STANDARD:
                for (Group set : sets) {
                    sb.append(set.signature()).append(',');
                }
                sb.append(pair.signature());
                break;
            case SEVEN_PAIRS:
                for (Group p : pairs) {
                    sb.append(p.signature()).append(',');
                }
                break;
            default:
                sb.append(orphanDuplicate.getCode());
                break;
        }
        sb.append('|').append(wait);
        if (winningGroup != null) {
            sb.append('|').append(winningGroup.signature());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Decomposition)) {
            return false;
        }
        return signature().equals(((Decomposition) o).signature());
    }

    @Override
    public int hashCode() {
        return signature().hashCode();
    }

    @Override
    public String toString() {
        switch (shape) {
            case STANDARD:
                return sets + " + " + pair + " [" + wait + "]";
            case SEVEN_PAIRS:
                return "七对子" + pairs;
            default:
                return "国士无双(" + orphanDuplicate.getCode() + ") [" + wait + "]";
        }
    }
}
