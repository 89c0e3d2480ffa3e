package com.riichimahjong.engine;

import com.riichimahjong.model.Tile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 拆解出的一组牌（顺子 / 刻子 / 杠子 / 对子）。
 * <p>
 * {@code concealed} 表示该组不是明副露。荣和完成的刻子是否算暗刻取决于和牌方式，
 * 见 {@link Decomposition#countsAsConcealed(Group, boolean)}。
 */
public final class Group {
    private final GroupType type;
    private final Tile first;        // 最小的一张（种类，不含赤牌标记）
    private final boolean concealed;
    private final boolean declared;  // 是否来自副露

    public Group(GroupType type, Tile first, boolean concealed, boolean declared) {
        this.type = type;
        this.first = first.kind();
        this.concealed = concealed;
        this.declared = declared;
    }

    public static Group concealed(GroupType type, Tile first) {
        return new Group(type, first, true, false);
    }

    public GroupType getType() {
        return type;
    }

    public Tile getFirst() {
        return first;
    }

    public boolean isConcealed() {
        return concealed;
    }

    public boolean isDeclared() {
        return declared;
    }

    public boolean isRun() {
        return type == GroupType.RUN;
    }

    public boolean isPair() {
        return type == GroupType.PAIR;
    }

    public int size() {
        switch (type) {
            case PAIR:
                return 2;
            case QUAD:
                return 4;
            default:
                return 3;
        }
    }

    public List<Tile> getTiles() {
        List<Tile> tiles = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            tiles.add(type == GroupType.RUN ? new Tile(first.getSuit(), first.getRank() + i) : first);
        }
        return tiles;
    }

    public boolean contains(Tile tile) {
        if (type != GroupType.RUN) {
            return first.isSameAs(tile);
        }
        return tile.getSuit() == first.getSuit()
                && tile.getRank() >= first.getRank()
                && tile.getRank() <= first.getRank() + 2;
    }

    /**
     * 组内是否含幺九牌
     */
    public boolean hasTerminalOrHonor() {
        if (type == GroupType.RUN) {
            return first.getRank() == 1 || first.getRank() == 7;
        }
        return first.isTerminalOrHonor();
    }

    /**
     * 用于去重与排序的签名，如 "RUN:2m:c"
     */
    String signature() {
        return type + ":" + first.getCode() + ":" + (concealed ? "c" : "o") + (declared ? "d" : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Group)) {
            return false;
        }
        Group group = (Group) o;
        return concealed == group.concealed && declared == group.declared
                && type == group.type && first.equals(group.first);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, first, concealed, declared);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Tile tile : getTiles()) {
            sb.append(tile.getCode());
        }
        return sb + (concealed ? "" : "(明)");
    }
}
