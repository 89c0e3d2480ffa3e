package com.riichimahjong.engine;

import com.riichimahjong.model.Hand;
import com.riichimahjong.model.Meld;
import com.riichimahjong.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 手牌拆解器：枚举 14 张和牌的所有合法拆解（标准形 / 七对子 / 国士无双）。
 * <p>
 * 副露是固定的面子，只对门内的牌做搜索。标准形先枚举雀头，
 * 再把剩余的牌拆成顺子/刻子；搜索使用显式栈，并按“剩余牌计数”记忆结果，
 * 已知无解的剩余牌不会被重复展开。
 */
public class HandDecomposer {

    private static final Logger log = LoggerFactory.getLogger(HandDecomposer.class);

    /** 单次拆面子搜索的步数上限，超过视为异常输入 */
    static final int MAX_ITERATIONS = 20000;

    /**
     * 拆解手牌。没有任何合法拆解时抛出 INVALID_HAND_SHAPE。
     */
    public List<Decomposition> decompose(Hand hand) {
        int[] concealedCounts = validateComposition(hand);

        Set<Decomposition> results = new LinkedHashSet<>();
        decomposeStandard(hand, concealedCounts, results);

        if (hand.getMelds().isEmpty()) {
            Decomposition sevenPairs = findSevenPairs(hand, concealedCounts);
            if (sevenPairs != null) {
                results.add(sevenPairs);
            }
            Decomposition orphans = findThirteenOrphans(hand, concealedCounts);
            if (orphans != null) {
                results.add(orphans);
            }
        }

        if (results.isEmpty()) {
            throw new ScoringException(ScoringError.INVALID_HAND_SHAPE, "手牌无法组成和牌形：" + hand);
        }
        log.debug("手牌 {} 共有 {} 种拆解", hand, results.size());
        return new ArrayList<>(results);
    }

    /**
     * 检查张数约束，返回门内牌的计数数组
     */
    private int[] validateComposition(Hand hand) {
        List<Meld> melds = hand.getMelds();
        if (melds.size() > 4) {
            throw new ScoringException(ScoringError.INVALID_HAND_SHAPE, "副露不能超过 4 组");
        }

        // 杠子只占一个面子位置：门内张数 + 3 × 副露数 必须为 14
        int effective = hand.getConcealedTiles().size() + 3 * melds.size();
        if (effective != 14) {
            throw new ScoringException(ScoringError.INVALID_HAND_SHAPE,
                    "张数不对：门内 " + hand.getConcealedTiles().size() + " 张，副露 " + melds.size() + " 组");
        }

        int[] concealedCounts = TileFactory.countKinds(hand.getConcealedTiles());
        if (concealedCounts[hand.getWinningTile().getIndex()] == 0) {
            throw new ScoringException(ScoringError.INVALID_HAND_SHAPE,
                    "和了牌 " + hand.getWinningTile() + " 不在门内的牌中");
        }

        int[] allCounts = TileFactory.countKinds(hand.getAllTiles());
        for (int index = 0; index < allCounts.length; index++) {
            if (allCounts[index] > 4) {
                throw new ScoringException(ScoringError.INVALID_HAND_SHAPE,
                        "同一种牌超过 4 张：" + Tile.fromIndex(index));
            }
        }
        return concealedCounts;
    }

    // === 标准形 ===

    private void decomposeStandard(Hand hand, int[] concealedCounts, Set<Decomposition> results) {
        List<Group> meldGroups = new ArrayList<>();
        for (Meld meld : hand.getMelds()) {
            meldGroups.add(toGroup(meld));
        }

        Map<String, List<List<Group>>> memo = new HashMap<>();
        for (int index = 0; index < concealedCounts.length; index++) {
            if (concealedCounts[index] < 2) {
                continue;
            }
            int[] rest = concealedCounts.clone();
            rest[index] -= 2;
            Group pair = Group.concealed(GroupType.PAIR, Tile.fromIndex(index));

            for (List<Group> partition : partitionIntoSets(rest, memo)) {
                placeWinningTile(hand, meldGroups, partition, pair, results);
            }
        }
    }

    /**
     * 把和了牌依次放进每个可能的门内组，每种放法得到一个拆解
     */
    private void placeWinningTile(Hand hand, List<Group> meldGroups, List<Group> partition, Group pair,
                                  Set<Decomposition> results) {
        Tile winningTile = hand.getWinningTile().kind();

        List<Group> candidates = new ArrayList<>(partition);
        candidates.add(pair);

        Set<String> tried = new HashSet<>();
        for (Group group : candidates) {
            if (!group.contains(winningTile) || !tried.add(group.signature())) {
                continue;
            }
            List<Group> sets = new ArrayList<>(meldGroups);
            sets.addAll(partition);
            results.add(Decomposition.standard(sets, pair, group, winningTile,
                    classifyWait(group, winningTile), hand.getAllTiles(), hand.isConcealed()));
        }
    }

    /**
     * 把剩余的牌全部拆成面子（刻子/顺子），返回所有拆法；无解时返回空列表。
     * <p>
     * 每一步只在最小的一张牌上分支（作刻子，或作顺子起点），剩余张数严格减少，
     * 因此搜索必然终止。
     */
    private List<List<Group>> partitionIntoSets(int[] counts, Map<String, List<List<Group>>> memo) {
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(counts);
        int iterations = 0;

        while (!stack.isEmpty()) {
            if (++iterations > MAX_ITERATIONS) {
                throw new ScoringException(ScoringError.INVALID_HAND_SHAPE, "拆解搜索超过上限，放弃");
            }
            int[] current = stack.peek();
            String key = key(current);
            if (memo.containsKey(key)) {
                stack.pop();
                continue;
            }

            int lowest = lowestIndex(current);
            if (lowest < 0) {
                memo.put(key, Collections.singletonList(Collections.<Group>emptyList()));
                stack.pop();
                continue;
            }

            List<Branch> branches = branches(current, lowest);
            boolean ready = true;
            for (Branch branch : branches) {
                if (!memo.containsKey(key(branch.rest))) {
                    stack.push(branch.rest);
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }

            // 所有分支都已求解，合并结果（空列表表示该剩余牌无解）
            List<List<Group>> partitions = new ArrayList<>();
            for (Branch branch : branches) {
                for (List<Group> sub : memo.get(key(branch.rest))) {
                    List<Group> partition = new ArrayList<>(sub.size() + 1);
                    partition.add(branch.group);
                    partition.addAll(sub);
                    partitions.add(partition);
                }
            }
            memo.put(key, partitions);
            stack.pop();
        }
        return memo.get(key(counts));
    }

    private List<Branch> branches(int[] counts, int index) {
        List<Branch> branches = new ArrayList<>(2);
        Tile tile = Tile.fromIndex(index);

        // 刻子 AAA
        if (counts[index] >= 3) {
            int[] rest = counts.clone();
            rest[index] -= 3;
            branches.add(new Branch(Group.concealed(GroupType.TRIPLET, tile), rest));
        }

        // 顺子 ABC（只有数牌，且起点 ≤ 7）
        if (tile.isNumber() && tile.getRank() <= 7 && counts[index + 1] > 0 && counts[index + 2] > 0) {
            int[] rest = counts.clone();
            rest[index]--;
            rest[index + 1]--;
            rest[index + 2]--;
            branches.add(new Branch(Group.concealed(GroupType.RUN, tile), rest));
        }
        return branches;
    }

    // === 七对子 / 国士无双 ===

    /**
     * 七对子：七种不同的对子，四张同种牌不算两对
     */
    private Decomposition findSevenPairs(Hand hand, int[] counts) {
        List<Group> pairs = new ArrayList<>(7);
        for (int index = 0; index < counts.length; index++) {
            if (counts[index] == 0) {
                continue;
            }
            if (counts[index] != 2) {
                return null;
            }
            pairs.add(Group.concealed(GroupType.PAIR, Tile.fromIndex(index)));
        }
        if (pairs.size() != 7) {
            return null;
        }
        return Decomposition.sevenPairs(pairs, hand.getWinningTile(), hand.getAllTiles());
    }

    /**
     * 国士无双：13 种幺九牌各至少一张，其中一种成对
     */
    private Decomposition findThirteenOrphans(Hand hand, int[] counts) {
        int[] remaining = counts.clone();
        Tile duplicate = null;
        for (Tile orphan : TileFactory.terminalsAndHonors()) {
            int count = remaining[orphan.getIndex()];
            if (count == 0 || count > 2) {
                return null;
            }
            if (count == 2) {
                if (duplicate != null) {
                    return null;
                }
                duplicate = orphan;
            }
            remaining[orphan.getIndex()] = 0;
        }
        if (duplicate == null || lowestIndex(remaining) >= 0) {
            return null;
        }
        return Decomposition.thirteenOrphans(duplicate, hand.getWinningTile(), hand.getAllTiles());
    }

    // === 工具方法 ===

    /**
     * 和了牌所在组的听牌形
     */
    static WaitShape classifyWait(Group group, Tile winningTile) {
        switch (group.getType()) {
            case PAIR:
                return WaitShape.TANKI;
            case RUN:
                int offset = winningTile.getRank() - group.getFirst().getRank();
                if (offset == 1) {
                    return WaitShape.KANCHAN;
                }
                if (offset == 0) {
                    // 789 和 7 为边张
                    return group.getFirst().getRank() == 7 ? WaitShape.PENCHAN : WaitShape.RYANMEN;
                }
                // 123 和 3 为边张
                return group.getFirst().getRank() == 1 ? WaitShape.PENCHAN : WaitShape.RYANMEN;
            default:
                return WaitShape.SHANPON;
        }
    }

    private static Group toGroup(Meld meld) {
        GroupType type;
        switch (meld.getType()) {
            case CHI:
                type = GroupType.RUN;
                break;
            case PON:
                type = GroupType.TRIPLET;
                break;
            default:
                type = GroupType.QUAD;
                break;
        }
        return new Group(type, meld.getFirst(), !meld.isOpen(), true);
    }

    private static int lowestIndex(int[] counts) {
        for (int index = 0; index < counts.length; index++) {
            if (counts[index] > 0) {
                return index;
            }
        }
        return -1;
    }

    private static String key(int[] counts) {
        return Arrays.toString(counts);
    }

    /**
     * 一个分支：取出的面子 + 剩余牌
     */
    private static final class Branch {
        private final Group group;
        private final int[] rest;

        private Branch(Group group, int[] rest) {
            this.group = group;
            this.rest = rest;
        }
    }
}
