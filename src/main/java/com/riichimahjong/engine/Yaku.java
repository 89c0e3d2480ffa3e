package com.riichimahjong.engine;

/**
 * 役（含役满与宝牌）。
 * <p>
 * closedHan / openHan 为门前 / 副露时的番数，openHan 为 0 表示只能门前成立（副露减一番的役在这里直接写出）。
 * yakumanMultiple 大于 0 的为役满，2 为双倍役满。
 */
public enum Yaku {
    // 1 番
    RIICHI("立直", 1, 0),
    IPPATSU("一发", 1, 0),
    MENZEN_TSUMO("门前清自摸和", 1, 0),
    PINFU("平和", 1, 0),
    IIPEIKOU("一杯口", 1, 0),
    HAITEI("海底摸月", 1, 1),
    HOUTEI("河底捞鱼", 1, 1),
    RINSHAN_KAIHOU("岭上开花", 1, 1),
    CHANKAN("抢杠", 1, 1),
    TANYAO("断幺九", 1, 1),
    YAKUHAI_HAKU("役牌 白", 1, 1),
    YAKUHAI_HATSU("役牌 发", 1, 1),
    YAKUHAI_CHUN("役牌 中", 1, 1),
    YAKUHAI_SEAT_WIND("役牌 自风", 1, 1),
    YAKUHAI_ROUND_WIND("役牌 场风", 1, 1),

    // 2 番
    DOUBLE_RIICHI("两立直", 2, 0),
    CHIITOITSU("七对子", 2, 0),
    SANSHOKU_DOUJUN("三色同顺", 2, 1),
    ITTSU("一气通贯", 2, 1),
    CHANTA("混全带幺九", 2, 1),
    TOITOI("对对和", 2, 2),
    SANANKOU("三暗刻", 2, 2),
    SANSHOKU_DOUKOU("三色同刻", 2, 2),
    SANKANTSU("三杠子", 2, 2),
    SHOUSANGEN("小三元", 2, 2),
    HONROUTOU("混老头", 2, 2),

    // 3 番
    RYANPEIKOU("二杯口", 3, 0),
    JUNCHAN("纯全带幺九", 3, 2),
    HONITSU("混一色", 3, 2),

    // 6 番
    CHINITSU("清一色", 6, 5),

    // 役满
    TENHOU("天和", 1),
    CHIIHOU("地和", 1),
    RENHOU("人和", 1),
    KOKUSHI_MUSOU("国士无双", 1),
    KOKUSHI_MUSOU_13("国士无双十三面", 2),
    SUUANKOU("四暗刻", 1),
    SUUANKOU_TANKI("四暗刻单骑", 2),
    DAISANGEN("大三元", 1),
    SHOUSUUSHII("小四喜", 1),
    DAISUUSHII("大四喜", 1),
    TSUUIISOU("字一色", 1),
    CHINROUTOU("清老头", 1),
    RYUUIISOU("绿一色", 1),
    CHUUREN_POUTOU("九莲宝灯", 1),
    JUNSEI_CHUUREN_POUTOU("纯正九莲宝灯", 2),
    SUUKANTSU("四杠子", 1),

    // 宝牌（不算役）
    DORA("宝牌", 1, 1),
    AKA_DORA("赤宝牌", 1, 1),
    URA_DORA("里宝牌", 1, 1);

    private final String displayName;
    private final int closedHan;
    private final int openHan;
    private final int yakumanMultiple;

    Yaku(String displayName, int closedHan, int openHan) {
        this.displayName = displayName;
        this.closedHan = closedHan;
        this.openHan = openHan;
        this.yakumanMultiple = 0;
    }

    Yaku(String displayName, int yakumanMultiple) {
        this.displayName = displayName;
        this.closedHan = 13;
        this.openHan = 13;
        this.yakumanMultiple = yakumanMultiple;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 按门前/副露取番数，0 表示该状态下不成立
     */
    public int getHan(boolean closedHand) {
        return closedHand ? closedHan : openHan;
    }

    public boolean isYakuman() {
        return yakumanMultiple > 0;
    }

    public int getYakumanMultiple() {
        return yakumanMultiple;
    }
}
